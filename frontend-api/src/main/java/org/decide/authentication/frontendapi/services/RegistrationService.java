package org.decide.authentication.frontendapi.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.frontendapi.entity.LoginResponse;
import org.decide.authentication.frontendapi.entity.RegistrationResponse;
import org.decide.authentication.shared.entity.AuthFailure;
import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.entity.Result;
import org.decide.authentication.shared.entity.Token;
import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.StorageException;
import org.decide.authentication.shared.exceptions.UserAlreadyExistsException;
import org.decide.authentication.shared.helpers.Argon2PasswordHelper;
import org.decide.authentication.shared.helpers.NowHelper;
import org.decide.authentication.shared.helpers.ValidationHelper;
import org.decide.authentication.shared.services.TokenStore;
import org.decide.authentication.shared.services.UserStore;
import org.decide.authentication.shared.validation.PasswordValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.decide.authentication.shared.helpers.LogLineHelper.attachOperationToLogs;
import static org.decide.authentication.shared.helpers.LogLineHelper.attachUserIdToLogs;

public class RegistrationService {

    private static final Logger LOG = LogManager.getLogger(RegistrationService.class);

    private final UserStore userStore;
    private final TokenStore tokenStore;
    private final AuthenticationService authenticationService;
    private final PasswordValidator passwordValidator;

    public RegistrationService(
            UserStore userStore,
            TokenStore tokenStore,
            AuthenticationService authenticationService,
            PasswordValidator passwordValidator) {
        this.userStore = userStore;
        this.tokenStore = tokenStore;
        this.authenticationService = authenticationService;
        this.passwordValidator = passwordValidator;
    }

    /**
     * Creates an account on behalf of a superuser. The caller's privileges are checked before the
     * request body, and no password policy applies.
     */
    public Result<AuthFailure, RegistrationResponse> registerPrivileged(
            String adminToken, String username, String password) {
        attachOperationToLogs("register-privileged");
        try {
            Optional<User> admin =
                    tokenStore.find(adminToken).flatMap(t -> userStore.findById(t.userId()));
            if (admin.isEmpty()) {
                return failure(ErrorResponse.TOKEN_NOT_FOUND);
            }
            if (!admin.get().isSuperuser()) {
                LOG.info("User {} is not allowed to register accounts", admin.get().getId());
                return failure(ErrorResponse.INSUFFICIENT_PRIVILEGES);
            }
            if (isBlank(username) || isBlank(password)) {
                return failure(ErrorResponse.REQUEST_MISSING_PARAMS);
            }

            User user;
            try {
                user = userStore.create(newUser(username, null, password));
            } catch (UserAlreadyExistsException e) {
                LOG.info("Registration rejected, {} is taken", e.getField());
                return failure(ErrorResponse.USERNAME_ALREADY_EXISTS);
            }
            attachUserIdToLogs(user.getId());
            LOG.info("Registered user");

            Token token = authenticationService.startSession(user);
            return Result.success(new RegistrationResponse(user.getId(), token.key()));
        } catch (StorageException e) {
            LOG.error("Storage unavailable during privileged registration", e);
            return Result.failure(AuthFailure.storageUnavailable());
        }
    }

    /** Email sign up. The email doubles as the username and a session starts straight away. */
    public Result<AuthFailure, LoginResponse> registerSelfService(
            String email, String password, String passwordConfirmation) {
        attachOperationToLogs("register-self-service");
        try {
            List<ErrorResponse> errors = new ArrayList<>();
            Optional<ErrorResponse> emailError = ValidationHelper.validateEmailAddress(email);
            emailError.ifPresent(errors::add);
            errors.addAll(passwordValidator.validate(password));
            if (!isBlank(password) && !password.equals(passwordConfirmation)) {
                errors.add(ErrorResponse.PASSWORDS_DO_NOT_MATCH);
            }
            if (emailError.isEmpty() && isTaken(email)) {
                errors.add(ErrorResponse.EMAIL_ADDRESS_ALREADY_EXISTS);
            }
            if (!errors.isEmpty()) {
                LOG.info("Sign up failed validation with {} errors", errors.size());
                return Result.failure(AuthFailure.validation(errors));
            }

            User user;
            try {
                user = userStore.create(newUser(email, email, password));
            } catch (UserAlreadyExistsException e) {
                LOG.info("Sign up lost a race for {}", e.getField());
                var taken = List.of(ErrorResponse.EMAIL_ADDRESS_ALREADY_EXISTS);
                return Result.failure(AuthFailure.validation(taken));
            }
            attachUserIdToLogs(user.getId());
            LOG.info("User signed up");

            Token token = authenticationService.startSession(user);
            return Result.success(LoginResponse.authenticated(token.key(), user.getId()));
        } catch (StorageException e) {
            LOG.error("Storage unavailable during sign up", e);
            return Result.failure(AuthFailure.storageUnavailable());
        }
    }

    private boolean isTaken(String email) {
        return userStore.findByEmail(email).isPresent()
                || userStore.findByUsername(email).isPresent();
    }

    private static User newUser(String username, String email, String password) {
        return new User()
                .withUsername(username)
                .withEmail(email)
                .withPassword(Argon2PasswordHelper.hashPassword(password))
                .withCreated(NowHelper.now());
    }

    private static <T> Result<AuthFailure, T> failure(ErrorResponse errorResponse) {
        return Result.failure(AuthFailure.of(errorResponse));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
