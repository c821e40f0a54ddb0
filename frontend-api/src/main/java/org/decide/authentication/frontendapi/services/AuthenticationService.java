package org.decide.authentication.frontendapi.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.frontendapi.entity.LoginResponse;
import org.decide.authentication.shared.entity.AuthFailure;
import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.entity.LoginAction;
import org.decide.authentication.shared.entity.LoginState;
import org.decide.authentication.shared.entity.Result;
import org.decide.authentication.shared.entity.Token;
import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.entity.UserProfile;
import org.decide.authentication.shared.exceptions.StorageException;
import org.decide.authentication.shared.helpers.Argon2PasswordHelper;
import org.decide.authentication.shared.services.AuthAppCodeService;
import org.decide.authentication.shared.services.CodeStorageService;
import org.decide.authentication.shared.services.ConfigurationService;
import org.decide.authentication.shared.services.KeyValueStore;
import org.decide.authentication.shared.services.KeyValueTokenStore;
import org.decide.authentication.shared.services.LockoutGuard;
import org.decide.authentication.shared.services.TokenStore;
import org.decide.authentication.shared.services.UserStore;
import org.decide.authentication.shared.state.StateMachine;

import java.util.Optional;

import static org.decide.authentication.shared.entity.LoginAction.USER_ACCOUNT_IS_BLOCKED;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_INVALID_CREDENTIALS;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_INVALID_MFA_CODE;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_VALID_CREDENTIALS;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_VALID_MFA_CODE;
import static org.decide.authentication.shared.entity.LoginAction.USER_HAS_STARTED_A_NEW_ATTEMPT;
import static org.decide.authentication.shared.entity.LoginState.AWAITING_CREDENTIALS;
import static org.decide.authentication.shared.entity.LoginState.AWAITING_MFA_CODE;
import static org.decide.authentication.shared.entity.LoginState.INVALID_CODE;
import static org.decide.authentication.shared.helpers.LogLineHelper.attachOperationToLogs;
import static org.decide.authentication.shared.helpers.LogLineHelper.attachUserIdToLogs;
import static org.decide.authentication.shared.services.CodeStorageService.CODE_BLOCKED_KEY_PREFIX;

public class AuthenticationService {

    private static final Logger LOG = LogManager.getLogger(AuthenticationService.class);

    private final UserStore userStore;
    private final TokenStore tokenStore;
    private final CodeStorageService codeStorageService;
    private final LockoutGuard lockoutGuard;
    private final AuthAppCodeService authAppCodeService;
    private final ConfigurationService configurationService;
    private final StateMachine<LoginState, LoginAction, User> stateMachine =
            StateMachine.loginStateMachine();

    public AuthenticationService(
            UserStore userStore,
            TokenStore tokenStore,
            CodeStorageService codeStorageService,
            LockoutGuard lockoutGuard,
            AuthAppCodeService authAppCodeService,
            ConfigurationService configurationService) {
        this.userStore = userStore;
        this.tokenStore = tokenStore;
        this.codeStorageService = codeStorageService;
        this.lockoutGuard = lockoutGuard;
        this.authAppCodeService = authAppCodeService;
        this.configurationService = configurationService;
    }

    public AuthenticationService(
            ConfigurationService configurationService,
            UserStore userStore,
            KeyValueStore keyValueStore) {
        this(
                configurationService,
                userStore,
                keyValueStore,
                new CodeStorageService(keyValueStore));
    }

    private AuthenticationService(
            ConfigurationService configurationService,
            UserStore userStore,
            KeyValueStore keyValueStore,
            CodeStorageService codeStorageService) {
        this(
                userStore,
                new KeyValueTokenStore(keyValueStore),
                codeStorageService,
                new LockoutGuard(
                        codeStorageService,
                        userStore,
                        configurationService.getMaxFailedLoginAttempts()),
                new AuthAppCodeService(configurationService),
                configurationService);
    }

    public Result<AuthFailure, LoginResponse> login(String username, String password) {
        attachOperationToLogs("login");
        if (isBlank(username) || isBlank(password)) {
            LOG.info("Login request is missing credentials");
            return failure(ErrorResponse.REQUEST_MISSING_PARAMS);
        }
        try {
            Optional<User> user = userStore.findByUsername(username);
            boolean passwordMatches =
                    Argon2PasswordHelper.matches(password, user.map(User::getPassword));
            Optional<LoginState> pendingChallenge =
                    user.flatMap(u -> codeStorageService.getMfaChallengeState(u.getId()));
            LoginState from = pendingChallenge.map(this::restart).orElse(AWAITING_CREDENTIALS);

            if (!passwordMatches) {
                var nextState = stateMachine.transition(from, USER_ENTERED_INVALID_CREDENTIALS);
                lockoutGuard.recordFailure(username);
                return failure(errorFor(nextState));
            }

            var userProfile = user.get();
            attachUserIdToLogs(userProfile.getId());
            var action =
                    userProfile.isBlocked()
                            ? USER_ACCOUNT_IS_BLOCKED
                            : USER_ENTERED_VALID_CREDENTIALS;
            var nextState = stateMachine.transition(from, action, userProfile);
            switch (nextState) {
                case AWAITING_MFA_CODE:
                    codeStorageService.saveMfaChallenge(
                            userProfile.getId(),
                            AWAITING_MFA_CODE,
                            configurationService.getMfaChallengeExpiry());
                    return Result.success(LoginResponse.pendingTwoFactor(userProfile.getId()));
                case AUTHENTICATED:
                    if (pendingChallenge.isPresent()) {
                        codeStorageService.deleteMfaChallenge(userProfile.getId());
                    }
                    lockoutGuard.recordSuccess(username);
                    var token = startSession(userProfile);
                    return Result.success(
                            LoginResponse.authenticated(token.key(), userProfile.getId()));
                default:
                    return failure(errorFor(nextState));
            }
        } catch (StorageException e) {
            return storageFailure("login", e);
        }
    }

    /**
     * Resumes the login from the state kept with the pending challenge. The challenge survives
     * wrong codes until it expires, is used, or too many wrong codes block further attempts.
     */
    public Result<AuthFailure, LoginResponse> verifyTwoFactor(long userId, String code) {
        attachOperationToLogs("verify-two-factor");
        attachUserIdToLogs(userId);
        String accountKey = String.valueOf(userId);
        try {
            if (codeStorageService.isBlockedForAccount(accountKey, CODE_BLOCKED_KEY_PREFIX)) {
                LOG.info("Auth app codes are blocked for user");
                return failure(ErrorResponse.TOO_MANY_INVALID_AUTH_APP_CODES);
            }
            Optional<LoginState> challengeState = codeStorageService.getMfaChallengeState(userId);
            if (challengeState.isEmpty()) {
                return failure(ErrorResponse.NO_PENDING_MFA_CHALLENGE);
            }

            Optional<User> user = userStore.findById(userId).filter(User::hasVerifiedAuthApp);
            if (user.isEmpty()) {
                LOG.warn("Discarding challenge for user without a verified auth app");
                codeStorageService.deleteMfaChallenge(userId);
                return failure(ErrorResponse.NO_PENDING_MFA_CHALLENGE);
            }
            var userProfile = user.get();

            var action = assessCode(userProfile, code, accountKey);
            var nextState = stateMachine.transition(challengeState.get(), action);
            switch (nextState) {
                case AUTHENTICATED:
                    return completeTwoFactor(userProfile, accountKey);
                case INVALID_CODE:
                    codeStorageService.updateMfaChallengeState(userId, INVALID_CODE);
                    return failure(errorFor(nextState));
                case ACCOUNT_LOCKED:
                    codeStorageService.deleteMfaChallenge(userId);
                    if (action == USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES) {
                        blockAuthAppCodes(accountKey);
                        return failure(ErrorResponse.INVALID_AUTH_APP_CODE);
                    }
                    return failure(errorFor(nextState));
                default:
                    throw new IllegalStateException("Unexpected login state " + nextState);
            }
        } catch (StorageException e) {
            return storageFailure("verify two factor", e);
        }
    }

    public Result<AuthFailure, UserProfile> getUser(String token) {
        attachOperationToLogs("get-user");
        try {
            Optional<Token> storedToken = tokenStore.find(token);
            if (storedToken.isEmpty()) {
                return failure(ErrorResponse.TOKEN_NOT_FOUND);
            }
            Optional<User> user = userStore.findById(storedToken.get().userId());
            if (user.isEmpty()) {
                LOG.warn("Purging token whose user no longer exists");
                tokenStore.delete(token);
                return failure(ErrorResponse.TOKEN_NOT_FOUND);
            }
            attachUserIdToLogs(user.get().getId());
            return Result.success(user.get().toProfile());
        } catch (StorageException e) {
            return storageFailure("get user", e);
        }
    }

    public Result<AuthFailure, Void> logout(String token) {
        attachOperationToLogs("logout");
        try {
            tokenStore.delete(token);
            return Result.success(null);
        } catch (StorageException e) {
            return storageFailure("logout", e);
        }
    }

    /** Issues a token for an already authenticated user. */
    public Token startSession(User user) {
        var token = tokenStore.create(user.getId());
        LOG.info("Session started");
        return token;
    }

    private LoginState restart(LoginState pendingChallenge) {
        return stateMachine.transition(pendingChallenge, USER_HAS_STARTED_A_NEW_ATTEMPT);
    }

    private LoginAction assessCode(User user, String code, String accountKey) {
        if (user.isBlocked()) {
            return USER_ACCOUNT_IS_BLOCKED;
        }
        if (authAppCodeService.isCodeValid(user.getAuthAppSecret().get(), code)) {
            return USER_ENTERED_VALID_MFA_CODE;
        }
        long count = codeStorageService.increaseIncorrectMfaCodeAttemptsCount(accountKey);
        return count >= configurationService.getMaxFailedMfaAttempts()
                ? USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES
                : USER_ENTERED_INVALID_MFA_CODE;
    }

    private Result<AuthFailure, LoginResponse> completeTwoFactor(User user, String accountKey) {
        if (!codeStorageService.consumeMfaChallenge(user.getId())) {
            LOG.info("Challenge was consumed by a concurrent request");
            return failure(ErrorResponse.NO_PENDING_MFA_CHALLENGE);
        }
        codeStorageService.deleteIncorrectMfaCodeAttemptsCount(accountKey);
        lockoutGuard.recordSuccess(user.getUsername());

        var token = startSession(user);
        return Result.success(LoginResponse.authenticated(token.key(), user.getId()));
    }

    private void blockAuthAppCodes(String accountKey) {
        LOG.info("Too many invalid auth app codes, blocking further codes");
        codeStorageService.deleteIncorrectMfaCodeAttemptsCount(accountKey);
        codeStorageService.saveBlockedForAccount(
                accountKey, CODE_BLOCKED_KEY_PREFIX, configurationService.getMfaLockoutDuration());
    }

    private static ErrorResponse errorFor(LoginState state) {
        switch (state) {
            case INVALID_CREDENTIALS:
                return ErrorResponse.INVALID_LOGIN_CREDS;
            case INVALID_CODE:
                return ErrorResponse.INVALID_AUTH_APP_CODE;
            case ACCOUNT_LOCKED:
                return ErrorResponse.ACCOUNT_LOCKED_FROM_SIGN_IN;
            default:
                throw new IllegalStateException("No error for login state " + state);
        }
    }

    private static <T> Result<AuthFailure, T> failure(ErrorResponse errorResponse) {
        return Result.failure(AuthFailure.of(errorResponse));
    }

    private static <T> Result<AuthFailure, T> storageFailure(
            String operation, StorageException e) {
        LOG.error("Storage unavailable during {}", operation, e);
        return Result.failure(AuthFailure.storageUnavailable());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
