package org.decide.authentication.frontendapi.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.entity.AuthFailure;
import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.entity.Result;
import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.NotificationException;
import org.decide.authentication.shared.exceptions.StorageException;
import org.decide.authentication.shared.helpers.Argon2PasswordHelper;
import org.decide.authentication.shared.helpers.ConstructUriHelper;
import org.decide.authentication.shared.helpers.IdGenerator;
import org.decide.authentication.shared.helpers.ValidationHelper;
import org.decide.authentication.shared.services.CodeStorageService;
import org.decide.authentication.shared.services.ConfigurationService;
import org.decide.authentication.shared.services.Notifier;
import org.decide.authentication.shared.services.UserStore;
import org.decide.authentication.shared.validation.PasswordValidator;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static org.decide.authentication.shared.helpers.LogLineHelper.attachOperationToLogs;
import static org.decide.authentication.shared.helpers.LogLineHelper.attachUserIdToLogs;

public class PasswordResetService {

    private static final Logger LOG = LogManager.getLogger(PasswordResetService.class);

    static final String EMAIL_BODY_TEMPLATE =
            "Alguien solicitó restablecer la contraseña del correo electrónico %s.\n"
                    + "Haz click en el siguiente link:\n"
                    + "%s\n"
                    + "Tu nombre de usuario, en caso de que lo hayas olvidado: %s";

    private final UserStore userStore;
    private final CodeStorageService codeStorageService;
    private final Notifier notifier;
    private final PasswordValidator passwordValidator;
    private final ConfigurationService configurationService;

    public PasswordResetService(
            UserStore userStore,
            CodeStorageService codeStorageService,
            Notifier notifier,
            PasswordValidator passwordValidator,
            ConfigurationService configurationService) {
        this.userStore = userStore;
        this.codeStorageService = codeStorageService;
        this.notifier = notifier;
        this.passwordValidator = passwordValidator;
        this.configurationService = configurationService;
    }

    /** Emails a single-use reset link. An address with no account succeeds without sending. */
    public Result<AuthFailure, Void> requestReset(String email) {
        attachOperationToLogs("request-password-reset");
        Optional<ErrorResponse> emailError = ValidationHelper.validateEmailAddress(email);
        if (emailError.isPresent()) {
            return Result.failure(AuthFailure.validation(List.of(emailError.get())));
        }
        try {
            Optional<User> user = userStore.findByEmail(email);
            if (user.isEmpty()) {
                LOG.info("No account for password reset request");
                return Result.success(null);
            }
            long userId = user.get().getId();
            attachUserIdToLogs(userId);

            String code = IdGenerator.generateHex();
            codeStorageService.saveResetPasswordCode(
                    userId, code, configurationService.getResetPasswordCodeExpiry());

            String domain = configurationService.getResetPasswordDomain();
            String resetLink = buildResetLink(domain, encodeUid(userId), code);
            String body =
                    format(EMAIL_BODY_TEMPLATE, email, resetLink, user.get().getUsername());
            try {
                notifier.send(email, "Password reset on " + domain, body, toHtml(body));
            } catch (NotificationException e) {
                LOG.error("Unable to send password reset email", e);
                codeStorageService.popResetPasswordCode(userId);
                return Result.failure(AuthFailure.of(ErrorResponse.NOTIFICATION_FAILURE));
            }
            LOG.info("Password reset email sent");
            return Result.success(null);
        } catch (StorageException e) {
            LOG.error("Storage unavailable during password reset request", e);
            return Result.failure(AuthFailure.storageUnavailable());
        }
    }

    /**
     * Sets a new password from a reset link. The code is only used up once the new password has
     * passed validation, so a rejected password leaves the link usable.
     */
    public Result<AuthFailure, Void> confirmReset(
            String uidb64, String token, String newPassword, String confirmation) {
        attachOperationToLogs("confirm-password-reset");
        Optional<Long> userId = decodeUid(uidb64);
        if (userId.isEmpty() || token == null) {
            return invalidLink();
        }
        try {
            attachUserIdToLogs(userId.get());
            if (userStore.findById(userId.get()).isEmpty()
                    || !codeStorageService
                            .getResetPasswordCode(userId.get())
                            .filter(code -> codesMatch(code, token))
                            .isPresent()) {
                return invalidLink();
            }

            List<ErrorResponse> errors = new ArrayList<>(passwordValidator.validate(newPassword));
            if (newPassword != null && !newPassword.equals(confirmation)) {
                errors.add(ErrorResponse.PASSWORDS_DO_NOT_MATCH);
            }
            if (!errors.isEmpty()) {
                return Result.failure(AuthFailure.validation(errors));
            }

            if (!codeStorageService
                    .popResetPasswordCode(userId.get())
                    .filter(code -> codesMatch(code, token))
                    .isPresent()) {
                LOG.info("Reset code was used by a concurrent request");
                return invalidLink();
            }
            String hash = Argon2PasswordHelper.hashPassword(newPassword);
            if (userStore.update(userId.get(), u -> u.withPassword(hash)).isEmpty()) {
                return invalidLink();
            }
            LOG.info("Password reset completed");
            return Result.success(null);
        } catch (StorageException e) {
            LOG.error("Storage unavailable during password reset", e);
            return Result.failure(AuthFailure.storageUnavailable());
        }
    }

    static String encodeUid(long userId) {
        return Base64.getUrlEncoder()
                .withoutPadding()
                .encodeToString(String.valueOf(userId).getBytes(StandardCharsets.UTF_8));
    }

    static Optional<Long> decodeUid(String uidb64) {
        if (uidb64 == null || uidb64.isBlank()) {
            return Optional.empty();
        }
        try {
            String decoded =
                    new String(Base64.getUrlDecoder().decode(uidb64), StandardCharsets.UTF_8);
            return Optional.of(Long.parseLong(decoded));
        } catch (IllegalArgumentException e) {
            LOG.info("Reset link carries a malformed uid");
            return Optional.empty();
        }
    }

    private String buildResetLink(String domain, String uidb64, String code) {
        String path =
                configurationService
                        .getResetPasswordPath()
                        .replace("{uidb64}", uidb64)
                        .replace("{token}", code);
        return ConstructUriHelper.buildURI(
                        configurationService.getResetPasswordProtocol(), domain, path)
                .toString();
    }

    private static String toHtml(String body) {
        String escaped =
                body.replace("&", "&amp;")
                        .replace("<", "&lt;")
                        .replace(">", "&gt;")
                        .replace("\"", "&quot;");
        return "<p>" + escaped.replace("\n", "<br>\n") + "</p>";
    }

    private static boolean codesMatch(String stored, String submitted) {
        return MessageDigest.isEqual(
                stored.getBytes(StandardCharsets.UTF_8),
                submitted.getBytes(StandardCharsets.UTF_8));
    }

    private static <T> Result<AuthFailure, T> invalidLink() {
        return Result.failure(AuthFailure.of(ErrorResponse.INVALID_RESET_PASSWORD_LINK));
    }
}
