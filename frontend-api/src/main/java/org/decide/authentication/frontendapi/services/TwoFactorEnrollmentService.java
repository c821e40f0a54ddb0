package org.decide.authentication.frontendapi.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.frontendapi.entity.EnrollmentResponse;
import org.decide.authentication.shared.entity.AuthFailure;
import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.entity.Result;
import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.StorageException;
import org.decide.authentication.shared.services.AuthAppCodeService;
import org.decide.authentication.shared.services.ConfigurationService;
import org.decide.authentication.shared.services.QrCodeRenderer;
import org.decide.authentication.shared.services.UserStore;

import java.util.Optional;

import static org.decide.authentication.shared.helpers.LogLineHelper.attachOperationToLogs;
import static org.decide.authentication.shared.helpers.LogLineHelper.attachUserIdToLogs;

public class TwoFactorEnrollmentService {

    private static final Logger LOG = LogManager.getLogger(TwoFactorEnrollmentService.class);

    private final UserStore userStore;
    private final AuthAppCodeService authAppCodeService;
    private final ConfigurationService configurationService;
    private final Optional<QrCodeRenderer> qrCodeRenderer;

    public TwoFactorEnrollmentService(
            UserStore userStore,
            AuthAppCodeService authAppCodeService,
            ConfigurationService configurationService,
            QrCodeRenderer qrCodeRenderer) {
        this.userStore = userStore;
        this.authAppCodeService = authAppCodeService;
        this.configurationService = configurationService;
        this.qrCodeRenderer = Optional.ofNullable(qrCodeRenderer);
    }

    public TwoFactorEnrollmentService(
            UserStore userStore,
            AuthAppCodeService authAppCodeService,
            ConfigurationService configurationService) {
        this(userStore, authAppCodeService, configurationService, null);
    }

    /**
     * Stores a fresh secret as pending, replacing any earlier pending one. The secret does not
     * gate sign in until {@link #confirmEnrollment(long, String)} succeeds.
     */
    public Result<AuthFailure, EnrollmentResponse> beginEnrollment(long userId) {
        attachOperationToLogs("begin-enrollment");
        attachUserIdToLogs(userId);
        try {
            Optional<User> user = userStore.findById(userId);
            if (user.isEmpty()) {
                return failure(ErrorResponse.USER_NOT_FOUND);
            }
            if (user.get().hasVerifiedAuthApp()) {
                return failure(ErrorResponse.AUTH_APP_ALREADY_EXISTS);
            }

            String secret = authAppCodeService.generateSecret();
            Optional<User> updated =
                    userStore.update(
                            userId,
                            u ->
                                    u.hasVerifiedAuthApp()
                                            ? u
                                            : u.withAuthAppSecret(secret)
                                                    .withAuthAppVerified(false));
            if (updated.isEmpty()) {
                return failure(ErrorResponse.USER_NOT_FOUND);
            }
            if (updated.get().hasVerifiedAuthApp()) {
                LOG.info("Auth app was confirmed by a concurrent request");
                return failure(ErrorResponse.AUTH_APP_ALREADY_EXISTS);
            }

            String provisioningUri =
                    authAppCodeService.provisioningUri(
                            secret,
                            updated.get().getUsername(),
                            configurationService.getAuthAppIssuer());
            LOG.info("Auth app enrollment started");
            return Result.success(
                    new EnrollmentResponse(
                            secret,
                            provisioningUri,
                            qrCodeRenderer.map(renderer -> renderer.render(provisioningUri))));
        } catch (StorageException e) {
            LOG.error("Storage unavailable during enrollment", e);
            return Result.failure(AuthFailure.storageUnavailable());
        }
    }

    public Result<AuthFailure, Void> confirmEnrollment(long userId, String code) {
        attachOperationToLogs("confirm-enrollment");
        attachUserIdToLogs(userId);
        try {
            Optional<User> user = userStore.findById(userId);
            if (user.isEmpty()) {
                return failure(ErrorResponse.USER_NOT_FOUND);
            }
            if (!user.get().hasPendingAuthApp()) {
                return failure(ErrorResponse.NO_PENDING_AUTH_APP);
            }

            String secret = user.get().getAuthAppSecret().get();
            if (!authAppCodeService.isCodeValid(secret, code)) {
                LOG.info("Invalid auth app code during enrollment");
                return failure(ErrorResponse.INVALID_AUTH_APP_CODE);
            }

            Optional<User> updated =
                    userStore.update(
                            userId,
                            u ->
                                    u.getAuthAppSecret().filter(secret::equals).isPresent()
                                            ? u.withAuthAppVerified(true)
                                            : u);
            boolean confirmed =
                    updated.filter(User::hasVerifiedAuthApp)
                            .flatMap(User::getAuthAppSecret)
                            .filter(secret::equals)
                            .isPresent();
            if (!confirmed) {
                LOG.info("Pending secret was replaced before it could be confirmed");
                return failure(ErrorResponse.INVALID_AUTH_APP_CODE);
            }
            LOG.info("Auth app enrollment confirmed");
            return Result.success(null);
        } catch (StorageException e) {
            LOG.error("Storage unavailable during enrollment confirmation", e);
            return Result.failure(AuthFailure.storageUnavailable());
        }
    }

    private static <T> Result<AuthFailure, T> failure(ErrorResponse errorResponse) {
        return Result.failure(AuthFailure.of(errorResponse));
    }
}
