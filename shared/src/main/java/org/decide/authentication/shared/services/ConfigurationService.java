package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.exceptions.MissingEnvVariableException;

import java.util.Optional;

public class ConfigurationService {

    private static final Logger LOG = LogManager.getLogger(ConfigurationService.class);

    private final SystemService systemService;

    public ConfigurationService(SystemService systemService) {
        this.systemService = systemService;
    }

    // Please keep the method names in alphabetical order so we can find stuff more easily.
    public int getAuthAppCodeAllowedWindows() {
        return Integer.parseInt(
                systemService.getOrDefault("AUTH_APP_CODE_ALLOWED_WINDOWS", "3"));
    }

    public int getAuthAppCodeWindowLength() {
        return Integer.parseInt(systemService.getOrDefault("AUTH_APP_CODE_WINDOW_LENGTH", "30"));
    }

    public String getAuthAppIssuer() {
        return systemService.getOrDefault("AUTH_APP_ISSUER", "Decide App");
    }

    public int getMaxFailedLoginAttempts() {
        String value = systemService.getenv("AUTH_MAX_FAILED_LOGIN_ATTEMPTS");
        if (value == null || value.isBlank()) {
            throw new MissingEnvVariableException("AUTH_MAX_FAILED_LOGIN_ATTEMPTS");
        }
        int maxAttempts = Integer.parseInt(value.trim());
        if (maxAttempts < 1) {
            LOG.error("AUTH_MAX_FAILED_LOGIN_ATTEMPTS must be at least 1 but was {}", maxAttempts);
            throw new IllegalStateException("AUTH_MAX_FAILED_LOGIN_ATTEMPTS must be at least 1");
        }
        return maxAttempts;
    }

    public int getMaxFailedMfaAttempts() {
        return Integer.parseInt(systemService.getOrDefault("AUTH_MAX_FAILED_MFA_ATTEMPTS", "5"));
    }

    public long getMfaChallengeExpiry() {
        return Long.parseLong(systemService.getOrDefault("MFA_CHALLENGE_EXPIRY", "300"));
    }

    public long getMfaLockoutDuration() {
        return Long.parseLong(systemService.getOrDefault("MFA_LOCKOUT_DURATION", "900"));
    }

    public Optional<String> getNotifyApiKey() {
        return Optional.ofNullable(systemService.getenv("NOTIFY_API_KEY"));
    }

    public Optional<String> getNotifyApiUrl() {
        return Optional.ofNullable(systemService.getenv("NOTIFY_URL"));
    }

    public String getRedisHost() {
        return systemService.getOrDefault("REDIS_HOST", "redis");
    }

    public Optional<String> getRedisPassword() {
        return Optional.ofNullable(systemService.getenv("REDIS_PASSWORD"));
    }

    public int getRedisPort() {
        return Integer.parseInt(systemService.getOrDefault("REDIS_PORT", "6379"));
    }

    public long getResetPasswordCodeExpiry() {
        return Long.parseLong(systemService.getOrDefault("RESET_PASSWORD_CODE_EXPIRY", "86400"));
    }

    public String getResetPasswordDomain() {
        String domain = systemService.getenv("RESET_PASSWORD_DOMAIN");
        if (domain == null || domain.isBlank()) {
            throw new MissingEnvVariableException("RESET_PASSWORD_DOMAIN");
        }
        return domain;
    }

    public String getResetPasswordPath() {
        return systemService.getOrDefault(
                "RESET_PASSWORD_PATH", "/authentication/reset/{uidb64}/{token}/");
    }

    public String getResetPasswordProtocol() {
        return systemService.getOrDefault("RESET_PASSWORD_PROTOCOL", "https");
    }

    public String getResetPasswordTemplateId() {
        return systemService.getenv("RESET_PASSWORD_TEMPLATE_ID");
    }

    public boolean getUseRedisTLS() {
        return Boolean.parseBoolean(systemService.getOrDefault("REDIS_TLS", "false"));
    }
}
