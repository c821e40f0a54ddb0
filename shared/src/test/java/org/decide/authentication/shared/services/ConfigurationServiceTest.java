package org.decide.authentication.shared.services;

import org.decide.authentication.shared.exceptions.MissingEnvVariableException;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConfigurationServiceTest {

    private final SystemService systemService = mock(SystemService.class);
    private final ConfigurationService configurationService =
            new ConfigurationService(systemService);

    ConfigurationServiceTest() {
        when(systemService.getOrDefault(anyString(), anyString()))
                .thenAnswer(invocation -> invocation.getArgument(1));
    }

    @Test
    void shouldFallBackToDefaults() {
        assertEquals(3, configurationService.getAuthAppCodeAllowedWindows());
        assertEquals(30, configurationService.getAuthAppCodeWindowLength());
        assertEquals("Decide App", configurationService.getAuthAppIssuer());
        assertEquals(5, configurationService.getMaxFailedMfaAttempts());
        assertEquals(300, configurationService.getMfaChallengeExpiry());
        assertEquals(900, configurationService.getMfaLockoutDuration());
        assertEquals("redis", configurationService.getRedisHost());
        assertEquals(6379, configurationService.getRedisPort());
        assertEquals(86400, configurationService.getResetPasswordCodeExpiry());
        assertEquals(
                "/authentication/reset/{uidb64}/{token}/",
                configurationService.getResetPasswordPath());
        assertEquals("https", configurationService.getResetPasswordProtocol());
        assertFalse(configurationService.getUseRedisTLS());
        assertEquals(Optional.empty(), configurationService.getRedisPassword());
        assertEquals(Optional.empty(), configurationService.getNotifyApiKey());
    }

    @Test
    void shouldReadOverriddenValues() {
        when(systemService.getOrDefault("AUTH_MAX_FAILED_MFA_ATTEMPTS", "5")).thenReturn("2");
        when(systemService.getOrDefault("REDIS_TLS", "false")).thenReturn("true");
        when(systemService.getenv("NOTIFY_API_KEY")).thenReturn("key");

        assertEquals(2, configurationService.getMaxFailedMfaAttempts());
        assertTrue(configurationService.getUseRedisTLS());
        assertEquals(Optional.of("key"), configurationService.getNotifyApiKey());
    }

    @Test
    void shouldReadTheMaxFailedLoginAttempts() {
        when(systemService.getenv("AUTH_MAX_FAILED_LOGIN_ATTEMPTS")).thenReturn("4");

        assertEquals(4, configurationService.getMaxFailedLoginAttempts());
    }

    @Test
    void shouldRequireTheMaxFailedLoginAttempts() {
        assertThrows(
                MissingEnvVariableException.class,
                configurationService::getMaxFailedLoginAttempts);
    }

    @Test
    void shouldRejectAMaxFailedLoginAttemptsBelowOne() {
        when(systemService.getenv("AUTH_MAX_FAILED_LOGIN_ATTEMPTS")).thenReturn("0");

        assertThrows(IllegalStateException.class, configurationService::getMaxFailedLoginAttempts);
    }

    @Test
    void shouldRequireTheResetPasswordDomain() {
        assertThrows(
                MissingEnvVariableException.class, configurationService::getResetPasswordDomain);

        when(systemService.getenv("RESET_PASSWORD_DOMAIN")).thenReturn("decide.example");
        assertEquals("decide.example", configurationService.getResetPasswordDomain());
    }
}
