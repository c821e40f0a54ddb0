package org.decide.authentication.shared.services;

import org.decide.authentication.shared.exceptions.NotificationException;
import org.junit.jupiter.api.Test;
import uk.gov.service.notify.NotificationClient;
import uk.gov.service.notify.NotificationClientException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotifyNotifierTest {
    private static final String TEST_EMAIL = "voter1@decide.example";
    private static final String TEMPLATE_ID = "reset-template";

    private final NotificationClient notificationClient = mock(NotificationClient.class);
    private final ConfigurationService configurationService = mock(ConfigurationService.class);
    private final NotifyNotifier notifier =
            new NotifyNotifier(notificationClient, configurationService);

    NotifyNotifierTest() {
        when(configurationService.getResetPasswordTemplateId()).thenReturn(TEMPLATE_ID);
    }

    @Test
    void shouldSendTheSubjectAndBodyAsPersonalisation() throws Exception {
        notifier.send(TEST_EMAIL, "Password reset on decide.example", "body", "<p>body</p>");

        verify(notificationClient)
                .sendEmail(
                        TEMPLATE_ID,
                        TEST_EMAIL,
                        Map.of("subject", "Password reset on decide.example", "body", "body"),
                        "");
    }

    @Test
    void shouldWrapNotifyFailures() throws Exception {
        when(notificationClient.sendEmail(anyString(), eq(TEST_EMAIL), any(), anyString()))
                .thenThrow(new NotificationClientException("Notify is unavailable"));

        assertThrows(
                NotificationException.class,
                () -> notifier.send(TEST_EMAIL, "subject", "body", "<p>body</p>"));
    }

    @Test
    void shouldRequireAnApiKeyToBuildItsOwnClient() {
        assertThrows(IllegalStateException.class, () -> new NotifyNotifier(configurationService));
    }
}
