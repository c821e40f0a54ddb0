package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.exceptions.NotificationException;
import uk.gov.service.notify.NotificationClient;
import uk.gov.service.notify.NotificationClientException;

import java.util.Map;

/**
 * Sends email through GOV.UK Notify. The template renders its own markup from the plaintext
 * body, so the html body is not sent.
 */
public class NotifyNotifier implements Notifier {

    private static final Logger LOG = LogManager.getLogger(NotifyNotifier.class);

    private final NotificationClient notifyClient;
    private final ConfigurationService configurationService;

    public NotifyNotifier(
            NotificationClient notifyClient, ConfigurationService configurationService) {
        this.notifyClient = notifyClient;
        this.configurationService = configurationService;
    }

    public NotifyNotifier(ConfigurationService configurationService) {
        this(createClient(configurationService), configurationService);
    }

    @Override
    public void send(String to, String subject, String plaintextBody, String htmlBody)
            throws NotificationException {
        LOG.info("Sending email through Notify");
        try {
            notifyClient.sendEmail(
                    configurationService.getResetPasswordTemplateId(),
                    to,
                    Map.of("subject", subject, "body", plaintextBody),
                    "");
        } catch (NotificationClientException e) {
            LOG.error("Notify rejected email with status {}", e.getHttpResult());
            throw new NotificationException("Unable to send email", e);
        }
    }

    private static NotificationClient createClient(ConfigurationService configurationService) {
        String apiKey =
                configurationService
                        .getNotifyApiKey()
                        .orElseThrow(() -> new IllegalStateException("NOTIFY_API_KEY is not set"));
        return configurationService
                .getNotifyApiUrl()
                .map(url -> new NotificationClient(apiKey, url))
                .orElseGet(() -> new NotificationClient(apiKey));
    }
}
