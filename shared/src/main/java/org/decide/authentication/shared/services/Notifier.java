package org.decide.authentication.shared.services;

import org.decide.authentication.shared.exceptions.NotificationException;

public interface Notifier {

    void send(String to, String subject, String plaintextBody, String htmlBody)
            throws NotificationException;
}
