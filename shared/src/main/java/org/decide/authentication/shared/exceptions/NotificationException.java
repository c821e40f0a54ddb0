package org.decide.authentication.shared.exceptions;

public class NotificationException extends Exception {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
