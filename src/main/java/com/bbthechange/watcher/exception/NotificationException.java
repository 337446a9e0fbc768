package com.bbthechange.watcher.exception;

/**
 * Exception thrown when a match notification could not be handed to the mail transport.
 */
public class NotificationException extends ExternalServiceException {

    private final String recipient;

    public NotificationException(ErrorType errorType, String recipient, String message, Throwable cause) {
        super(errorType, message, cause);
        this.recipient = recipient;
    }

    public String getRecipient() {
        return recipient;
    }
}
