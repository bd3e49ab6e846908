package com.creditengine.common.exception;

/**
 * Thrown when a notification cannot be delivered.
 */
public class NotificationException extends CreditEngineException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
