package com.mamacare.appointments.exception;

/**
 * Delivery to the push backend failed. Logged by the notifier, never propagated to callers.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
