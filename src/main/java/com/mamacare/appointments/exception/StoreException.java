package com.mamacare.appointments.exception;

/**
 * Backing persistence failed: timeout, lost connection, constraint violation.
 */
public class StoreException extends AppointmentException {

    public static final String RETRY_MESSAGE =
            "Something went wrong while saving the appointment. Please try again.";

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
