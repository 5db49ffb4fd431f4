package com.mamacare.appointments.exception;

/**
 * Base of every failure raised by the appointment core. Messages are meant to be shown to the user.
 */
public abstract class AppointmentException extends RuntimeException {

    protected AppointmentException(String message) {
        super(message);
    }

    protected AppointmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
