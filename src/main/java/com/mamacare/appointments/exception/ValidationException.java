package com.mamacare.appointments.exception;

public class ValidationException extends AppointmentException {

    public ValidationException(String message) {
        super(message);
    }
}
