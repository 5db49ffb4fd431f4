package com.mamacare.appointments.exception;

public class NotFoundException extends AppointmentException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException appointment(Long id) {
        return new NotFoundException("Appointment " + id + " was not found.");
    }
}
