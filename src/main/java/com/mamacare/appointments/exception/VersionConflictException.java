package com.mamacare.appointments.exception;

import lombok.Getter;

/**
 * The record changed between read and write. Callers must re-fetch before retrying.
 */
@Getter
public class VersionConflictException extends StoreException {

    private final Long appointmentId;

    public VersionConflictException(Long appointmentId) {
        super("Appointment " + appointmentId + " was changed by someone else. Please refresh and try again.");
        this.appointmentId = appointmentId;
    }

    public VersionConflictException(Long appointmentId, Throwable cause) {
        super("Appointment " + appointmentId + " was changed by someone else. Please refresh and try again.", cause);
        this.appointmentId = appointmentId;
    }
}
