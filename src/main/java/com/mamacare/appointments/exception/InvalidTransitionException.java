package com.mamacare.appointments.exception;

import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import lombok.Getter;

import java.util.Locale;

@Getter
public class InvalidTransitionException extends AppointmentException {

    private final AppointmentStatus from;
    private final AppointmentStatus to;
    private final UserRole role;

    public InvalidTransitionException(AppointmentStatus from, AppointmentStatus to, UserRole role) {
        super(String.format("A %s cannot move an appointment from %s to %s.",
                role.name().toLowerCase(Locale.ROOT), from.wireValue(), to.wireValue()));
        this.from = from;
        this.to = to;
        this.role = role;
    }

    public InvalidTransitionException(String message, AppointmentStatus from) {
        super(message);
        this.from = from;
        this.to = null;
        this.role = null;
    }
}
