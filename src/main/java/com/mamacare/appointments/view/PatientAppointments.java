package com.mamacare.appointments.view;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.service.AppointmentService;

import java.time.Instant;

/**
 * A patient's appointments: request, cancel, reschedule.
 */
public class PatientAppointments extends RoleScopedAppointments {

    public PatientAppointments(AppointmentService service, Actor actor) {
        super(service, actor, UserRole.PATIENT);
    }

    public boolean request(String doctorId, String reason, Instant dateTime, String notes) {
        try {
            Appointment created = service.requestAppointment(actor, actor.getUserId(), doctorId, reason, dateTime, notes);
            insert(created);
            clearError();
            return true;
        } catch (RuntimeException e) {
            fail("request", null, e);
            return false;
        }
    }

    public boolean cancel(Long appointmentId, String reason) {
        return changeStatus(appointmentId, AppointmentStatus.CANCELLED, reason);
    }

    public boolean reschedule(Long appointmentId, Instant newDateTime) {
        return moveTo(appointmentId, newDateTime);
    }
}
