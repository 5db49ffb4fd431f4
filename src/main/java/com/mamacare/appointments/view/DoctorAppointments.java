package com.mamacare.appointments.view;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.service.AppointmentService;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;

/**
 * A doctor's appointments: approve, decline, schedule, complete, reschedule, assign nurse, delete.
 */
public class DoctorAppointments extends RoleScopedAppointments {

    public DoctorAppointments(AppointmentService service, Actor actor) {
        super(service, actor, UserRole.DOCTOR);
    }

    public boolean approve(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.CONFIRMED, null);
    }

    public boolean decline(Long appointmentId, String reason) {
        return changeStatus(appointmentId, AppointmentStatus.DECLINED, reason);
    }

    public boolean markScheduled(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.SCHEDULED, null);
    }

    public boolean complete(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.COMPLETED, null);
    }

    public boolean reschedule(Long appointmentId, Instant newDateTime) {
        return moveTo(appointmentId, newDateTime);
    }

    public boolean assignNurse(Long appointmentId, String nurseId) {
        String target = StringUtils.trimToNull(nurseId);
        return mutateRecord(appointmentId, "assignNurse",
                current -> current.toBuilder().nurseId(target).build(),
                () -> service.assignNurse(appointmentId, target, actor));
    }

    /** Removes a terminal appointment; the record leaves the cached list without a reload. */
    public boolean delete(Long appointmentId) {
        return removeRecord(appointmentId, () -> service.deleteAppointment(appointmentId, actor));
    }
}
