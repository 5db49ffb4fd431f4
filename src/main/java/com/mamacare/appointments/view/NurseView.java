package com.mamacare.appointments.view;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.service.AppointmentService;

/**
 * Appointments a nurse is assigned to. Read-mostly; the only write is confirming logistics.
 */
public class NurseView extends RoleScopedAppointments {

    public NurseView(AppointmentService service, Actor actor) {
        super(service, actor, UserRole.NURSE);
    }

    public boolean markScheduled(Long appointmentId) {
        return changeStatus(appointmentId, AppointmentStatus.SCHEDULED, null);
    }
}
