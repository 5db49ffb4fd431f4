package com.mamacare.appointments.view;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.service.AppointmentService;
import org.springframework.stereotype.Component;

/**
 * Creates one view per actor. Views hold per-actor state and are never shared.
 */
@Component
public class AppointmentViews {

    private final AppointmentService appointmentService;

    public AppointmentViews(AppointmentService appointmentService) {
        this.appointmentService = appointmentService;
    }

    public PatientAppointments forPatient(Actor actor) {
        return new PatientAppointments(appointmentService, actor);
    }

    public DoctorAppointments forDoctor(Actor actor) {
        return new DoctorAppointments(appointmentService, actor);
    }

    public NurseView forNurse(Actor actor) {
        return new NurseView(appointmentService, actor);
    }
}
