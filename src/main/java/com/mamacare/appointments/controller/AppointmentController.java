package com.mamacare.appointments.controller;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.auth.SessionAuthenticator;
import com.mamacare.appointments.dto.AppointmentRequest;
import com.mamacare.appointments.dto.AppointmentResponse;
import com.mamacare.appointments.dto.NurseAssignmentRequest;
import com.mamacare.appointments.dto.RescheduleRequest;
import com.mamacare.appointments.dto.StatusChangeRequest;
import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.exception.ValidationException;
import com.mamacare.appointments.service.AppointmentService;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/appointments")
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final SessionAuthenticator authenticator;

    public AppointmentController(AppointmentService appointmentService, SessionAuthenticator authenticator) {
        this.appointmentService = appointmentService;
        this.authenticator = authenticator;
    }

    @PostMapping
    public ResponseEntity<AppointmentResponse> request(@RequestBody AppointmentRequest body, HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        Appointment created = appointmentService.requestAppointment(
                actor, body.getPatientId(), body.getDoctorId(), body.getReason(), body.getDateTime(), body.getNotes());
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentResponse.from(created));
    }

    @GetMapping
    public ResponseEntity<List<AppointmentResponse>> list(
            @RequestParam(required = false) String status,
            HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        List<AppointmentResponse> result = appointmentService.listForRole(actor, parseFilter(status)).stream()
                .map(AppointmentResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppointmentResponse> get(@PathVariable Long id, HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        return ResponseEntity.ok(AppointmentResponse.from(appointmentService.getAppointment(id, actor)));
    }

    @PutMapping("/{id}/status")
    public ResponseEntity<AppointmentResponse> setStatus(
            @PathVariable Long id,
            @RequestBody StatusChangeRequest body,
            HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        AppointmentStatus target = AppointmentStatus.parseOrNull(body.getStatus());
        if (target == null) {
            throw new ValidationException("Unknown appointment status: " + body.getStatus());
        }
        Appointment updated = appointmentService.setStatus(id, target, actor, body.getReason());
        return ResponseEntity.ok(AppointmentResponse.from(updated));
    }

    @PutMapping("/{id}/schedule")
    public ResponseEntity<AppointmentResponse> reschedule(
            @PathVariable Long id,
            @RequestBody RescheduleRequest body,
            HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        Appointment updated = appointmentService.reschedule(id, body.getDateTime(), actor);
        return ResponseEntity.ok(AppointmentResponse.from(updated));
    }

    @PutMapping("/{id}/nurse")
    public ResponseEntity<AppointmentResponse> assignNurse(
            @PathVariable Long id,
            @RequestBody NurseAssignmentRequest body,
            HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        Appointment updated = appointmentService.assignNurse(id, body.getNurseId(), actor);
        return ResponseEntity.ok(AppointmentResponse.from(updated));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id, HttpServletRequest request) {
        Actor actor = authenticator.currentActor(request);
        appointmentService.deleteAppointment(id, actor);
        return ResponseEntity.noContent().build();
    }

    private static AppointmentStatus parseFilter(String status) {
        if (StringUtils.isBlank(status) || "all".equalsIgnoreCase(status.trim())) {
            return null;
        }
        AppointmentStatus filter = AppointmentStatus.parseOrNull(status);
        if (filter == null) {
            throw new ValidationException("Unknown appointment status: " + status);
        }
        return filter;
    }
}
