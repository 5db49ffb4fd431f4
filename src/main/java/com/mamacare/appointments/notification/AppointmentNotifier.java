package com.mamacare.appointments.notification;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.NotificationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Post-commit notifications to the other participants of an appointment.
 *
 * <p>Messages are handed to {@link NotificationGateway} on the notification executor. The caller
 * never waits for delivery and never sees a delivery failure; failures are only logged.
 */
@Component
public class AppointmentNotifier {

    private static final Logger log = LoggerFactory.getLogger(AppointmentNotifier.class);

    public static final String TYPE_REQUEST = "appointment_request";
    public static final String TYPE_STATUS = "appointment_status";
    public static final String TYPE_RESCHEDULE = "appointment_rescheduled";
    public static final String TYPE_NURSE = "nurse_assignment";

    private final NotificationGateway gateway;
    private final Executor executor;
    private final DateTimeFormatter formatter;

    public AppointmentNotifier(
            NotificationGateway gateway,
            @Qualifier("notificationExecutor") Executor executor,
            @Value("${appointments.zone-id:UTC}") String zoneId
    ) {
        this.gateway = gateway;
        this.executor = executor;
        this.formatter = DateTimeFormatter.ofPattern("EEE, MMM d yyyy 'at' HH:mm", Locale.ENGLISH)
                .withZone(ZoneId.of(zoneId));
    }

    public void appointmentRequested(Appointment appointment) {
        String body = String.format("%s requested an appointment on %s. Reason: %s",
                appointment.getPatientName(), formatter.format(appointment.getDateTime()), appointment.getReason());
        dispatch(appointment.getDoctorId(), "New Appointment Request", body, data(appointment, TYPE_REQUEST));
    }

    /**
     * @param reason optional free text, appended for declines and cancellations
     */
    public void statusChanged(Appointment appointment, Actor actor, String reason) {
        AppointmentStatus status = appointment.getStatus();
        String title = "Appointment " + StringUtils.capitalize(status.wireValue());
        String when = formatter.format(appointment.getDateTime());

        for (String target : counterparts(appointment, actor)) {
            String body;
            if (target.equals(appointment.getPatientId())) {
                body = String.format("Your appointment with Dr. %s on %s has been %s.",
                        appointment.getDoctorName(), when, status.wireValue());
            } else {
                body = String.format("The appointment with %s on %s has been %s.",
                        appointment.getPatientName(), when, status.wireValue());
            }
            if (StringUtils.isNotBlank(reason)) {
                body += " Reason: " + reason.trim();
            }
            Map<String, String> data = data(appointment, TYPE_STATUS);
            data.put("status", status.wireValue());
            dispatch(target, title, body, data);
        }
    }

    public void rescheduled(Appointment appointment, Actor actor) {
        String when = formatter.format(appointment.getDateTime());
        for (String target : counterparts(appointment, actor)) {
            String body = target.equals(appointment.getPatientId())
                    ? String.format("Your appointment with Dr. %s has been moved to %s.", appointment.getDoctorName(), when)
                    : String.format("%s moved their appointment to %s.", appointment.getPatientName(), when);
            dispatch(target, "Appointment Rescheduled", body, data(appointment, TYPE_RESCHEDULE));
        }
    }

    public void nurseAssigned(Appointment appointment) {
        if (StringUtils.isBlank(appointment.getNurseId())) return;
        String body = String.format("You have been assigned to %s's appointment with Dr. %s on %s.",
                appointment.getPatientName(), appointment.getDoctorName(), formatter.format(appointment.getDateTime()));
        dispatch(appointment.getNurseId(), "New Appointment Assignment", body, data(appointment, TYPE_NURSE));
    }

    /**
     * Participants to tell about an action: the patient hears about doctor and nurse actions, the
     * doctor hears about patient and nurse actions.
     */
    static List<String> counterparts(Appointment appointment, Actor actor) {
        List<String> targets = new ArrayList<>();
        UserRole role = actor.getRole();
        if (role != UserRole.PATIENT) targets.add(appointment.getPatientId());
        if (role != UserRole.DOCTOR) targets.add(appointment.getDoctorId());
        targets.removeIf(id -> StringUtils.isBlank(id) || id.equals(actor.getUserId()));
        return targets;
    }

    private Map<String, String> data(Appointment appointment, String type) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("type", type);
        data.put("appointmentId", String.valueOf(appointment.getId()));
        return data;
    }

    private void dispatch(String targetUserId, String title, String body, Map<String, String> data) {
        try {
            executor.execute(() -> deliver(targetUserId, title, body, data));
        } catch (RejectedExecutionException e) {
            log.error("Notification '{}' to {} rejected by executor", title, targetUserId, e);
        }
    }

    private void deliver(String targetUserId, String title, String body, Map<String, String> data) {
        try {
            gateway.send(targetUserId, title, body, data);
        } catch (NotificationException e) {
            log.warn("Notification '{}' to {} failed: {}", title, targetUserId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error sending notification '{}' to {}", title, targetUserId, e);
        }
    }
}
