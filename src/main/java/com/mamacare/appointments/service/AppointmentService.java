package com.mamacare.appointments.service;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.directory.DoctorDirectory;
import com.mamacare.appointments.directory.DoctorSummary;
import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserAccount;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.AuthException;
import com.mamacare.appointments.exception.InvalidTransitionException;
import com.mamacare.appointments.exception.NotFoundException;
import com.mamacare.appointments.exception.ValidationException;
import com.mamacare.appointments.exception.VersionConflictException;
import com.mamacare.appointments.notification.AppointmentNotifier;
import com.mamacare.appointments.policy.StatusPolicy;
import com.mamacare.appointments.repository.UserAccountRepository;
import com.mamacare.appointments.store.AppointmentPatch;
import com.mamacare.appointments.store.AppointmentStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Appointment lifecycle operations. Each operation validates the actor and the transition,
 * writes through {@link AppointmentStore}, then hands notifications to {@link AppointmentNotifier}
 * once the write has committed.
 *
 * <p>A {@link VersionConflictException} on update triggers exactly one re-fetch, re-validation and
 * retry. A second conflict, or any other store failure, reaches the caller.
 */
@Service
public class AppointmentService {

    private static final Logger log = LoggerFactory.getLogger(AppointmentService.class);

    static final String UNKNOWN_PATIENT = "Unknown Patient";

    private final AppointmentStore store;
    private final DoctorDirectory doctorDirectory;
    private final UserAccountRepository userAccountRepository;
    private final AppointmentNotifier notifier;
    private final Clock clock;
    private final ReschedulePolicy reschedulePolicy;

    public AppointmentService(
            AppointmentStore store,
            DoctorDirectory doctorDirectory,
            UserAccountRepository userAccountRepository,
            AppointmentNotifier notifier,
            Clock clock,
            @Value("${appointments.reschedule.policy:KEEP_STATUS}") ReschedulePolicy reschedulePolicy
    ) {
        this.store = store;
        this.doctorDirectory = doctorDirectory;
        this.userAccountRepository = userAccountRepository;
        this.notifier = notifier;
        this.clock = clock;
        this.reschedulePolicy = reschedulePolicy;
    }

    // =========================================================
    // REQUEST
    // =========================================================
    public Appointment requestAppointment(
            Actor actor,
            String patientId,
            String doctorId,
            String reason,
            Instant dateTime,
            String notes
    ) {
        requireAuthenticated(actor);
        if (actor.getRole() != UserRole.PATIENT) {
            throw new AuthException("Only patients can request appointments.");
        }
        String owner = StringUtils.defaultIfBlank(patientId, actor.getUserId());
        if (!owner.equals(actor.getUserId())) {
            throw new AuthException("You can only request appointments for yourself.");
        }
        if (StringUtils.isBlank(reason)) {
            throw new ValidationException("Please provide a reason for the appointment.");
        }
        requireFuture(dateTime);
        if (StringUtils.isBlank(doctorId)) {
            throw new ValidationException("Please select a doctor.");
        }
        if (owner.equals(doctorId)) {
            throw new ValidationException("Patient and doctor must be different people.");
        }

        DoctorSummary doctor = doctorDirectory.find(doctorId)
                .orElseThrow(() -> new ValidationException("Selected doctor could not be found."));
        String patientName = userAccountRepository.findById(owner)
                .map(UserAccount::getName)
                .orElse(UNKNOWN_PATIENT);

        Appointment draft = Appointment.builder()
                .patientId(owner)
                .doctorId(doctor.getId())
                .patientName(patientName)
                .doctorName(doctor.getName())
                .dateTime(dateTime)
                .reason(reason.trim())
                .notes(StringUtils.trimToNull(notes))
                .status(AppointmentStatus.PENDING)
                .build();

        Appointment created = store.create(draft);
        log.info("Appointment {} requested: patient={} doctor={} at={}",
                created.getId(), owner, doctor.getId(), dateTime);

        notifier.appointmentRequested(created);
        return created;
    }

    // =========================================================
    // STATUS
    // =========================================================
    public Appointment setStatus(Long appointmentId, AppointmentStatus newStatus, Actor actor) {
        return setStatus(appointmentId, newStatus, actor, null);
    }

    /**
     * Moves a record to {@code newStatus}. Moving to the current status is rejected as an
     * {@link InvalidTransitionException}, like any other move outside the transition table.
     *
     * @param reason optional text passed on to the counterpart, used for declines and cancellations
     */
    public Appointment setStatus(Long appointmentId, AppointmentStatus newStatus, Actor actor, String reason) {
        requireAuthenticated(actor);
        if (newStatus == null) {
            throw new ValidationException("A target status is required.");
        }

        Appointment updated = updateWithRetry(appointmentId, "setStatus", current -> {
            requireParticipant(current, actor);
            if (current.getStatus() == newStatus) {
                throw new InvalidTransitionException(
                        "Appointment is already " + current.getStatus().wireValue() + ".", current.getStatus());
            }
            StatusPolicy.checkTransition(current.getStatus(), newStatus, actor.getRole());
            return AppointmentPatch.status(newStatus);
        });

        log.info("Appointment {} moved to {} by {} {}",
                appointmentId, newStatus.wireValue(), actor.getRole(), actor.getUserId());
        notifier.statusChanged(updated, actor, reason);
        return updated;
    }

    // =========================================================
    // RESCHEDULE
    // =========================================================
    public Appointment reschedule(Long appointmentId, Instant newDateTime, Actor actor) {
        requireAuthenticated(actor);
        requireFuture(newDateTime);

        Appointment updated = updateWithRetry(appointmentId, "reschedule", current -> {
            requireParticipant(current, actor);
            if (!StatusPolicy.canBeRescheduled(current.getStatus())) {
                throw new InvalidTransitionException(
                        "Appointment cannot be rescheduled in its current state ("
                                + current.getStatus().getDisplayName() + ").", current.getStatus());
            }
            if (!StatusPolicy.canReschedule(current.getStatus(), actor.getRole())) {
                throw new AuthException("Only the patient or the doctor can reschedule this appointment.");
            }
            if (newDateTime.equals(current.getDateTime())) {
                throw new ValidationException("The new time is the same as the current one.");
            }
            return AppointmentPatch.builder()
                    .dateTime(newDateTime)
                    .status(statusAfterReschedule(current.getStatus(), actor.getRole()))
                    .build();
        });

        log.info("Appointment {} rescheduled to {} by {} {}",
                appointmentId, newDateTime, actor.getRole(), actor.getUserId());
        notifier.rescheduled(updated, actor);
        return updated;
    }

    private AppointmentStatus statusAfterReschedule(AppointmentStatus current, UserRole role) {
        if (reschedulePolicy == ReschedulePolicy.RESET_TO_PENDING
                && role == UserRole.PATIENT
                && current == AppointmentStatus.CONFIRMED) {
            return AppointmentStatus.PENDING;
        }
        return null;
    }

    // =========================================================
    // NURSE ASSIGNMENT
    // =========================================================

    /**
     * Assigns a nurse to the record, or clears the assignment when {@code nurseId} is blank.
     */
    public Appointment assignNurse(Long appointmentId, String nurseId, Actor actor) {
        requireAuthenticated(actor);
        if (actor.getRole() != UserRole.DOCTOR) {
            throw new AuthException("Only doctors can assign nurses.");
        }
        String target = StringUtils.trimToNull(nurseId);
        if (target != null && !userAccountRepository.findByIdAndRoleAndActiveTrue(target, UserRole.NURSE).isPresent()) {
            throw new ValidationException("Selected nurse could not be found.");
        }

        Appointment updated = updateWithRetry(appointmentId, "assignNurse", current -> {
            requireParticipant(current, actor);
            if (!StatusPolicy.canAssignNurse(current.getStatus(), actor.getRole())) {
                throw new InvalidTransitionException(
                        "Nurses can only be assigned to active appointments.", current.getStatus());
            }
            if (Objects.equals(current.getNurseId(), target)) {
                throw new ValidationException(target == null
                        ? "No nurse is assigned to this appointment."
                        : "This nurse is already assigned to the appointment.");
            }
            return target == null
                    ? AppointmentPatch.builder().clearNurse(true).build()
                    : AppointmentPatch.builder().nurseId(target).build();
        });

        log.info("Appointment {} nurse set to {} by doctor {}", appointmentId, target, actor.getUserId());
        notifier.nurseAssigned(updated);
        return updated;
    }

    // =========================================================
    // DELETE
    // =========================================================
    public void deleteAppointment(Long appointmentId, Actor actor) {
        requireAuthenticated(actor);
        if (actor.getRole() != UserRole.DOCTOR) {
            throw new AuthException("Only doctors can delete appointments.");
        }
        Appointment current = store.get(appointmentId);
        requireParticipant(current, actor);
        if (!StatusPolicy.canBeDeletedByDoctor(current.getStatus())) {
            throw new InvalidTransitionException(
                    "Appointment cannot be deleted in its current state ("
                            + current.getStatus().getDisplayName() + ").", current.getStatus());
        }
        store.delete(appointmentId);
        log.info("Appointment {} deleted by doctor {}", appointmentId, actor.getUserId());
    }

    // =========================================================
    // READ
    // =========================================================
    public List<Appointment> listForRole(Actor actor, AppointmentStatus statusFilter) {
        requireAuthenticated(actor);
        UserRole role = actor.getRole();
        if (role != UserRole.PATIENT && role != UserRole.DOCTOR && role != UserRole.NURSE) {
            throw new AuthException("Your role has no appointment list.");
        }
        List<Appointment> appointments = store.listByParticipant(actor.getUserId(), role, statusFilter);
        log.debug("Listed {} appointments for {} {} (status: {})", appointments.size(), role,
                actor.getUserId(), statusFilter == null ? "all" : statusFilter.wireValue());
        return appointments;
    }

    public Appointment getAppointment(Long appointmentId, Actor actor) {
        requireAuthenticated(actor);
        Appointment appointment = store.get(appointmentId);
        requireParticipant(appointment, actor);
        return appointment;
    }

    // =========================================================
    // HELPERS
    // =========================================================

    /**
     * Reads the record, lets {@code decide} validate it and build the patch, then writes with the
     * read version. On a version conflict the whole read-decide-write runs once more.
     */
    private Appointment updateWithRetry(Long appointmentId, String operation,
                                        Function<Appointment, AppointmentPatch> decide) {
        if (appointmentId == null) {
            throw new NotFoundException("Appointment id is required.");
        }
        Appointment current = store.get(appointmentId);
        AppointmentPatch patch = decide.apply(current);
        try {
            return store.updateFields(appointmentId, patch, current.getVersion());
        } catch (VersionConflictException e) {
            log.info("{} on appointment {} hit a concurrent update, re-reading once", operation, appointmentId);
            Appointment fresh = store.get(appointmentId);
            AppointmentPatch retryPatch = decide.apply(fresh);
            return store.updateFields(appointmentId, retryPatch, fresh.getVersion());
        }
    }

    private void requireAuthenticated(Actor actor) {
        if (actor == null || !actor.isAuthenticated()) {
            throw AuthException.unauthenticated();
        }
    }

    private void requireFuture(Instant dateTime) {
        if (dateTime == null) {
            throw new ValidationException("Please choose a date and time.");
        }
        if (dateTime.isBefore(clock.instant())) {
            throw new ValidationException("Appointment time cannot be in the past.");
        }
    }

    private static void requireParticipant(Appointment appointment, Actor actor) {
        String userId = actor.getUserId();
        boolean allowed;
        switch (actor.getRole()) {
            case PATIENT:
                allowed = userId.equals(appointment.getPatientId());
                break;
            case DOCTOR:
                allowed = userId.equals(appointment.getDoctorId());
                break;
            case NURSE:
                allowed = userId.equals(appointment.getNurseId());
                break;
            default:
                allowed = false;
        }
        if (!allowed) {
            throw new AuthException("You are not a participant of this appointment.");
        }
    }
}
