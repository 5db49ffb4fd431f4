package com.mamacare.appointments.store;

import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.NotFoundException;
import com.mamacare.appointments.exception.StoreException;
import com.mamacare.appointments.exception.VersionConflictException;
import com.mamacare.appointments.repository.AppointmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * JPA-backed {@link AppointmentStore}.
 *
 * <p>Each call runs in its own transaction bounded by {@code appointments.store.timeout-seconds}.
 * Persistence failures surface as {@link StoreException}; a stale version or a lost optimistic
 * lock surfaces as {@link VersionConflictException}.
 */
@Component
public class JpaAppointmentStore implements AppointmentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaAppointmentStore.class);

    private final AppointmentRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;

    public JpaAppointmentStore(
            AppointmentRepository repository,
            PlatformTransactionManager transactionManager,
            Clock clock,
            @Value("${appointments.store.timeout-seconds:20}") int timeoutSeconds
    ) {
        this.repository = repository;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setTimeout(timeoutSeconds);
        this.readOnlyTemplate.setReadOnly(true);
    }

    @Override
    public Appointment create(Appointment appointment) {
        Objects.requireNonNull(appointment, "appointment");
        Instant now = clock.instant();
        Appointment toSave = appointment.toBuilder()
                .id(null)
                .version(null)
                .createdAt(now)
                .updatedAt(now)
                .build();

        Appointment saved = execute("create", null, transactionTemplate,
                () -> repository.saveAndFlush(toSave));
        log.debug("Stored appointment {} for patient {} with doctor {}",
                saved.getId(), saved.getPatientId(), saved.getDoctorId());
        return saved;
    }

    @Override
    public Appointment get(Long id) {
        return execute("get", id, readOnlyTemplate,
                () -> repository.findById(id).orElseThrow(() -> NotFoundException.appointment(id)));
    }

    @Override
    public List<Appointment> listByParticipant(String userId, UserRole roleHint, AppointmentStatus statusFilter) {
        return execute("list", null, readOnlyTemplate, () -> {
            switch (roleHint) {
                case PATIENT:
                    return statusFilter == null
                            ? repository.findByPatientIdOrderByDateTimeAsc(userId)
                            : repository.findByPatientIdAndStatusOrderByDateTimeAsc(userId, statusFilter);
                case DOCTOR:
                    return statusFilter == null
                            ? repository.findByDoctorIdOrderByDateTimeAsc(userId)
                            : repository.findByDoctorIdAndStatusOrderByDateTimeAsc(userId, statusFilter);
                case NURSE:
                    return statusFilter == null
                            ? repository.findByNurseIdOrderByDateTimeAsc(userId)
                            : repository.findByNurseIdAndStatusOrderByDateTimeAsc(userId, statusFilter);
                default:
                    return List.of();
            }
        });
    }

    @Override
    public Appointment updateFields(Long id, AppointmentPatch patch, Long expectedVersion) {
        Objects.requireNonNull(patch, "patch");
        return execute("update", id, transactionTemplate, () -> {
            Appointment current = repository.findById(id)
                    .orElseThrow(() -> NotFoundException.appointment(id));

            if (!Objects.equals(current.getVersion(), expectedVersion)) {
                log.warn("Version conflict on appointment {}: expected {} but found {}",
                        id, expectedVersion, current.getVersion());
                throw new VersionConflictException(id);
            }

            if (patch.getStatus() != null) current.setStatus(patch.getStatus());
            if (patch.getDateTime() != null) current.setDateTime(patch.getDateTime());
            if (patch.isClearNurse()) {
                current.setNurseId(null);
            } else if (patch.getNurseId() != null) {
                current.setNurseId(patch.getNurseId());
            }
            if (patch.getNotes() != null) current.setNotes(patch.getNotes());
            current.setUpdatedAt(clock.instant());

            return repository.saveAndFlush(current);
        });
    }

    @Override
    public void delete(Long id) {
        execute("delete", id, transactionTemplate, () -> {
            Appointment current = repository.findById(id)
                    .orElseThrow(() -> NotFoundException.appointment(id));
            repository.delete(current);
            repository.flush();
            return null;
        });
    }

    private <T> T execute(String operation, Long id, TransactionTemplate template, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (OptimisticLockingFailureException e) {
            log.warn("Optimistic lock lost on appointment {} during {}", id, operation);
            throw new VersionConflictException(id, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Appointment store {} failed for id={}", operation, id, e);
            throw new StoreException(StoreException.RETRY_MESSAGE, e);
        }
    }
}
