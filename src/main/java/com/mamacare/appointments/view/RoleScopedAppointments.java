package com.mamacare.appointments.view;

import com.mamacare.appointments.auth.Actor;
import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.AppointmentException;
import com.mamacare.appointments.exception.StoreException;
import com.mamacare.appointments.exception.VersionConflictException;
import com.mamacare.appointments.service.AppointmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Cached, filtered list of one actor's appointments plus the mutations that actor may apply.
 *
 * <p>The cached list belongs to this instance alone. Loads replace it wholesale; mutations patch
 * the affected record in place, optimistically, and revert it if the service call fails. Only one
 * mutation per appointment may be in flight at a time; a second one is rejected. A revert is skipped
 * when a load started while the mutation was in flight, since that load already holds newer data.
 *
 * <p>Operations return {@code true} on success. On failure they return {@code false} and leave a
 * user-facing message in {@link #getError()}.
 */
public abstract class RoleScopedAppointments {

    private static final Logger log = LoggerFactory.getLogger(RoleScopedAppointments.class);

    static final String IN_PROGRESS_MESSAGE = "An update for this appointment is already in progress.";
    static final String UNEXPECTED_MESSAGE = "Something went wrong. Please try again.";

    private static final Comparator<Appointment> BY_DATE_TIME =
            Comparator.comparing(Appointment::getDateTime, Comparator.nullsLast(Comparator.naturalOrder()));

    protected final AppointmentService service;
    protected final Actor actor;

    private final Object lock = new Object();
    private final List<Appointment> appointments = new ArrayList<>();
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger busy = new AtomicInteger();
    private final AtomicLong loadGeneration = new AtomicLong();

    private volatile AppointmentStatus statusFilter;
    private volatile String error;

    protected RoleScopedAppointments(AppointmentService service, Actor actor, UserRole expectedRole) {
        this.service = Objects.requireNonNull(service, "service");
        this.actor = Objects.requireNonNull(actor, "actor");
        if (actor.getRole() != expectedRole) {
            throw new IllegalArgumentException(
                    getClass().getSimpleName() + " requires a " + expectedRole + " actor, got " + actor.getRole());
        }
    }

    public List<Appointment> getAppointments() {
        synchronized (lock) {
            return Collections.unmodifiableList(new ArrayList<>(appointments));
        }
    }

    public Optional<Appointment> find(Long appointmentId) {
        synchronized (lock) {
            return appointments.stream().filter(a -> a.getId().equals(appointmentId)).findFirst();
        }
    }

    public AppointmentStatus getStatusFilter() {
        return statusFilter;
    }

    public boolean isBusy() {
        return busy.get() > 0;
    }

    public String getError() {
        return error;
    }

    public void clearError() {
        error = null;
    }

    public Actor getActor() {
        return actor;
    }

    /**
     * Reloads the list for the current filter. A load that finishes after a newer load started is discarded.
     */
    public boolean load() {
        long generation = loadGeneration.incrementAndGet();
        AppointmentStatus filter = statusFilter;
        busy.incrementAndGet();
        try {
            List<Appointment> loaded = service.listForRole(actor, filter);
            synchronized (lock) {
                if (generation != loadGeneration.get()) {
                    log.debug("Discarding stale load for {} {}", actor.getRole(), actor.getUserId());
                    return true;
                }
                appointments.clear();
                appointments.addAll(loaded);
            }
            error = null;
            log.debug("Loaded {} appointments for {} {}", loaded.size(), actor.getRole(), actor.getUserId());
            return true;
        } catch (RuntimeException e) {
            fail("load", null, e);
            return false;
        } finally {
            busy.decrementAndGet();
        }
    }

    /**
     * Changes the filter and reloads from the service. Null means every status.
     */
    public boolean setStatusFilter(AppointmentStatus filter) {
        if (statusFilter == filter) {
            return true;
        }
        statusFilter = filter;
        log.debug("Status filter for {} {} changed to {}", actor.getRole(), actor.getUserId(),
                filter == null ? "all" : filter.wireValue());
        return load();
    }

    protected boolean changeStatus(Long appointmentId, AppointmentStatus target, String reason) {
        return mutateRecord(appointmentId, "setStatus",
                current -> current.toBuilder().status(target).build(),
                () -> service.setStatus(appointmentId, target, actor, reason));
    }

    protected boolean moveTo(Long appointmentId, Instant newDateTime) {
        return mutateRecord(appointmentId, "reschedule",
                current -> current.toBuilder().dateTime(newDateTime).build(),
                () -> service.reschedule(appointmentId, newDateTime, actor));
    }

    /**
     * Runs a mutation of one cached record: the record is patched locally first, replaced by the
     * service's result on success and restored on failure.
     */
    protected boolean mutateRecord(Long appointmentId, String operation,
                                   UnaryOperator<Appointment> optimisticChange,
                                   Supplier<Appointment> action) {
        if (!claim(appointmentId)) {
            return false;
        }
        busy.incrementAndGet();
        long generation = loadGeneration.get();
        try {
            OptimisticUpdate.<Appointment, Appointment>of(
                    () -> find(appointmentId).orElse(null),
                    () -> find(appointmentId).ifPresent(current -> replace(optimisticChange.apply(current))),
                    this::applyCommitted,
                    snapshot -> {
                        if (snapshot != null && !reloadedSince(generation, appointmentId)) replace(snapshot);
                    }
            ).run(action);
            error = null;
            return true;
        } catch (RuntimeException e) {
            fail(operation, appointmentId, e);
            return false;
        } finally {
            busy.decrementAndGet();
            inFlight.remove(appointmentId);
        }
    }

    protected boolean removeRecord(Long appointmentId, Runnable action) {
        if (!claim(appointmentId)) {
            return false;
        }
        busy.incrementAndGet();
        long generation = loadGeneration.get();
        try {
            OptimisticUpdate.<IndexedRecord, Boolean>of(
                    () -> indexOf(appointmentId),
                    () -> remove(appointmentId),
                    done -> { },
                    snapshot -> {
                        if (snapshot != null && !reloadedSince(generation, appointmentId)) restore(snapshot);
                    }
            ).run(() -> {
                action.run();
                return Boolean.TRUE;
            });
            error = null;
            return true;
        } catch (RuntimeException e) {
            fail("delete", appointmentId, e);
            return false;
        } finally {
            busy.decrementAndGet();
            inFlight.remove(appointmentId);
        }
    }

    private boolean reloadedSince(long generation, Long appointmentId) {
        if (loadGeneration.get() == generation) {
            return false;
        }
        log.debug("Keeping reloaded copy of appointment {} instead of reverting", appointmentId);
        return true;
    }

    private boolean claim(Long appointmentId) {
        if (appointmentId == null) {
            error = "Appointment id is required.";
            return false;
        }
        if (!inFlight.add(appointmentId)) {
            log.warn("Rejected update of appointment {}: another update is in flight", appointmentId);
            error = IN_PROGRESS_MESSAGE;
            return false;
        }
        return true;
    }

    /**
     * Adds a record created through this view if it matches the current filter.
     */
    protected void insert(Appointment appointment) {
        AppointmentStatus filter = statusFilter;
        if (filter != null && appointment.getStatus() != filter) return;
        synchronized (lock) {
            appointments.removeIf(a -> a.getId().equals(appointment.getId()));
            appointments.add(appointment);
            appointments.sort(BY_DATE_TIME);
        }
    }

    protected void fail(String operation, Long appointmentId, RuntimeException e) {
        if (e instanceof StoreException && !(e instanceof VersionConflictException)) {
            log.error("{} failed for appointment {} ({} {})", operation, appointmentId,
                    actor.getRole(), actor.getUserId(), e);
            error = StoreException.RETRY_MESSAGE;
        } else if (e instanceof AppointmentException) {
            log.warn("{} rejected for appointment {} ({} {}): {}", operation, appointmentId,
                    actor.getRole(), actor.getUserId(), e.getMessage());
            error = e.getMessage();
        } else {
            log.error("Unexpected error during {} for appointment {}", operation, appointmentId, e);
            error = UNEXPECTED_MESSAGE;
        }
    }

    /**
     * The committed record replaces the cached one, or drops out when it no longer matches the filter.
     */
    private void applyCommitted(Appointment updated) {
        AppointmentStatus filter = statusFilter;
        if (filter != null && updated.getStatus() != filter) {
            remove(updated.getId());
        } else {
            replace(updated);
        }
    }

    private void replace(Appointment appointment) {
        synchronized (lock) {
            for (int i = 0; i < appointments.size(); i++) {
                if (appointments.get(i).getId().equals(appointment.getId())) {
                    appointments.set(i, appointment);
                    return;
                }
            }
        }
    }

    private void remove(Long appointmentId) {
        synchronized (lock) {
            appointments.removeIf(a -> a.getId().equals(appointmentId));
        }
    }

    private IndexedRecord indexOf(Long appointmentId) {
        synchronized (lock) {
            for (int i = 0; i < appointments.size(); i++) {
                if (appointments.get(i).getId().equals(appointmentId)) {
                    return new IndexedRecord(i, appointments.get(i));
                }
            }
            return null;
        }
    }

    private void restore(IndexedRecord snapshot) {
        synchronized (lock) {
            if (appointments.stream().anyMatch(a -> a.getId().equals(snapshot.record.getId()))) return;
            appointments.add(Math.min(snapshot.index, appointments.size()), snapshot.record);
        }
    }

    private static final class IndexedRecord {
        private final int index;
        private final Appointment record;

        private IndexedRecord(int index, Appointment record) {
            this.index = index;
            this.record = record;
        }
    }
}
