package com.mamacare.appointments.store;

import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.entity.UserRole;
import com.mamacare.appointments.exception.NotFoundException;
import com.mamacare.appointments.exception.StoreException;
import com.mamacare.appointments.exception.VersionConflictException;

import java.util.List;

/**
 * Persistence of appointment records. Implementations assign ids and timestamps and guard
 * updates with the record version.
 *
 * <p>Every method may throw {@link StoreException} on backing failures or timeouts.
 */
public interface AppointmentStore {

    /**
     * Persists a new record and returns it as stored, with its assigned id. {@code createdAt},
     * {@code updatedAt} and {@code version} are set by the store.
     */
    Appointment create(Appointment appointment);

    /**
     * @throws NotFoundException if no record has this id
     */
    Appointment get(Long id);

    /**
     * Records in which {@code userId} is the participant named by {@code roleHint}, ordered by
     * {@code dateTime} ascending. A null {@code statusFilter} returns every status.
     */
    List<Appointment> listByParticipant(String userId, UserRole roleHint, AppointmentStatus statusFilter);

    /**
     * Applies the patch only if the stored version still equals {@code expectedVersion}.
     *
     * @throws VersionConflictException if the record changed since it was read
     * @throws NotFoundException if the record no longer exists
     */
    Appointment updateFields(Long id, AppointmentPatch patch, Long expectedVersion);

    /**
     * @throws NotFoundException if no record has this id
     */
    void delete(Long id);
}
