package com.mamacare.appointments.store;

import com.mamacare.appointments.entity.AppointmentStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Field-level update applied by {@link AppointmentStore#updateFields}. Null fields are left untouched;
 * {@code clearNurse} explicitly removes the assigned nurse.
 */
@Getter
@Builder
@ToString
public class AppointmentPatch {

    private final AppointmentStatus status;

    private final Instant dateTime;

    private final String nurseId;

    private final boolean clearNurse;

    private final String notes;

    public static AppointmentPatch status(AppointmentStatus status) {
        return AppointmentPatch.builder().status(status).build();
    }
}
