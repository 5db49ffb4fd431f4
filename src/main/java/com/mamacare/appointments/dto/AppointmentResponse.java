package com.mamacare.appointments.dto;

import com.mamacare.appointments.entity.Appointment;
import com.mamacare.appointments.entity.AppointmentStatus;
import com.mamacare.appointments.policy.StatusPolicy;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class AppointmentResponse {

    private final Long id;
    private final String patientId;
    private final String doctorId;
    private final String nurseId;
    private final String patientName;
    private final String doctorName;
    private final Instant dateTime;
    private final String reason;
    private final String notes;
    private final String status;
    private final String statusDisplayName;
    private final Instant createdAt;
    private final Instant updatedAt;

    private final boolean approvable;
    private final boolean cancellable;
    private final boolean completable;
    private final boolean reschedulable;
    private final boolean deletable;

    public static AppointmentResponse from(Appointment a) {
        AppointmentStatus status = a.getStatus();
        return AppointmentResponse.builder()
                .id(a.getId())
                .patientId(a.getPatientId())
                .doctorId(a.getDoctorId())
                .nurseId(a.getNurseId())
                .patientName(a.getPatientName())
                .doctorName(a.getDoctorName())
                .dateTime(a.getDateTime())
                .reason(a.getReason())
                .notes(a.getNotes())
                .status(status.wireValue())
                .statusDisplayName(status.getDisplayName())
                .createdAt(a.getCreatedAt())
                .updatedAt(a.getUpdatedAt())
                .approvable(StatusPolicy.canBeApprovedOrDeclined(status))
                .cancellable(StatusPolicy.canBeCancelled(status))
                .completable(StatusPolicy.canBeCompletedByDoctor(status))
                .reschedulable(StatusPolicy.canBeRescheduled(status))
                .deletable(StatusPolicy.canBeDeletedByDoctor(status))
                .build();
    }
}
