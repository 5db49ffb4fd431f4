package com.mamacare.appointments.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "appointment", indexes = {
    @Index(name = "idx_appointment_patient", columnList = "patient_id"),
    @Index(name = "idx_appointment_doctor", columnList = "doctor_id"),
    @Index(name = "idx_appointment_nurse", columnList = "nurse_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class Appointment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false, updatable = false, length = 64)
    private String patientId;

    @Column(name = "doctor_id", nullable = false, updatable = false, length = 64)
    private String doctorId;

    @Column(name = "nurse_id", length = 64)
    private String nurseId;

    /** Captured at creation time, display only. */
    @Column(name = "patient_name", nullable = false, length = 100)
    private String patientName;

    @Column(name = "doctor_name", nullable = false, length = 100)
    private String doctorName;

    @Column(name = "date_time", nullable = false)
    private Instant dateTime;

    @Column(nullable = false, length = 500)
    private String reason;

    @Column(length = 2000)
    private String notes;

    @Convert(converter = AppointmentStatusConverter.class)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private AppointmentStatus status = AppointmentStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /** Compare-and-swap token, bumped on every update. */
    @Version
    private Long version;
}
