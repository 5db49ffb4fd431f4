package com.mamacare.appointments.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentRequest {

    /** Optional, defaults to the caller. */
    private String patientId;

    private String doctorId;

    private String reason;

    private Instant dateTime;

    private String notes;
}
