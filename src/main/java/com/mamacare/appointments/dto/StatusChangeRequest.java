package com.mamacare.appointments.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeRequest {

    private String status;

    /** Shown to the counterpart on decline or cancel. */
    private String reason;
}
