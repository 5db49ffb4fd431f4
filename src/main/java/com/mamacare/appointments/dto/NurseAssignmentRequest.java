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
public class NurseAssignmentRequest {

    /** Null or blank clears the assignment. */
    private String nurseId;
}
