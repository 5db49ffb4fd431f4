package com.mamacare.appointments.directory;

import java.util.List;
import java.util.Optional;

public interface DoctorDirectory {

    boolean exists(String doctorId);

    Optional<DoctorSummary> find(String doctorId);

    /**
     * Active doctors, optionally restricted to one specialty (case-insensitive).
     */
    List<DoctorSummary> listAvailable(String specialtyFilter);
}
