package com.mamacare.appointments.entity;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum AppointmentStatus {

    /** Patient requested, doctor hasn't responded. */
    PENDING("Pending Confirmation"),
    CONFIRMED("Confirmed"),
    /** Logistics confirmed by the doctor or the assigned nurse. */
    SCHEDULED("Scheduled"),
    COMPLETED("Completed"),
    CANCELLED("Cancelled by Patient"),
    DECLINED("Declined by Doctor");

    private static final Logger log = LoggerFactory.getLogger(AppointmentStatus.class);

    private final String displayName;

    AppointmentStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == DECLINED;
    }

    /** Lower-case wire value, e.g. {@code "confirmed"}. */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes a stored or submitted status string. Null, blank and unknown values
     * fall back to {@link #PENDING} so that a record is never read as terminal by accident.
     */
    public static AppointmentStatus fromString(String value) {
        if (StringUtils.isBlank(value)) {
            return PENDING;
        }
        for (AppointmentStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        log.warn("Could not parse appointment status '{}', defaulting to pending", value);
        return PENDING;
    }

    /**
     * Strict variant for client input: returns null instead of falling back.
     */
    public static AppointmentStatus parseOrNull(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        for (AppointmentStatus status : values()) {
            if (status.name().equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
