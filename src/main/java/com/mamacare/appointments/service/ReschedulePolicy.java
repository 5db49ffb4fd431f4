package com.mamacare.appointments.service;

/**
 * What a reschedule does to the status of the record.
 */
public enum ReschedulePolicy {

    /** Only the date moves. */
    KEEP_STATUS,

    /** A patient moving a confirmed appointment sends it back to pending for re-confirmation. */
    RESET_TO_PENDING
}
