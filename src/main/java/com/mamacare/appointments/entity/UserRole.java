package com.mamacare.appointments.entity;

public enum UserRole {
    PATIENT,
    NURSE,
    DOCTOR,
    ADMIN,
    UNKNOWN
}
