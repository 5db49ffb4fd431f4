package com.mamacare.appointments.auth;

import com.mamacare.appointments.entity.UserRole;
import lombok.Value;

/**
 * The authenticated identity performing an operation.
 */
@Value
public class Actor {

    String userId;
    UserRole role;

    public static Actor of(String userId, UserRole role) {
        return new Actor(userId, role == null ? UserRole.UNKNOWN : role);
    }

    public static Actor patient(String userId) {
        return new Actor(userId, UserRole.PATIENT);
    }

    public static Actor doctor(String userId) {
        return new Actor(userId, UserRole.DOCTOR);
    }

    public static Actor nurse(String userId) {
        return new Actor(userId, UserRole.NURSE);
    }

    public static Actor anonymous() {
        return new Actor(null, UserRole.UNKNOWN);
    }

    public boolean isAuthenticated() {
        return userId != null && role != UserRole.UNKNOWN;
    }
}
