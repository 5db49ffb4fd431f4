package com.mamacare.appointments.exception;

import lombok.Getter;

/**
 * The caller is not authenticated, or is authenticated with a role or identity that may not
 * touch the record.
 */
@Getter
public class AuthException extends AppointmentException {

    private final boolean authenticated;

    public AuthException(String message) {
        this(message, true);
    }

    public AuthException(String message, boolean authenticated) {
        super(message);
        this.authenticated = authenticated;
    }

    public static AuthException unauthenticated() {
        return new AuthException("You must be logged in to manage appointments.", false);
    }
}
