package com.mamacare.appointments.notification;

import com.mamacare.appointments.exception.NotificationException;

import java.util.Map;

/**
 * Delivers a push message to every device registered for a user. Retry, if any, is the
 * gateway's own business.
 */
public interface NotificationGateway {

    /**
     * @throws NotificationException if the message could not be handed to the push backend
     */
    void send(String targetUserId, String title, String body, Map<String, String> data);
}
