package com.mamacare.appointments.notification;

import com.mamacare.appointments.exception.NotificationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Hands notifications to the push backend, which looks up the user's device tokens and fans out.
 */
@Service
public class PushNotificationGateway implements NotificationGateway {

    private static final Logger log = LoggerFactory.getLogger(PushNotificationGateway.class);

    static final String NOTIFY_PATH = "/notify-user";

    private final RestTemplate restTemplate;

    private final String baseUrl;

    public PushNotificationGateway(
            RestTemplateBuilder builder,
            @Value("${notification.base-url:}") String baseUrl,
            @Value("${notification.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${notification.read-timeout-ms:15000}") long readTimeoutMs
    ) {
        this.restTemplate = builder
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .readTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
        this.baseUrl = StringUtils.removeEnd(StringUtils.trimToEmpty(baseUrl), "/");
    }

    @Override
    public void send(String targetUserId, String title, String body, Map<String, String> data) {
        if (StringUtils.isBlank(targetUserId)) {
            return;
        }
        if (baseUrl.isEmpty()) {
            log.warn("notification.base-url not set; skipping notification '{}' to {}", title, targetUserId);
            return;
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("user_id", targetUserId);
        payload.put("title", title);
        payload.put("body", body);
        payload.put("data", data == null ? Map.of() : data);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + NOTIFY_PATH, new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new NotificationException("Push backend returned " + response.getStatusCode()
                        + " for user " + targetUserId);
            }
            log.debug("Notification '{}' accepted for user {}", title, targetUserId);
        } catch (RestClientException e) {
            throw new NotificationException("Push backend unreachable for user " + targetUserId, e);
        }
    }
}
