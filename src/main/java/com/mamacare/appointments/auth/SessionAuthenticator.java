package com.mamacare.appointments.auth;

import com.mamacare.appointments.entity.UserAccount;
import com.mamacare.appointments.repository.UserAccountRepository;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the calling user from the {@code X-User-Id} header. Identity itself is established
 * upstream; this only looks the id up and attaches its role.
 */
@Component
public class SessionAuthenticator {

    public static final String USER_HEADER = "X-User-Id";

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

    private final UserAccountRepository userAccountRepository;

    public SessionAuthenticator(UserAccountRepository userAccountRepository) {
        this.userAccountRepository = userAccountRepository;
    }

    public Actor currentActor(HttpServletRequest request) {
        return resolve(request.getHeader(USER_HEADER));
    }

    public Actor resolve(String userId) {
        if (StringUtils.isBlank(userId)) {
            return Actor.anonymous();
        }
        Optional<UserAccount> account = userAccountRepository.findByIdAndActiveTrue(userId.trim());
        if (!account.isPresent()) {
            log.warn("No active account for user id {}", userId);
            return Actor.anonymous();
        }
        return Actor.of(account.get().getId(), account.get().getRole());
    }
}
