package com.memoryvault.application;

import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.SessionResolution;
import com.memoryvault.domain.repository.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Read-side access to live sessions for every component that gates on one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionGuard {

    private final SessionStore sessionStore;
    private final Clock clock;

    public SessionResolution resolve(String sessionId) {
        return sessionStore.resolve(sessionId, Instant.now(clock));
    }

    /**
     * Resolves the session and additionally requires it to cover
     * {@code category}. Sessions opened without a category cover all.
     */
    public SessionResolution resolveFor(String sessionId, String category) {
        SessionResolution resolution = resolve(sessionId);
        if (resolution instanceof SessionResolution.Active active) {
            AuthSession session = active.getSession();
            if (category != null && !session.covers(category)) {
                log.warn("Session category mismatch: principal={}, bound={}, requested={}",
                    session.getPrincipalId(), session.getBoundCategory().orElse(null), category);
                return SessionResolution.rejected(DenialReason.CATEGORY_NOT_COVERED);
            }
        }
        return resolution;
    }

    public boolean logout(String sessionId) {
        boolean removed = sessionStore.remove(sessionId);
        if (removed) {
            log.info("Session closed by logout");
        }
        return removed;
    }
}
