package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.SessionResolution;
import com.memoryvault.domain.repository.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory adapter for the {@code auth_sessions} table.
 *
 * <p>Expiry is decided on every {@link #resolve}; {@link #purgeExpired} only
 * reclaims memory.
 */
@Component
@Slf4j
public class InMemorySessionStore implements SessionStore {

    private final Map<String, AuthSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void save(AuthSession session) {
        sessions.put(session.getSessionId(), session);
        log.debug("Session stored: principal={}, channel={}, expiresAt={}",
            session.getPrincipalId(), session.getChannelId(), session.getExpiresAt());
    }

    @Override
    public SessionResolution resolve(String sessionId, Instant now) {
        if (sessionId == null || sessionId.isBlank()) {
            return SessionResolution.rejected(DenialReason.SESSION_NOT_FOUND);
        }
        AuthSession session = sessions.get(sessionId);
        if (session == null) {
            return SessionResolution.rejected(DenialReason.SESSION_NOT_FOUND);
        }
        if (!session.isValidAt(now)) {
            // only drop the exact entry we looked at
            sessions.remove(sessionId, session);
            log.debug("Session expired on read: principal={}", session.getPrincipalId());
            return SessionResolution.rejected(DenialReason.SESSION_EXPIRED);
        }
        return SessionResolution.active(session);
    }

    @Override
    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    @Override
    public int removeByPrincipal(String principalId) {
        return removeMatching(session -> session.getPrincipalId().equals(principalId));
    }

    @Override
    public int purgeExpired(Instant now) {
        return removeMatching(session -> !session.isValidAt(now));
    }

    @Override
    public int size() {
        return sessions.size();
    }

    private int removeMatching(Predicate<AuthSession> condition) {
        int removed = 0;
        for (Map.Entry<String, AuthSession> entry : sessions.entrySet()) {
            if (condition.test(entry.getValue()) && sessions.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }
}
