package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.SessionResolution;

import java.time.Instant;

/**
 * Table of live authentication sessions (logical table {@code auth_sessions}).
 *
 * <p>Implementations must evaluate expiry on every read: a session whose
 * expiry is not after {@code now} is never returned as active, however late
 * the background sweep runs. Concurrent readers must be supported.
 */
public interface SessionStore {

    void save(AuthSession session);

    /**
     * Looks a session up at {@code now}. An expired entry is removed and
     * reported as {@code SESSION_EXPIRED}; an unknown id as
     * {@code SESSION_NOT_FOUND}.
     */
    SessionResolution resolve(String sessionId, Instant now);

    boolean remove(String sessionId);

    int removeByPrincipal(String principalId);

    /**
     * Drops every session expired at {@code now}. Memory reclamation only.
     *
     * @return number of sessions removed
     */
    int purgeExpired(Instant now);

    int size();
}
