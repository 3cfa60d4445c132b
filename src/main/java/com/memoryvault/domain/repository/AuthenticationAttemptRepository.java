package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.AuthenticationAttempt;

import java.util.List;

/**
 * Domain repository for verification attempts (logical table
 * {@code authentication_logs}). Append-only.
 */
public interface AuthenticationAttemptRepository {

    void append(AuthenticationAttempt attempt);

    /**
     * @return at most {@code limit} attempts, newest first
     */
    List<AuthenticationAttempt> findRecentByPrincipal(String principalId, int limit);
}
