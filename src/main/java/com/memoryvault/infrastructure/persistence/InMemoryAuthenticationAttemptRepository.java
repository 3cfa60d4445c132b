package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.AuthenticationAttempt;
import com.memoryvault.domain.repository.AuthenticationAttemptRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory adapter for the {@code authentication_logs} table. Each
 * principal's attempts are kept newest first.
 */
@Component
@Slf4j
public class InMemoryAuthenticationAttemptRepository implements AuthenticationAttemptRepository {

    private final Map<String, Deque<AuthenticationAttempt>> byPrincipal = new ConcurrentHashMap<>();

    @Override
    public void append(AuthenticationAttempt attempt) {
        byPrincipal.computeIfAbsent(attempt.getPrincipalId(), principal -> new ConcurrentLinkedDeque<>())
            .addFirst(attempt);
        log.debug("Authentication attempt persisted: principal={}, success={}",
            attempt.getPrincipalId(), attempt.isSuccess());
    }

    @Override
    public List<AuthenticationAttempt> findRecentByPrincipal(String principalId, int limit) {
        Deque<AuthenticationAttempt> attempts = byPrincipal.get(principalId);
        if (attempts == null || limit <= 0) {
            return List.of();
        }
        return attempts.stream().limit(limit).toList();
    }
}
