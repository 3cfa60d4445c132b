package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.repository.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically drops expired sessions. Correctness never depends on this
 * running: {@link SessionStore#resolve} rejects expired sessions on its own.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionSweeper {

    private final SessionStore sessionStore;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${memoryvault.auth.session-sweep-interval:60000}")
    public void sweep() {
        int purged = sessionStore.purgeExpired(Instant.now(clock));
        if (purged > 0 && log.isInfoEnabled()) {
            log.info("Purged {} expired session(s), {} live", purged, sessionStore.size());
        }
    }
}
