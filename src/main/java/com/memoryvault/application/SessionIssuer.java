package com.memoryvault.application;

import com.memoryvault.config.AuthProperties;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.SessionFactor;
import com.memoryvault.domain.repository.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Set;

/**
 * Opens sessions for the authenticator and the challenge issuer. Expiry is
 * fixed at issue time; there is no refresh.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionIssuer {

    private static final int SESSION_ID_BYTES = 32;

    private final SessionStore sessionStore;
    private final AuthProperties properties;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public AuthSession open(
            String principalId,
            String channelId,
            double confidence,
            Set<SessionFactor> factors,
            String boundCategory) {

        Instant issuedAt = Instant.now(clock);
        AuthSession session = AuthSession.builder()
            .sessionId(newSessionId())
            .principalId(principalId)
            .channelId(channelId)
            .issuedAt(issuedAt)
            .expiresAt(issuedAt.plus(properties.getSessionTtl()))
            .confidence(confidence)
            .factors(factors)
            .boundCategory(boundCategory)
            .build();
        sessionStore.save(session);

        log.info("Session opened: principal={}, channel={}, factors={}, confidence={}, expiresAt={}",
            principalId, channelId, session.getFactors(),
            String.format("%.3f", confidence), session.getExpiresAt());
        return session;
    }

    private String newSessionId() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
