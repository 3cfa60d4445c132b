package com.memoryvault.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Time-boxed proof that a principal authenticated on a channel.
 *
 * <p>A session is valid iff {@code now < expiresAt}. There is no refresh:
 * once expired, a new verification is required. Callers hold the session id
 * only; the session itself is owned by the {@code SessionStore}.
 *
 * @since 1.0.0
 */
@Value
public class AuthSession {

    String sessionId;
    String principalId;
    String channelId;
    Instant issuedAt;
    Instant expiresAt;
    double confidence;

    /**
     * Factors satisfied, in {@link SessionFactor} declaration order.
     */
    Set<SessionFactor> factors;

    /**
     * Memory category the session was opened for, or null for any.
     */
    String boundCategory;

    @Builder
    private AuthSession(
            String sessionId,
            String principalId,
            String channelId,
            Instant issuedAt,
            Instant expiresAt,
            double confidence,
            Collection<SessionFactor> factors,
            String boundCategory) {

        this.sessionId = Objects.requireNonNull(sessionId, "Session id must not be null");
        this.principalId = Objects.requireNonNull(principalId, "Principal id must not be null");
        this.channelId = Objects.requireNonNull(channelId, "Channel id must not be null");
        this.issuedAt = Objects.requireNonNull(issuedAt, "Issue time must not be null");
        this.expiresAt = Objects.requireNonNull(expiresAt, "Expiry must not be null");
        if (!expiresAt.isAfter(issuedAt)) {
            throw new IllegalArgumentException("Session must expire after it is issued");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0, 1]");
        }
        if (factors == null || factors.isEmpty()) {
            throw new IllegalArgumentException("A session needs at least one factor");
        }
        this.confidence = confidence;
        this.factors = Collections.unmodifiableSet(EnumSet.copyOf(factors));
        this.boundCategory = boundCategory;
    }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    public boolean hasFactor(SessionFactor factor) {
        return factors.contains(factor);
    }

    public Optional<String> getBoundCategory() {
        return Optional.ofNullable(boundCategory);
    }

    /**
     * True when the session may be used for {@code category}: unbound
     * sessions cover every category.
     */
    public boolean covers(String category) {
        return boundCategory == null || boundCategory.equalsIgnoreCase(category);
    }

    public Duration remainingAt(Instant now) {
        Duration remaining = Duration.between(now, expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
