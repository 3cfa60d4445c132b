package com.memoryvault.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One voice or challenge verification attempt, kept so a principal can review
 * who tried to open their account.
 *
 * <p>{@code band} is null when the attempt was refused before a score was
 * computed. {@code reason} is null for successful attempts and for those that
 * moved on to a challenge.
 */
@Value
@Builder
public class AuthenticationAttempt {
    @NonNull UUID id;
    @NonNull String principalId;
    @NonNull String channelId;
    @NonNull Instant attemptedAt;
    double score;
    ConfidenceBand band;
    boolean success;
    DenialReason reason;
    boolean challengeRequired;
    boolean challengePassed;
}
