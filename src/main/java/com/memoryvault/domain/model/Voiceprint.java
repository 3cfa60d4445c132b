package com.memoryvault.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One enrollment of a principal's voice: the averaged embedding of the
 * samples supplied in a single enrollment call, encrypted at rest.
 *
 * <p>Immutable. A principal may hold several; they are only removed when the
 * account is deleted.
 */
@Value
@Builder
public class Voiceprint {
    @NonNull UUID id;
    @NonNull String ownerId;
    @NonNull EncryptedValue embedding;
    @NonNull String modelVersion;
    @NonNull Instant enrolledAt;
    String deviceHint;
    double enrollmentConfidence;
    int sampleCount;
}
