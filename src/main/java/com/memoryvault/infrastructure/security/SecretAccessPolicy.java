package com.memoryvault.infrastructure.security;

import com.memoryvault.domain.model.AccessBasis;
import com.memoryvault.domain.model.SecretRecord;

/**
 * Central authorization decision point for secret records.
 *
 * <p>Decisions are returned, not thrown: a refusal is {@link AccessBasis#NONE}.
 *
 * @since 1.0.0
 */
public interface SecretAccessPolicy {

    /**
     * Decide whether {@code requesterId} may read {@code record}. The first
     * matching rule wins: owner, explicit authorization, contact level.
     */
    AccessBasis authorizeRead(SecretRecord record, String requesterId);
}
