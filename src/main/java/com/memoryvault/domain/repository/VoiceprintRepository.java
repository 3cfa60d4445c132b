package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.Voiceprint;

import java.util.List;

/**
 * Domain repository for enrolled voiceprints (logical table {@code voiceprints}).
 * Voiceprints are append-only; the only removal path is account deletion.
 */
public interface VoiceprintRepository {

    void append(Voiceprint voiceprint);

    List<Voiceprint> findByOwner(String ownerId);

    /**
     * @return number of voiceprints removed
     */
    int deleteByOwner(String ownerId);
}
