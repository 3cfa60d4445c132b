package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.MemorySnapshot;

import java.util.List;

/**
 * Port to the external memory store, read by the challenge issuer.
 */
public interface MemoryRecordSource {

    /**
     * Most recent memories of {@code ownerId}, newest first.
     */
    List<MemorySnapshot> findRecent(String ownerId, int limit);
}
