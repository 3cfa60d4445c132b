package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.SecretRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Domain repository for {@link SecretRecord} aggregates (logical table
 * {@code secret_records}). The access log travels with the aggregate.
 *
 * <p>Reclassified and deleted records are retired, not erased: their ids stop
 * resolving through {@link #findById} but {@link #findRetiredById} still
 * returns them so their access logs stay available.
 */
public interface SecretRecordRepository {

    Optional<SecretRecord> findById(UUID id);

    List<SecretRecord> findByOwner(String ownerId);

    void save(SecretRecord record);

    /**
     * Retired record with this id, kept for its access log.
     */
    Optional<SecretRecord> findRetiredById(UUID id);

    /**
     * Stores {@code replacement}, then retires {@code retiredId}. The content
     * is never unreachable in between.
     */
    void replace(UUID retiredId, SecretRecord replacement);

    /**
     * Retires a record.
     *
     * @return false if no live record had this id
     */
    boolean delete(UUID id);
}
