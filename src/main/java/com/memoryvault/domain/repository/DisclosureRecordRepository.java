package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.DisclosureRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Domain repository for disclosure records (logical table {@code disclosure_records}).
 */
public interface DisclosureRecordRepository {

    Optional<DisclosureRecord> findById(UUID id);

    List<DisclosureRecord> findByOwner(String ownerId);

    void save(DisclosureRecord record);

    /**
     * Persists the two sides of a match together.
     */
    void saveAll(List<DisclosureRecord> records);

    boolean delete(UUID id);
}
