package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.SecretRecord;
import com.memoryvault.domain.repository.SecretRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory adapter for the {@code secret_records} table. Records are held
 * by reference, so access-log appends are visible without a re-save.
 * Retired records move to a second map and are never dropped.
 */
@Component
@Slf4j
public class InMemorySecretRecordRepository implements SecretRecordRepository {

    private final Map<UUID, SecretRecord> records = new ConcurrentHashMap<>();

    private final Map<UUID, SecretRecord> retired = new ConcurrentHashMap<>();

    @Override
    public Optional<SecretRecord> findById(UUID id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<SecretRecord> findByOwner(String ownerId) {
        return records.values().stream()
            .filter(record -> record.isOwnedBy(ownerId))
            .sorted(Comparator.comparing(SecretRecord::getCreatedAt))
            .toList();
    }

    @Override
    public void save(SecretRecord record) {
        records.put(record.getId(), record);
        log.info("Secret record persisted: id={}, tier={}, owner={}",
            record.getId(), record.getTier(), record.getOwnerId());
    }

    @Override
    public Optional<SecretRecord> findRetiredById(UUID id) {
        return Optional.ofNullable(retired.get(id));
    }

    @Override
    public void replace(UUID retiredId, SecretRecord replacement) {
        records.put(replacement.getId(), replacement);
        retire(retiredId);
        log.info("Secret record replaced: retired={}, id={}, tier={}",
            retiredId, replacement.getId(), replacement.getTier());
    }

    @Override
    public boolean delete(UUID id) {
        boolean removed = retire(id);
        if (removed) {
            log.warn("Secret record deleted: id={}", id);
        }
        return removed;
    }

    private boolean retire(UUID id) {
        SecretRecord record = records.remove(id);
        if (record == null) {
            return false;
        }
        retired.put(id, record);
        return true;
    }
}
