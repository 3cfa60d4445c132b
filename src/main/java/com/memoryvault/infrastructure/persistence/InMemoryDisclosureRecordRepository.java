package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.DisclosureRecord;
import com.memoryvault.domain.repository.DisclosureRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory adapter for the {@code disclosure_records} table.
 */
@Component
@Slf4j
public class InMemoryDisclosureRecordRepository implements DisclosureRecordRepository {

    private final Map<UUID, DisclosureRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<DisclosureRecord> findById(UUID id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public List<DisclosureRecord> findByOwner(String ownerId) {
        return records.values().stream()
            .filter(record -> record.isOwnedBy(ownerId))
            .sorted(Comparator.comparing(DisclosureRecord::getCreatedAt))
            .toList();
    }

    @Override
    public void save(DisclosureRecord record) {
        records.put(record.getId(), record);
        log.info("Disclosure persisted: id={}, owner={}", record.getId(), record.getOwnerId());
    }

    @Override
    public void saveAll(List<DisclosureRecord> batch) {
        batch.forEach(record -> records.put(record.getId(), record));
        log.info("Disclosures persisted: count={}", batch.size());
    }

    @Override
    public boolean delete(UUID id) {
        boolean removed = records.remove(id) != null;
        if (removed) {
            log.warn("Disclosure deleted: id={}", id);
        }
        return removed;
    }
}
