package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.MemorySnapshot;
import com.memoryvault.domain.repository.MemoryRecordSource;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory stand-in for the external memory store.
 */
@Component
public class InMemoryMemoryRecordSource implements MemoryRecordSource {

    private final Map<String, List<MemorySnapshot>> byOwner = new ConcurrentHashMap<>();

    @Override
    public List<MemorySnapshot> findRecent(String ownerId, int limit) {
        List<MemorySnapshot> memories = byOwner.getOrDefault(ownerId, List.of());
        return memories.stream()
            .sorted(Comparator.comparing(MemorySnapshot::getCreatedAt).reversed())
            .limit(limit)
            .toList();
    }

    public void add(MemorySnapshot memory) {
        byOwner.computeIfAbsent(memory.getOwnerId(), owner -> new CopyOnWriteArrayList<>()).add(memory);
    }
}
