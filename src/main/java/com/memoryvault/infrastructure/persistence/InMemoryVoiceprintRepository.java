package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.Voiceprint;
import com.memoryvault.domain.repository.VoiceprintRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory adapter for the {@code voiceprints} table.
 */
@Component
@Slf4j
public class InMemoryVoiceprintRepository implements VoiceprintRepository {

    private final Map<String, List<Voiceprint>> byOwner = new ConcurrentHashMap<>();

    @Override
    public void append(Voiceprint voiceprint) {
        byOwner.computeIfAbsent(voiceprint.getOwnerId(), owner -> new CopyOnWriteArrayList<>())
            .add(voiceprint);
        log.info("Voiceprint persisted: id={}, owner={}, model={}",
            voiceprint.getId(), voiceprint.getOwnerId(), voiceprint.getModelVersion());
    }

    @Override
    public List<Voiceprint> findByOwner(String ownerId) {
        List<Voiceprint> voiceprints = byOwner.get(ownerId);
        return voiceprints != null ? List.copyOf(voiceprints) : List.of();
    }

    @Override
    public int deleteByOwner(String ownerId) {
        List<Voiceprint> removed = byOwner.remove(ownerId);
        int count = removed != null ? removed.size() : 0;
        log.warn("Voiceprints deleted: owner={}, count={}", ownerId, count);
        return count;
    }
}
