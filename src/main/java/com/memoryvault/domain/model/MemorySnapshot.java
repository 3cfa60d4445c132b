package com.memoryvault.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only view of one of a principal's own memories, as supplied by the
 * external memory store. Used to build knowledge challenges.
 */
@Value
@Builder
public class MemorySnapshot {
    @NonNull String id;
    @NonNull String ownerId;
    @NonNull String category;
    @NonNull String content;
    @NonNull Instant createdAt;

    /** Person the memory is about, when known. */
    String relatedPerson;

    /** That person's relationship to the owner, e.g. "sister". */
    String relationship;
}
