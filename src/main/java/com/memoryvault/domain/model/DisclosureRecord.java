package com.memoryvault.domain.model;

import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Designated Disclosure Record.
 *
 * <p>A private disclosure readable by its owner and at most one designated
 * reader, optionally naming a romantic target. When the target has made a
 * reciprocal disclosure, both records are matched and each owner becomes a
 * reader of the other's record.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>readers = {owner} ∪ {designated reader} ∪ ({matchedWith} iff matched)</li>
 *   <li>At most one designated reader; assigning replaces</li>
 *   <li>A match is never reversed; clearing the target keeps the grant</li>
 * </ul>
 *
 * <p>Only {@code MutualDisclosureMatcher} calls {@link #markMatched}, and it
 * does so for both sides of a pair under one lock.
 *
 * @since 1.0.0
 */
public class DisclosureRecord {

    @Getter
    private final UUID id;

    @Getter
    private final String title;

    @Getter
    private final EncryptedValue content;

    @Getter
    private final String ownerId;

    @Getter
    private final boolean romanticIntent;

    @Getter
    private final Instant createdAt;

    private String designatedReaderId;

    private String targetPrincipalId;

    private String targetName;

    private boolean matched;

    private Instant matchedAt;

    private String matchedWith;

    private DisclosureRecord(
            UUID id,
            String title,
            EncryptedValue content,
            String ownerId,
            boolean romanticIntent,
            String targetPrincipalId,
            String targetName,
            Instant createdAt) {
        this.id = id;
        this.title = title;
        this.content = content;
        this.ownerId = ownerId;
        this.romanticIntent = romanticIntent;
        this.targetPrincipalId = targetPrincipalId;
        this.targetName = targetName;
        this.createdAt = createdAt;
    }

    public static DisclosureRecord create(
            UUID id,
            String title,
            EncryptedValue content,
            String ownerId,
            boolean romanticIntent,
            String targetPrincipalId,
            String targetName,
            Instant createdAt) {

        Objects.requireNonNull(id, "Record id must not be null");
        Objects.requireNonNull(content, "Content must not be null");
        Objects.requireNonNull(createdAt, "Creation time must not be null");
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title must not be blank");
        }
        String target = targetPrincipalId != null && !targetPrincipalId.isBlank() ? targetPrincipalId : null;
        if (ownerId.equals(target)) {
            throw new IllegalArgumentException("A disclosure cannot target its own owner");
        }

        return new DisclosureRecord(id, title.strip(), content, ownerId, romanticIntent, target, targetName, createdAt);
    }

    /**
     * Replaces the designated reader.
     *
     * @return false if {@code readerId} already was the designated reader
     */
    public synchronized boolean assignDesignatedReader(String readerId) {
        if (readerId == null || readerId.isBlank()) {
            throw new IllegalArgumentException("Reader id must not be blank");
        }
        if (ownerId.equals(readerId)) {
            throw new IllegalArgumentException("The owner cannot be the designated reader");
        }
        if (readerId.equals(designatedReaderId)) {
            return false;
        }
        designatedReaderId = readerId;
        return true;
    }

    public synchronized void clearDesignatedReader() {
        designatedReaderId = null;
    }

    /**
     * Drops the romantic target. An existing match, and the counterpart's
     * read access, stay as they are.
     */
    public synchronized void clearTarget() {
        targetPrincipalId = null;
        targetName = null;
    }

    public synchronized void markMatched(String counterpartId, Instant at) {
        Objects.requireNonNull(counterpartId, "Counterpart must not be null");
        Objects.requireNonNull(at, "Match time must not be null");
        if (matched) {
            throw new IllegalStateException("Disclosure " + id + " is already matched");
        }
        matched = true;
        matchedAt = at;
        matchedWith = counterpartId;
    }

    /**
     * True for a romantic disclosure whose current target is {@code principalId}.
     */
    public synchronized boolean isRomanticTowards(String principalId) {
        return romanticIntent && principalId.equals(targetPrincipalId);
    }

    public synchronized Set<String> readers() {
        Set<String> readers = new LinkedHashSet<>();
        readers.add(ownerId);
        if (designatedReaderId != null) {
            readers.add(designatedReaderId);
        }
        if (matched) {
            readers.add(matchedWith);
        }
        return Set.copyOf(readers);
    }

    public boolean canRead(String principalId) {
        return principalId != null && readers().contains(principalId);
    }

    public boolean isOwnedBy(String principalId) {
        return ownerId.equals(principalId);
    }

    public synchronized Optional<String> getDesignatedReaderId() {
        return Optional.ofNullable(designatedReaderId);
    }

    public synchronized Optional<String> getTargetPrincipalId() {
        return Optional.ofNullable(targetPrincipalId);
    }

    public synchronized Optional<String> getTargetName() {
        return Optional.ofNullable(targetName);
    }

    public synchronized boolean isMatched() {
        return matched;
    }

    public synchronized Optional<Instant> getMatchedAt() {
        return Optional.ofNullable(matchedAt);
    }

    public synchronized Optional<String> getMatchedWith() {
        return Optional.ofNullable(matchedWith);
    }

    @Override
    public synchronized String toString() {
        return String.format("DisclosureRecord[id=%s, owner=%s, romantic=%s, matched=%s]",
            id, ownerId, romanticIntent, matched);
    }
}
