package com.memoryvault.domain.model;

import lombok.AccessLevel;
import lombok.Getter;
import org.owasp.encoder.Encode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Secret Record Aggregate Root.
 *
 * <p>A secret stored at a fixed {@link SecretTier}, readable by its owner,
 * by explicitly authorized principals, and by contacts whose knowledge-access
 * level meets the tier minimum.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Tier, owner, content and the authorized list never change; changing
 *       sensitivity means creating a new record ({@link #reclassify})</li>
 *   <li>The access log is append-only and totally ordered by sequence</li>
 *   <li>Each append is atomic: readers see whole entries or none</li>
 * </ul>
 *
 * <p>Mutators synchronize on the record, giving single-writer semantics per
 * record while different records proceed independently.
 *
 * @since 1.0.0
 */
public class SecretRecord {

    private static final int MAX_TITLE_LENGTH = 200;

    @Getter
    private final UUID id;

    @Getter
    private final String title;

    @Getter
    private final SecretTier tier;

    @Getter
    private final String ownerId;

    @Getter
    private final EncryptedValue content;

    @Getter
    private final Set<String> authorizedPrincipals;

    @Getter
    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final List<AccessLogEntry> accessLog = new ArrayList<>();

    private long accessCount;

    private Instant lastAccessAt;

    private SecretRecord(
            UUID id,
            String title,
            SecretTier tier,
            String ownerId,
            EncryptedValue content,
            Set<String> authorizedPrincipals,
            Instant createdAt) {
        this.id = id;
        this.title = title;
        this.tier = tier;
        this.ownerId = ownerId;
        this.content = content;
        this.authorizedPrincipals = authorizedPrincipals;
        this.createdAt = createdAt;
    }

    /**
     * Factory for a freshly stored secret.
     *
     * @throws IllegalArgumentException if a required part is missing or the title is invalid
     */
    public static SecretRecord create(
            UUID id,
            String title,
            SecretTier tier,
            String ownerId,
            EncryptedValue content,
            Set<String> authorizedPrincipals,
            Instant createdAt) {

        Objects.requireNonNull(id, "Record id must not be null");
        Objects.requireNonNull(tier, "Tier must not be null");
        Objects.requireNonNull(content, "Content must not be null");
        Objects.requireNonNull(createdAt, "Creation time must not be null");
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Owner id must not be blank");
        }

        Set<String> authorized = authorizedPrincipals != null
            ? Set.copyOf(authorizedPrincipals)
            : Set.of();
        authorized.forEach(principal -> {
            if (principal.isBlank()) {
                throw new IllegalArgumentException("Authorized principal id must not be blank");
            }
        });

        return new SecretRecord(id, validateTitle(title), tier, ownerId, content, authorized, createdAt);
    }

    /**
     * Copies this secret to a new id at another tier. The caller is
     * responsible for invalidating this record's id.
     */
    public SecretRecord reclassify(UUID newId, SecretTier newTier, Instant at) {
        return create(newId, title, newTier, ownerId, content, authorizedPrincipals, at);
    }

    public boolean isOwnedBy(String principalId) {
        return ownerId.equals(principalId);
    }

    public boolean isExplicitlyAuthorized(String principalId) {
        return authorizedPrincipals.contains(principalId);
    }

    /**
     * Appends one audit entry. Successful attempts also bump the access
     * counter and the last-access time.
     *
     * <p>Timestamps never go backwards within a record even if the wall clock
     * does.
     */
    public synchronized AccessLogEntry recordAttempt(
            String principalId,
            Instant at,
            boolean success,
            String reason) {

        Instant timestamp = at;
        if (!accessLog.isEmpty()) {
            Instant previous = accessLog.get(accessLog.size() - 1).getTimestamp();
            if (timestamp.isBefore(previous)) {
                timestamp = previous;
            }
        }

        AccessLogEntry entry = new AccessLogEntry(
            accessLog.size() + 1L,
            id,
            principalId,
            timestamp,
            success,
            reason
        );
        accessLog.add(entry);

        if (success) {
            accessCount++;
            lastAccessAt = timestamp;
        }
        return entry;
    }

    public synchronized List<AccessLogEntry> getAccessLog() {
        return List.copyOf(accessLog);
    }

    public synchronized long getAccessCount() {
        return accessCount;
    }

    public synchronized Optional<Instant> getLastAccessAt() {
        return Optional.ofNullable(lastAccessAt);
    }

    private static String validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title must not be blank");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException(
                "Title too long (max " + MAX_TITLE_LENGTH + "): " + Encode.forJava(title.substring(0, 32)) + "..."
            );
        }
        return title.strip();
    }

    @Override
    public String toString() {
        return String.format("SecretRecord[id=%s, tier=%s, owner=%s, authorized=%d]",
            id, tier, ownerId, authorizedPrincipals.size());
    }
}
