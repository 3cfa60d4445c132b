package com.memoryvault.application;

import com.memoryvault.application.exceptions.DecryptionFailedException;
import com.memoryvault.config.PerformanceConfiguration.BusinessMetrics;
import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.DisclosureRecord;
import com.memoryvault.domain.model.SessionResolution;
import com.memoryvault.domain.repository.DisclosureRecordRepository;
import com.memoryvault.infrastructure.audit.AuditService;
import com.memoryvault.infrastructure.classifier.RomanticIntentClassifier;
import com.memoryvault.infrastructure.crypto.CryptoException;
import com.memoryvault.infrastructure.crypto.CryptoService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Designated disclosure records: private notes readable by their owner, one
 * designated reader and, after a mutual match, the matched counterpart.
 *
 * <p>Content is classified for romantic intent before it is stored. Creating
 * a romantic disclosure with a target triggers {@link MutualDisclosureMatcher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DisclosureService {

    static final String CONTENT_PURPOSE = "disclosure-content";

    private final DisclosureRecordRepository recordRepository;
    private final RomanticIntentClassifier intentClassifier;
    private final MutualDisclosureMatcher matcher;
    private final CryptoService cryptoService;
    private final SessionGuard sessionGuard;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    /**
     * @param targetPrincipalId person the disclosure is about, or null
     * @param targetName display name of that person, or null
     */
    public DisclosureRecord create(
            String ownerId,
            String title,
            String content,
            String targetPrincipalId,
            String targetName) {

        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content must not be blank");
        }
        boolean romantic = intentClassifier.isRomantic(content);

        DisclosureRecord record = DisclosureRecord.create(
            UUID.randomUUID(),
            title,
            cryptoService.encrypt(content.getBytes(StandardCharsets.UTF_8), CONTENT_PURPOSE),
            ownerId,
            romantic,
            targetPrincipalId,
            targetName,
            Instant.now(clock)
        );
        recordRepository.save(record);

        businessMetrics.recordDisclosureCreated(romantic);
        auditService.record("DISCLOSURE", "CREATE", record.getId().toString(), ownerId,
            "romantic=" + romantic + " targeted=" + record.getTargetPrincipalId().isPresent());

        if (romantic && record.getTargetPrincipalId().isPresent()) {
            matcher.match(record);
        }
        return record;
    }

    /**
     * Makes {@code readerId} the only designated reader, replacing any
     * previous one. Repeating the call with the same reader changes nothing.
     */
    public AccessResult<DisclosureRecord> setDesignatedReader(UUID recordId, String ownerId, String readerId) {
        Optional<DisclosureRecord> owned = findOwned(recordId, ownerId, "SET_READER");
        if (owned.isEmpty()) {
            return AccessResult.denied(DenialReason.AUTHORIZATION_DENIED);
        }
        DisclosureRecord record = owned.get();
        if (record.assignDesignatedReader(readerId)) {
            recordRepository.save(record);
            auditService.record("DISCLOSURE", "SET_READER", recordId.toString(), ownerId, "reader=" + readerId);
        }
        return AccessResult.granted(record);
    }

    public AccessResult<DisclosureRecord> clearDesignatedReader(UUID recordId, String ownerId) {
        Optional<DisclosureRecord> owned = findOwned(recordId, ownerId, "CLEAR_READER");
        if (owned.isEmpty()) {
            return AccessResult.denied(DenialReason.AUTHORIZATION_DENIED);
        }
        DisclosureRecord record = owned.get();
        record.clearDesignatedReader();
        recordRepository.save(record);
        auditService.record("DISCLOSURE", "CLEAR_READER", recordId.toString(), ownerId, "");
        return AccessResult.granted(record);
    }

    /**
     * Drops the romantic target. A match already made, and the read access
     * it granted, are kept.
     */
    public AccessResult<DisclosureRecord> removeTarget(UUID recordId, String ownerId) {
        Optional<DisclosureRecord> owned = findOwned(recordId, ownerId, "REMOVE_TARGET");
        if (owned.isEmpty()) {
            return AccessResult.denied(DenialReason.AUTHORIZATION_DENIED);
        }
        DisclosureRecord record = owned.get();
        matcher.clearTarget(record);
        auditService.record("DISCLOSURE", "REMOVE_TARGET", recordId.toString(), ownerId,
            "matched=" + record.isMatched());
        return AccessResult.granted(record);
    }

    /**
     * Decrypts the disclosure for one of its readers.
     *
     * @throws DecryptionFailedException if a reader was granted access but the
     *         stored content could not be decrypted
     */
    public AccessResult<String> read(UUID recordId, String requesterId) {
        Optional<DisclosureRecord> found = recordRepository.findById(recordId);
        if (found.isEmpty() || !matcher.canRead(found.get(), requesterId)) {
            auditService.record("DISCLOSURE", "READ", String.valueOf(recordId), requesterId, "denied");
            log.warn("AUTHORIZATION DENIED: principal={}, disclosure={}", requesterId, recordId);
            return AccessResult.denied(found.isEmpty() ? DenialReason.RECORD_NOT_FOUND : DenialReason.AUTHORIZATION_DENIED);
        }
        DisclosureRecord record = found.get();
        try {
            String plaintext = new String(cryptoService.decrypt(record.getContent(), CONTENT_PURPOSE), StandardCharsets.UTF_8);
            auditService.record("DISCLOSURE", "READ", recordId.toString(), requesterId, "granted");
            return AccessResult.granted(plaintext);
        } catch (CryptoException e) {
            auditService.record("DISCLOSURE", "READ", recordId.toString(), requesterId, "decryption-failed");
            log.error("Integrity fault: disclosure {} could not be decrypted", recordId, e);
            throw new DecryptionFailedException(recordId, e);
        }
    }

    public AccessResult<String> readWithSession(UUID recordId, String sessionId) {
        SessionResolution resolution = sessionGuard.resolve(sessionId);
        if (resolution instanceof SessionResolution.Rejected rejected) {
            return AccessResult.denied(rejected.getReason());
        }
        return read(recordId, ((SessionResolution.Active) resolution).getSession().getPrincipalId());
    }

    public List<DisclosureRecord> listOwned(String ownerId) {
        return recordRepository.findByOwner(ownerId);
    }

    private Optional<DisclosureRecord> findOwned(UUID recordId, String principalId, String action) {
        Optional<DisclosureRecord> record = recordRepository.findById(recordId)
            .filter(candidate -> candidate.isOwnedBy(principalId));
        if (record.isEmpty()) {
            auditService.record("DISCLOSURE", action, String.valueOf(recordId), principalId, "denied reason=not-owner");
            log.warn("AUTHORIZATION DENIED: principal={}, operation={}, disclosure={}", principalId, action, recordId);
        }
        return record;
    }
}
