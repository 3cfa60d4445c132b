package com.memoryvault.application;

import com.memoryvault.application.event.AccessLogEvent;
import com.memoryvault.application.exceptions.DecryptionFailedException;
import com.memoryvault.config.PerformanceConfiguration.BusinessMetrics;
import com.memoryvault.config.VaultProperties;
import com.memoryvault.domain.model.AccessBasis;
import com.memoryvault.domain.model.AccessLogEntry;
import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.SecretRecord;
import com.memoryvault.domain.model.SecretTier;
import com.memoryvault.domain.model.SessionResolution;
import com.memoryvault.domain.repository.SecretRecordRepository;
import com.memoryvault.infrastructure.audit.AuditService;
import com.memoryvault.infrastructure.crypto.CryptoException;
import com.memoryvault.infrastructure.crypto.CryptoService;
import com.memoryvault.infrastructure.security.SecretAccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Tiered secret storage.
 *
 * <p>Content is encrypted at rest under a per-record data key. Reads go
 * through {@link SecretAccessPolicy}; only a granted check ever decrypts.
 * Every read attempt, granted or not, appends exactly one entry to the
 * record's access log before the call returns, and each append is published
 * as an {@link AccessLogEvent}.
 *
 * <p>A missing record and a forbidden one produce the same denial message.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecretVault {

    static final String CONTENT_PURPOSE = "secret-content";

    private final SecretRecordRepository recordRepository;
    private final SecretAccessPolicy accessPolicy;
    private final CryptoService cryptoService;
    private final SessionGuard sessionGuard;
    private final AuditService auditService;
    private final ApplicationEventPublisher events;
    private final BusinessMetrics businessMetrics;
    private final VaultProperties properties;
    private final Clock clock;

    @Qualifier("accessCheckExecutor")
    private final Executor accessCheckExecutor;

    /**
     * Encrypts and stores a new secret.
     *
     * @param authorized principals allowed to read this record regardless of contact level
     */
    public SecretRecord put(
            String ownerId,
            SecretTier tier,
            String title,
            String content,
            Collection<String> authorized) {

        if (content == null) {
            throw new IllegalArgumentException("Content must not be null");
        }
        SecretRecord record = SecretRecord.create(
            UUID.randomUUID(),
            title,
            tier,
            ownerId,
            cryptoService.encrypt(content.getBytes(StandardCharsets.UTF_8), CONTENT_PURPOSE),
            authorized != null ? Set.copyOf(authorized) : Set.of(),
            Instant.now(clock)
        );
        recordRepository.save(record);

        businessMetrics.recordSecretStored(tier.name());
        auditService.record("VAULT", "PUT", record.getId().toString(), ownerId,
            "tier=" + tier + " authorized=" + record.getAuthorizedPrincipals().size());
        return record;
    }

    /**
     * Releases the plaintext of {@code recordId} to {@code requesterId} if
     * allowed.
     *
     * @throws DecryptionFailedException if access was granted but the stored
     *         content could not be decrypted
     */
    public AccessResult<String> get(UUID recordId, String requesterId) {
        Optional<SecretRecord> found = recordRepository.findById(recordId);
        if (found.isEmpty()) {
            Optional<SecretRecord> retired = recordRepository.findRetiredById(recordId);
            if (retired.isPresent()) {
                appendAttempt(retired.get(), requesterId, false, "record-retired");
                return AccessResult.denied(DenialReason.RECORD_NOT_FOUND);
            }
            auditService.record("VAULT", "READ", String.valueOf(recordId), requesterId, "denied reason=not-found");
            log.warn("AUTHORIZATION DENIED: principal={}, record={} (no such record)", requesterId, recordId);
            return AccessResult.denied(DenialReason.RECORD_NOT_FOUND);
        }
        SecretRecord record = found.get();

        AccessBasis basis = accessPolicy.authorizeRead(record, requesterId);
        businessMetrics.recordVaultDecision(basis);
        if (!basis.isGranted()) {
            appendAttempt(record, requesterId, false, basis.getLogReason());
            return AccessResult.denied(DenialReason.AUTHORIZATION_DENIED);
        }

        String plaintext;
        try {
            plaintext = new String(cryptoService.decrypt(record.getContent(), CONTENT_PURPOSE), StandardCharsets.UTF_8);
        } catch (CryptoException e) {
            appendAttempt(record, requesterId, false, "decryption-failed");
            log.error("Integrity fault: record {} could not be decrypted for principal {}", recordId, requesterId, e);
            throw new DecryptionFailedException(recordId, e);
        }

        appendAttempt(record, requesterId, true, basis.getLogReason());
        return AccessResult.granted(plaintext);
    }

    /**
     * Same as {@link #get(UUID, String)} with the requester taken from an
     * active session. An unusable session is a denial and is logged against
     * the record as unauthenticated.
     */
    public AccessResult<String> getWithSession(UUID recordId, String sessionId) {
        SessionResolution resolution = sessionGuard.resolve(sessionId);
        if (resolution instanceof SessionResolution.Rejected rejected) {
            findLiveOrRetired(recordId).ifPresent(record ->
                appendAttempt(record, AccessLogEntry.UNAUTHENTICATED, false,
                    rejected.getReason().name().toLowerCase(Locale.ROOT).replace('_', '-')));
            return AccessResult.denied(rejected.getReason());
        }
        String requesterId = ((SessionResolution.Active) resolution).getSession().getPrincipalId();
        return get(recordId, requesterId);
    }

    /**
     * {@link #get(UUID, String)} on the access-check executor, failing with a
     * timeout after {@code memoryvault.vault.access-timeout}.
     */
    public CompletableFuture<AccessResult<String>> getAsync(UUID recordId, String requesterId) {
        return CompletableFuture
            .supplyAsync(() -> get(recordId, requesterId), accessCheckExecutor)
            .orTimeout(properties.getAccessTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Moves a secret to another tier by copying it to a new id and retiring
     * the old one. Owner only. The old id keeps its access log and starts a
     * new one at the new id.
     */
    public AccessResult<SecretRecord> reclassify(UUID recordId, String ownerId, SecretTier newTier) {
        Optional<SecretRecord> owned = findOwned(recordId, ownerId, "RECLASSIFY");
        if (owned.isEmpty()) {
            return AccessResult.denied(DenialReason.AUTHORIZATION_DENIED);
        }
        SecretRecord replacement = owned.get().reclassify(UUID.randomUUID(), newTier, Instant.now(clock));
        recordRepository.replace(recordId, replacement);

        auditService.record("VAULT", "RECLASSIFY", recordId.toString(), ownerId,
            "from=" + owned.get().getTier() + " to=" + newTier + " newId=" + replacement.getId());
        return AccessResult.granted(replacement);
    }

    /**
     * Deletes a secret. Owner only. Its access log stays readable by the owner.
     *
     * @return the deleted id when granted
     */
    public AccessResult<UUID> delete(UUID recordId, String ownerId) {
        Optional<SecretRecord> owned = findOwned(recordId, ownerId, "DELETE");
        if (owned.isEmpty()) {
            return AccessResult.denied(DenialReason.AUTHORIZATION_DENIED);
        }
        recordRepository.delete(recordId);
        auditService.record("VAULT", "DELETE", recordId.toString(), ownerId, "tier=" + owned.get().getTier());
        return AccessResult.granted(recordId);
    }

    /**
     * The record's access log in append order, for live and retired records.
     * Owner only.
     */
    public AccessResult<List<AccessLogEntry>> accessLog(UUID recordId, String requesterId) {
        return filterOwned(findLiveOrRetired(recordId), recordId, requesterId, "ACCESS_LOG")
            .<AccessResult<List<AccessLogEntry>>>map(record -> AccessResult.granted(record.getAccessLog()))
            .orElseGet(() -> AccessResult.denied(DenialReason.AUTHORIZATION_DENIED));
    }

    /**
     * Metadata of the owner's secrets, oldest first. Content stays encrypted.
     */
    public List<SecretRecord> listOwned(String ownerId) {
        return recordRepository.findByOwner(ownerId);
    }

    private Optional<SecretRecord> findOwned(UUID recordId, String principalId, String action) {
        return filterOwned(recordRepository.findById(recordId), recordId, principalId, action);
    }

    private Optional<SecretRecord> filterOwned(
            Optional<SecretRecord> found, UUID recordId, String principalId, String action) {
        Optional<SecretRecord> record = found.filter(candidate -> candidate.isOwnedBy(principalId));
        if (record.isEmpty()) {
            auditService.record("VAULT", action, String.valueOf(recordId), principalId, "denied reason=not-owner");
            log.warn("AUTHORIZATION DENIED: principal={}, operation={}, record={}", principalId, action, recordId);
        }
        return record;
    }

    private Optional<SecretRecord> findLiveOrRetired(UUID recordId) {
        return recordRepository.findById(recordId).or(() -> recordRepository.findRetiredById(recordId));
    }

    private void appendAttempt(SecretRecord record, String principalId, boolean success, String reason) {
        AccessLogEntry entry;
        // publish under the record lock so the stream keeps log order
        synchronized (record) {
            entry = record.recordAttempt(principalId, Instant.now(clock), success, reason);
            events.publishEvent(new AccessLogEvent(record.getOwnerId(), entry));
        }
        auditService.record("VAULT", "READ", record.getId().toString(), principalId,
            (success ? "granted" : "denied") + " reason=" + reason + " seq=" + entry.getSequence());
    }
}
