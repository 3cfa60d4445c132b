package com.memoryvault.application;

import com.memoryvault.application.event.MutualMatchEvent;
import com.memoryvault.config.PerformanceConfiguration.BusinessMetrics;
import com.memoryvault.domain.model.DisclosurePairState;
import com.memoryvault.domain.model.DisclosureRecord;
import com.memoryvault.domain.repository.DisclosureRecordRepository;
import com.memoryvault.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Detects reciprocal romantic disclosures.
 *
 * <p>When a principal's romantic disclosure names a target who already has
 * an unmatched romantic disclosure naming them back, both records are marked
 * matched with the same timestamp while the pair's write lock is held.
 * {@link #pairState} reads both flags under the read lock, so it never
 * reports one side matched without the other.
 *
 * <p>A {@link MutualMatchEvent} is published once per pair of principals, no
 * matter how many record pairs later match.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MutualDisclosureMatcher {

    private final DisclosureRecordRepository recordRepository;
    private final PairLockRegistry pairLocks;
    private final ApplicationEventPublisher events;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;
    private final Clock clock;

    private final Set<PrincipalPair> notifiedPairs = ConcurrentHashMap.newKeySet();

    /**
     * Tries to match {@code created} with a reciprocal disclosure. The record
     * must already be persisted so a concurrent creator on the other side can
     * find it.
     *
     * @return the published event, if this call produced the pair's first match
     */
    public Optional<MutualMatchEvent> match(DisclosureRecord created) {
        Optional<String> target = created.getTargetPrincipalId();
        if (!created.isRomanticIntent() || target.isEmpty()) {
            return Optional.empty();
        }
        String ownerId = created.getOwnerId();
        String targetId = target.get();
        PrincipalPair pair = PrincipalPair.of(ownerId, targetId);

        MutualMatchEvent event = null;
        Lock lock = pairLocks.lockFor(pair).writeLock();
        lock.lock();
        try {
            if (created.isMatched() || !created.isRomanticTowards(targetId)) {
                return Optional.empty();
            }
            Optional<DisclosureRecord> counterpart = recordRepository.findByOwner(targetId).stream()
                .filter(candidate -> !candidate.isMatched())
                .filter(candidate -> candidate.isRomanticTowards(ownerId))
                .findFirst();
            if (counterpart.isEmpty()) {
                log.debug("No reciprocal disclosure yet: owner={}, target={}", ownerId, targetId);
                return Optional.empty();
            }

            DisclosureRecord other = counterpart.get();
            if (other.isMatched() || !other.isRomanticTowards(ownerId)) {
                return Optional.empty();
            }
            Instant matchedAt = Instant.now(clock);
            other.markMatched(ownerId, matchedAt);
            created.markMatched(targetId, matchedAt);
            recordRepository.saveAll(List.of(other, created));

            businessMetrics.recordMutualMatch();
            auditService.record("DISCLOSURE", "MATCH", created.getId().toString(), ownerId,
                "counterpartRecord=" + other.getId());
            log.info("Mutual disclosure matched: {} <-> {}", ownerId, targetId);

            if (notifiedPairs.add(pair)) {
                event = new MutualMatchEvent(other.getOwnerId(), other.getId(), ownerId, created.getId(), matchedAt);
            }
        } finally {
            lock.unlock();
        }

        if (event != null) {
            events.publishEvent(event);
        }
        return Optional.ofNullable(event);
    }

    /**
     * Drops the romantic target of {@code record} under the pair lock of its
     * owner and that target, so a concurrent {@link #match} either sees the
     * target or does not match.
     */
    public void clearTarget(DisclosureRecord record) {
        Optional<String> target = record.getTargetPrincipalId();
        if (target.isEmpty()) {
            return;
        }
        Lock lock = pairLocks.lockFor(PrincipalPair.of(record.getOwnerId(), target.get())).writeLock();
        lock.lock();
        try {
            record.clearTarget();
            recordRepository.save(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether {@code principalId} may read {@code record}. Checks by anyone
     * other than the owner run under the pair read lock, so a counterpart
     * cannot read one side of a match before the other side is marked.
     */
    public boolean canRead(DisclosureRecord record, String principalId) {
        if (principalId == null || record.isOwnedBy(principalId)) {
            return record.canRead(principalId);
        }
        Lock lock = pairLocks.lockFor(PrincipalPair.of(record.getOwnerId(), principalId)).readLock();
        lock.lock();
        try {
            return record.canRead(principalId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Matched flags of two disclosures, read together under their owners'
     * pair lock.
     *
     * @return empty if either record does not exist
     */
    public Optional<DisclosurePairState> pairState(UUID firstRecordId, UUID secondRecordId) {
        Optional<DisclosureRecord> first = recordRepository.findById(firstRecordId);
        Optional<DisclosureRecord> second = recordRepository.findById(secondRecordId);
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }

        PrincipalPair pair = PrincipalPair.of(first.get().getOwnerId(), second.get().getOwnerId());
        Lock lock = pairLocks.lockFor(pair).readLock();
        lock.lock();
        try {
            return Optional.of(new DisclosurePairState(
                firstRecordId, first.get().isMatched(),
                secondRecordId, second.get().isMatched()));
        } finally {
            lock.unlock();
        }
    }
}
