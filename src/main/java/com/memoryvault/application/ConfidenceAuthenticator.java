package com.memoryvault.application;

import com.memoryvault.config.AuthProperties;
import com.memoryvault.config.PerformanceConfiguration.BusinessMetrics;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.AuthenticationAttempt;
import com.memoryvault.domain.model.Challenge;
import com.memoryvault.domain.model.ConfidenceBand;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.EncryptedValue;
import com.memoryvault.domain.model.EnrollmentStatus;
import com.memoryvault.domain.model.PrincipalAccount;
import com.memoryvault.domain.model.SessionFactor;
import com.memoryvault.domain.model.VerificationOutcome;
import com.memoryvault.domain.model.Voiceprint;
import com.memoryvault.domain.repository.AuthenticationAttemptRepository;
import com.memoryvault.domain.repository.PrincipalAccountRepository;
import com.memoryvault.domain.repository.SessionStore;
import com.memoryvault.domain.repository.VoiceprintRepository;
import com.memoryvault.infrastructure.audit.AuditService;
import com.memoryvault.infrastructure.crypto.CryptoService;
import com.memoryvault.infrastructure.voice.EmbeddingExtractor;
import com.memoryvault.infrastructure.voice.Embeddings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Voice confidence authentication.
 *
 * <p>A sample is compared with every voiceprint the principal enrolled and
 * the best cosine similarity decides:
 * <ul>
 *   <li>{@code score >= high threshold}: a session with factor VOICE and
 *       confidence equal to the score</li>
 *   <li>{@code challenge threshold <= score < high threshold}: knowledge
 *       challenges are issued and must be answered through
 *       {@link ChallengeIssuer#verify}</li>
 *   <li>otherwise: denied</li>
 * </ul>
 *
 * <p>Refusals, including unknown principals, are returned as
 * {@link VerificationOutcome.Denied}, never thrown.
 *
 * @since 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConfidenceAuthenticator {

    static final String VOICEPRINT_PURPOSE = "voiceprint";

    static final int MAX_LOG_ENTRIES = 100;

    private final PrincipalAccountRepository accountRepository;
    private final VoiceprintRepository voiceprintRepository;
    private final AuthenticationAttemptRepository attemptRepository;
    private final SessionStore sessionStore;
    private final EmbeddingExtractor embeddingExtractor;
    private final CryptoService cryptoService;
    private final ConfidencePolicy confidencePolicy;
    private final VerificationRateLimiter rateLimiter;
    private final SessionIssuer sessionIssuer;
    private final SessionGuard sessionGuard;
    private final ChallengeIssuer challengeIssuer;
    private final PendingChallengeRegistry pendingChallenges;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;
    private final AuthProperties properties;
    private final Clock clock;

    @Qualifier("accessCheckExecutor")
    private final Executor accessCheckExecutor;

    /**
     * Creates an account awaiting enrollment. Existing accounts are returned unchanged.
     */
    public PrincipalAccount register(String principalId, String displayName) {
        requireId(principalId);
        Optional<PrincipalAccount> existing = accountRepository.findById(principalId);
        if (existing.isPresent()) {
            return existing.get();
        }
        PrincipalAccount account = PrincipalAccount.builder()
            .principalId(principalId)
            .displayName(displayName != null && !displayName.isBlank() ? displayName.strip() : principalId)
            .status(EnrollmentStatus.PENDING_ENROLLMENT)
            .createdAt(Instant.now(clock))
            .build();
        accountRepository.save(account);
        auditService.record("ACCOUNT", "REGISTER", principalId, principalId, "status=" + account.getStatus());
        return account;
    }

    /**
     * Averages the samples into one new voiceprint and marks the principal
     * enrolled. Every call appends; earlier voiceprints are kept.
     *
     * @throws IllegalArgumentException if no sample is given
     * @throws IllegalStateException if the account is suspended
     */
    public Voiceprint enroll(String principalId, List<byte[]> samples, String deviceHint) {
        requireId(principalId);
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("At least one voice sample is required for enrollment");
        }

        PrincipalAccount account = register(principalId, null);
        if (account.getStatus() == EnrollmentStatus.SUSPENDED) {
            throw new IllegalStateException("Account " + Encode.forJava(principalId) + " is suspended");
        }

        double[][] embeddings = samples.stream()
            .map(embeddingExtractor::extract)
            .toArray(double[][]::new);
        double[] centroid = Embeddings.average(embeddings);

        double consistency = 0.0;
        for (double[] embedding : embeddings) {
            consistency += Embeddings.cosine(embedding, centroid);
        }
        consistency /= embeddings.length;

        Voiceprint voiceprint = Voiceprint.builder()
            .id(UUID.randomUUID())
            .ownerId(principalId)
            .embedding(cryptoService.encrypt(Embeddings.toBytes(centroid), VOICEPRINT_PURPOSE))
            .modelVersion(embeddingExtractor.modelVersion())
            .enrolledAt(Instant.now(clock))
            .deviceHint(deviceHint)
            .enrollmentConfidence(consistency)
            .sampleCount(samples.size())
            .build();
        voiceprintRepository.append(voiceprint);

        if (!account.isEnrolled()) {
            accountRepository.save(account.withStatus(EnrollmentStatus.ENROLLED));
        }

        businessMetrics.recordEnrollment();
        auditService.record("AUTHENTICATION", "ENROLL", voiceprint.getId().toString(), principalId,
            "samples=" + samples.size());
        log.info("Voice enrolled: principal={}, samples={}, consistency={}",
            principalId, samples.size(), String.format("%.3f", consistency));
        return voiceprint;
    }

    public boolean isEnrolled(String principalId) {
        return accountRepository.findById(principalId).map(PrincipalAccount::isEnrolled).orElse(false);
    }

    public VerificationOutcome verify(String principalId, byte[] sample, String channelId) {
        return verify(principalId, sample, channelId, null);
    }

    /**
     * Scores {@code sample} against the principal's voiceprints.
     *
     * @param category memory category the session is being opened for, or null for any
     */
    public VerificationOutcome verify(String principalId, byte[] sample, String channelId, String category) {
        requireId(principalId);
        requireId(channelId);

        if (!rateLimiter.tryAcquire(principalId)) {
            return denied(principalId, channelId, 0.0, DenialReason.RATE_LIMITED);
        }

        Optional<PrincipalAccount> account = accountRepository.findById(principalId);
        if (account.isEmpty() || !account.get().isEnrolled()) {
            return denied(principalId, channelId, 0.0, DenialReason.NOT_ENROLLED);
        }

        List<Voiceprint> voiceprints = voiceprintRepository.findByOwner(principalId).stream()
            .filter(this::isCurrentModel)
            .toList();
        if (voiceprints.isEmpty()) {
            return denied(principalId, channelId, 0.0, DenialReason.NOT_ENROLLED);
        }

        double[] sampleEmbedding = embeddingExtractor.extract(sample);
        double score = 0.0;
        for (Voiceprint voiceprint : voiceprints) {
            score = Math.max(score, Embeddings.cosine(sampleEmbedding, decode(voiceprint.getEmbedding())));
        }

        ConfidenceBand band = confidencePolicy.classify(score);
        VerificationOutcome outcome = switch (band) {
            case HIGH -> {
                AuthSession session = sessionIssuer.open(
                    principalId, channelId, score, EnumSet.of(SessionFactor.VOICE), category);
                yield new VerificationOutcome.Authenticated(session);
            }
            case AMBIGUOUS -> {
                pendingChallenges.grantVoiceCredit(principalId, channelId, score, category, Instant.now(clock));
                List<Challenge> challenges = challengeIssuer.issue(principalId, category);
                yield new VerificationOutcome.ChallengeRequired(score, challenges);
            }
            case LOW -> new VerificationOutcome.Denied(score, DenialReason.AUTHENTICATION_DENIED);
        };

        businessMetrics.recordVerification(band.name().toLowerCase(Locale.ROOT));
        recordAttempt(principalId, channelId, band, outcome);
        auditService.record("AUTHENTICATION", "VERIFY", principalId, principalId,
            "band=" + band + " score=" + String.format("%.3f", score) + " channel=" + channelId);
        if (log.isInfoEnabled()) {
            log.info("Voice verification: principal={}, channel={}, score={}, band={}",
                principalId, channelId, String.format("%.3f", score), band);
        }
        return outcome;
    }

    /**
     * {@link #verify} on the access-check executor. The future fails with a
     * {@link java.util.concurrent.TimeoutException} after the configured
     * verification timeout.
     */
    public CompletableFuture<VerificationOutcome> verifyAsync(
            String principalId,
            byte[] sample,
            String channelId,
            String category) {

        return CompletableFuture
            .supplyAsync(() -> verify(principalId, sample, channelId, category), accessCheckExecutor)
            .orTimeout(properties.getVerificationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Past voice and challenge verification attempts of {@code principalId},
     * newest first. {@code limit} is clamped to 1..{@value #MAX_LOG_ENTRIES}.
     */
    public List<AuthenticationAttempt> authenticationLog(String principalId, int limit) {
        requireId(principalId);
        int bounded = Math.max(1, Math.min(limit, MAX_LOG_ENTRIES));
        return attemptRepository.findRecentByPrincipal(principalId, bounded);
    }

    public boolean logout(String sessionId) {
        return sessionGuard.logout(sessionId);
    }

    public List<Voiceprint> listVoiceprints(String principalId) {
        return voiceprintRepository.findByOwner(principalId);
    }

    /**
     * Removes the account, every voiceprint and every live session of the
     * principal. The only path by which voiceprints are deleted.
     *
     * @return number of voiceprints removed
     */
    public int deleteAccount(String principalId) {
        requireId(principalId);
        int voiceprints = voiceprintRepository.deleteByOwner(principalId);
        int sessions = sessionStore.removeByPrincipal(principalId);
        pendingChallenges.clear(principalId);
        rateLimiter.reset(principalId);
        accountRepository.delete(principalId);

        auditService.record("ACCOUNT", "DELETE", principalId, principalId,
            "voiceprints=" + voiceprints + " sessions=" + sessions);
        log.warn("Account deleted: principal={}, voiceprints={}, sessions={}", principalId, voiceprints, sessions);
        return voiceprints;
    }

    private boolean isCurrentModel(Voiceprint voiceprint) {
        if (embeddingExtractor.modelVersion().equals(voiceprint.getModelVersion())) {
            return true;
        }
        log.warn("Skipping voiceprint {} enrolled with model {}", voiceprint.getId(), voiceprint.getModelVersion());
        return false;
    }

    private double[] decode(EncryptedValue embedding) {
        return Embeddings.fromBytes(cryptoService.decrypt(embedding, VOICEPRINT_PURPOSE));
    }

    private VerificationOutcome denied(String principalId, String channelId, double score, DenialReason reason) {
        businessMetrics.recordVerification("denied");
        auditService.record("AUTHENTICATION", "VERIFY", principalId, principalId,
            "denied reason=" + reason + " channel=" + channelId);
        log.warn("Voice verification denied: principal={}, channel={}, reason={}", principalId, channelId, reason);
        VerificationOutcome outcome = new VerificationOutcome.Denied(score, reason);
        recordAttempt(principalId, channelId, null, outcome);
        return outcome;
    }

    private void recordAttempt(String principalId, String channelId, ConfidenceBand band, VerificationOutcome outcome) {
        attemptRepository.append(AuthenticationAttempt.builder()
            .id(UUID.randomUUID())
            .principalId(principalId)
            .channelId(channelId)
            .attemptedAt(Instant.now(clock))
            .score(outcome.getScore())
            .band(band)
            .success(outcome.isAuthenticated())
            .reason(outcome instanceof VerificationOutcome.Denied denied ? denied.getReason() : null)
            .challengeRequired(outcome instanceof VerificationOutcome.ChallengeRequired)
            .build());
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
    }
}
