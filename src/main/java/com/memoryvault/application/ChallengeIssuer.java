package com.memoryvault.application;

import com.memoryvault.config.AuthProperties;
import com.memoryvault.config.PerformanceConfiguration.BusinessMetrics;
import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.AuthenticationAttempt;
import com.memoryvault.domain.model.Challenge;
import com.memoryvault.domain.model.ChallengeResponse;
import com.memoryvault.domain.model.ChallengeType;
import com.memoryvault.domain.model.ConfidenceBand;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.MemorySnapshot;
import com.memoryvault.domain.model.PrincipalAccount;
import com.memoryvault.domain.model.SessionFactor;
import com.memoryvault.domain.model.VerificationOutcome;
import com.memoryvault.domain.repository.AuthenticationAttemptRepository;
import com.memoryvault.domain.repository.MemoryRecordSource;
import com.memoryvault.domain.repository.PrincipalAccountRepository;
import com.memoryvault.infrastructure.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Knowledge challenges for principals whose voice score fell in the
 * ambiguous band.
 *
 * <p>Challenges are built from the principal's own recent memories:
 * <ol>
 *   <li>temporal: the date of the most recent memory</li>
 *   <li>relationship: how a named person is related, for family categories only</li>
 *   <li>content: the word that follows a short prefix of the second most recent memory</li>
 * </ol>
 * At most {@code max-challenges} are issued, in that order. With no memories
 * the principal is asked for the name they registered with.
 *
 * <p>A session is only issued if the principal holds a voice credit from an
 * ambiguous verification on the same channel and answers every challenge
 * correctly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeIssuer {

    static final Set<String> FAMILY_CATEGORIES = Set.of("family", "parents", "siblings", "children", "relatives");

    private static final int RECENT_MEMORY_SCAN = 20;

    private final MemoryRecordSource memoryRecordSource;
    private final PrincipalAccountRepository accountRepository;
    private final PendingChallengeRegistry pendingChallenges;
    private final AuthenticationAttemptRepository attemptRepository;
    private final ChallengeResponseVerifier responseVerifier;
    private final SessionIssuer sessionIssuer;
    private final AuditService auditService;
    private final BusinessMetrics businessMetrics;
    private final AuthProperties properties;
    private final Clock clock;

    /**
     * Issues a fresh challenge set for {@code principalId}, replacing any
     * pending one. Expected answers stay server-side.
     *
     * @param category memory category the caller wants to open, or null
     */
    public List<Challenge> issue(String principalId, String category) {
        List<MemorySnapshot> recent = memoryRecordSource.findRecent(principalId, RECENT_MEMORY_SCAN);
        List<IssuedChallenge> issued = new ArrayList<>();

        if (recent.isEmpty()) {
            issued.add(identityChallenge(principalId));
        } else {
            issued.add(temporalChallenge(recent.get(0)));
            if (isFamilyCategory(category)) {
                relationshipChallenge(recent).ifPresent(issued::add);
            }
            if (recent.size() > 1) {
                contentChallenge(recent.get(1)).ifPresent(issued::add);
            }
        }

        List<IssuedChallenge> selected = issued.size() > properties.getMaxChallenges()
            ? List.copyOf(issued.subList(0, properties.getMaxChallenges()))
            : List.copyOf(issued);
        pendingChallenges.store(principalId, selected, Instant.now(clock));

        List<Challenge> challenges = selected.stream().map(IssuedChallenge::getChallenge).toList();
        auditService.record("CHALLENGE", "ISSUE", principalId, principalId,
            challenges.stream().map(c -> c.getType().name()).collect(Collectors.joining(",")));
        log.info("Issued {} challenge(s): principal={}, category={}", challenges.size(), principalId, category);
        return challenges;
    }

    /**
     * Issues a fresh set to a principal who holds a voice credit on
     * {@code channelId}. Without a credit nothing is issued, so prompts built
     * from private memories are never shown to an unverified caller. Failed
     * attempts made under the credit still count against the new set.
     */
    public AccessResult<List<Challenge>> reissue(String principalId, String channelId, String category) {
        Optional<PendingChallengeRegistry.VoiceCredit> credit =
            pendingChallenges.voiceCredit(principalId, Instant.now(clock));
        if (credit.isEmpty() || !credit.get().channelId().equals(channelId)) {
            auditService.record("CHALLENGE", "ISSUE", principalId, principalId, "denied reason=no-voice-credit");
            log.warn("Challenge reissue refused: principal={}, channel={}", principalId, channelId);
            return AccessResult.denied(DenialReason.CHALLENGE_NOT_PENDING);
        }
        return AccessResult.granted(issue(principalId, category != null ? category : credit.get().category()));
    }

    /**
     * Checks the answers to the pending challenge set. Every issued challenge
     * must be answered correctly. Attempts are counted per voice credit; after
     * {@code max-challenge-attempts} failed tries the set and the credit are
     * discarded.
     *
     * @return {@code Authenticated} with factors VOICE and CHALLENGE, or {@code Denied}
     */
    public VerificationOutcome verify(String principalId, String channelId, List<ChallengeResponse> responses) {
        Instant now = Instant.now(clock);

        Optional<PendingChallengeRegistry.VoiceCredit> credit = pendingChallenges.voiceCredit(principalId, now);
        if (credit.isEmpty() || !credit.get().channelId().equals(channelId)) {
            return deny(principalId, channelId, 0.0, DenialReason.CHALLENGE_NOT_PENDING);
        }
        double voiceScore = credit.get().score();

        Optional<PendingChallengeRegistry.PendingChallengeSet> pending =
            pendingChallenges.challengeSet(principalId, now);
        if (pending.isEmpty()) {
            return deny(principalId, channelId, voiceScore, DenialReason.CHALLENGE_NOT_PENDING);
        }
        PendingChallengeRegistry.PendingChallengeSet set = pending.get();
        int attempt = credit.get().recordAttempt();
        if (attempt > properties.getMaxChallengeAttempts()) {
            pendingChallenges.clear(principalId);
            return deny(principalId, channelId, voiceScore, DenialReason.CHALLENGE_ATTEMPTS_EXHAUSTED);
        }

        if (!allAnswered(set.getChallenges(), responses)) {
            businessMetrics.recordChallengeVerification(false);
            if (attempt >= properties.getMaxChallengeAttempts()) {
                pendingChallenges.clear(principalId);
                return deny(principalId, channelId, voiceScore, DenialReason.CHALLENGE_ATTEMPTS_EXHAUSTED);
            }
            return deny(principalId, channelId, voiceScore, DenialReason.CHALLENGE_FAILED);
        }

        if (!pendingChallenges.consume(principalId, set)) {
            return deny(principalId, channelId, voiceScore, DenialReason.CHALLENGE_NOT_PENDING);
        }

        businessMetrics.recordChallengeVerification(true);
        AuthSession session = sessionIssuer.open(
            principalId,
            channelId,
            properties.getChallengeConfidence(),
            EnumSet.of(SessionFactor.VOICE, SessionFactor.CHALLENGE),
            credit.get().category()
        );
        auditService.record("CHALLENGE", "VERIFY", principalId, principalId, "passed attempt=" + attempt);
        recordAttempt(principalId, channelId, voiceScore, true, null);
        return new VerificationOutcome.Authenticated(session);
    }

    private boolean allAnswered(List<IssuedChallenge> challenges, List<ChallengeResponse> responses) {
        if (responses == null || responses.isEmpty()) {
            return false;
        }
        Map<String, String> answers = responses.stream()
            .filter(response -> response.getAnswer() != null)
            .collect(Collectors.toMap(ChallengeResponse::getChallengeId, ChallengeResponse::getAnswer,
                (first, second) -> second));
        return challenges.stream()
            .allMatch(challenge -> responseVerifier.matches(challenge, answers.get(challenge.getId())));
    }

    private VerificationOutcome deny(String principalId, String channelId, double score, DenialReason reason) {
        auditService.record("CHALLENGE", "VERIFY", principalId, principalId, "denied reason=" + reason);
        log.warn("Challenge verification denied: principal={}, reason={}", principalId, reason);
        recordAttempt(principalId, channelId, score, false, reason);
        return new VerificationOutcome.Denied(score, reason);
    }

    private void recordAttempt(String principalId, String channelId, double score, boolean passed, DenialReason reason) {
        attemptRepository.append(AuthenticationAttempt.builder()
            .id(UUID.randomUUID())
            .principalId(principalId)
            .channelId(channelId != null ? channelId : "")
            .attemptedAt(Instant.now(clock))
            .score(score)
            .band(score > 0.0 ? ConfidenceBand.AMBIGUOUS : null)
            .success(passed)
            .reason(reason)
            .challengeRequired(true)
            .challengePassed(passed)
            .build());
    }

    private IssuedChallenge temporalChallenge(MemorySnapshot latest) {
        LocalDate date = LocalDate.ofInstant(latest.getCreatedAt(), properties.getChallengeZone());
        return issued(ChallengeType.TEMPORAL,
            "On what date did you save your most recent memory? (YYYY-MM-DD)",
            date.toString());
    }

    private Optional<IssuedChallenge> relationshipChallenge(List<MemorySnapshot> recent) {
        return recent.stream()
            .filter(memory -> hasText(memory.getRelatedPerson()) && hasText(memory.getRelationship()))
            .findFirst()
            .map(memory -> issued(ChallengeType.RELATIONSHIP,
                "How is " + memory.getRelatedPerson().strip() + " related to you?",
                memory.getRelationship().strip()));
    }

    /**
     * Shows whole words of the memory up to the hint length and asks for the
     * next one. Skipped when the memory has no word left to ask for.
     */
    private Optional<IssuedChallenge> contentChallenge(MemorySnapshot memory) {
        String[] words = memory.getContent().strip().split("\\s+");
        int limit = properties.getContentHintLength();

        StringBuilder hint = new StringBuilder();
        int shown = 0;
        while (shown < words.length - 1) {
            int length = hint.length() + (shown == 0 ? 0 : 1) + words[shown].length();
            if (length > limit) {
                break;
            }
            if (shown > 0) {
                hint.append(' ');
            }
            hint.append(words[shown++]);
        }
        if (shown == 0) {
            return Optional.empty();
        }

        String answer = trimPunctuation(words[shown]);
        if (answer.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(issued(ChallengeType.CONTENT,
            "Which word comes next in one of your memories: \"" + hint + " ...\"?",
            answer));
    }

    private IssuedChallenge identityChallenge(String principalId) {
        String displayName = accountRepository.findById(principalId)
            .map(PrincipalAccount::getDisplayName)
            .orElse(principalId);
        return issued(ChallengeType.IDENTITY, "What name did you register with?", displayName);
    }

    private static IssuedChallenge issued(ChallengeType type, String prompt, String expectedAnswer) {
        return new IssuedChallenge(new Challenge(UUID.randomUUID().toString(), type, prompt), expectedAnswer);
    }

    private static boolean isFamilyCategory(String category) {
        return category != null && FAMILY_CATEGORIES.contains(category.strip().toLowerCase(Locale.ROOT));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String trimPunctuation(String word) {
        return word.replaceAll("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$", "");
    }
}
