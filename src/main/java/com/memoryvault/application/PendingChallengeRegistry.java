package com.memoryvault.application;

import com.memoryvault.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Short-lived state linking an ambiguous voice verification to the
 * knowledge challenges that may complete it.
 *
 * <p>A voice credit records that the principal reached the challenge band on
 * a channel; a challenge set holds the prompts and their expected answers.
 * Both expire after {@code memoryvault.auth.challenge-ttl}.
 *
 * <p>Failed answers are counted on the credit, so issuing a new set does not
 * give the caller more guesses.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PendingChallengeRegistry {

    private final AuthProperties properties;

    private final Map<String, VoiceCredit> credits = new ConcurrentHashMap<>();

    private final Map<String, PendingChallengeSet> challengeSets = new ConcurrentHashMap<>();

    public void grantVoiceCredit(String principalId, String channelId, double score, String category, Instant now) {
        credits.put(principalId, new VoiceCredit(channelId, score, category, now));
        log.debug("Voice credit granted: principal={}, channel={}", principalId, channelId);
    }

    public Optional<VoiceCredit> voiceCredit(String principalId, Instant now) {
        VoiceCredit credit = credits.get(principalId);
        if (credit == null) {
            return Optional.empty();
        }
        if (isExpired(credit.grantedAt(), now)) {
            credits.remove(principalId, credit);
            return Optional.empty();
        }
        return Optional.of(credit);
    }

    /**
     * Stores a fresh challenge set, replacing any earlier one.
     */
    public PendingChallengeSet store(String principalId, List<IssuedChallenge> challenges, Instant now) {
        PendingChallengeSet set = new PendingChallengeSet(List.copyOf(challenges), now);
        challengeSets.put(principalId, set);
        return set;
    }

    public Optional<PendingChallengeSet> challengeSet(String principalId, Instant now) {
        PendingChallengeSet set = challengeSets.get(principalId);
        if (set == null) {
            return Optional.empty();
        }
        if (isExpired(set.getIssuedAt(), now)) {
            challengeSets.remove(principalId, set);
            return Optional.empty();
        }
        return Optional.of(set);
    }

    /**
     * Removes {@code set} and the principal's voice credit if {@code set} is
     * still the current one.
     *
     * @return false if another caller consumed or replaced the set first
     */
    public boolean consume(String principalId, PendingChallengeSet set) {
        if (!challengeSets.remove(principalId, set)) {
            return false;
        }
        credits.remove(principalId);
        return true;
    }

    public void clear(String principalId) {
        challengeSets.remove(principalId);
        credits.remove(principalId);
    }

    private boolean isExpired(Instant since, Instant now) {
        return !now.isBefore(since.plus(properties.getChallengeTtl()));
    }

    /**
     * Proof of an ambiguous-band voice match, waiting for a second factor.
     * Carries the number of answer attempts made against it across every
     * challenge set issued while it lives.
     */
    public static final class VoiceCredit {

        private final String channelId;
        private final double score;
        private final String category;
        private final Instant grantedAt;
        private final AtomicInteger attempts = new AtomicInteger();

        VoiceCredit(String channelId, double score, String category, Instant grantedAt) {
            this.channelId = channelId;
            this.score = score;
            this.category = category;
            this.grantedAt = grantedAt;
        }

        public String channelId() {
            return channelId;
        }

        public double score() {
            return score;
        }

        public String category() {
            return category;
        }

        public Instant grantedAt() {
            return grantedAt;
        }

        /**
         * @return the attempt number just recorded, starting at 1
         */
        public int recordAttempt() {
            return attempts.incrementAndGet();
        }
    }

    /**
     * Issued challenges with their expected answers.
     */
    public static final class PendingChallengeSet {

        private final List<IssuedChallenge> challenges;
        private final Instant issuedAt;

        PendingChallengeSet(List<IssuedChallenge> challenges, Instant issuedAt) {
            this.challenges = challenges;
            this.issuedAt = issuedAt;
        }

        public List<IssuedChallenge> getChallenges() {
            return challenges;
        }

        public Instant getIssuedAt() {
            return issuedAt;
        }
    }
}
