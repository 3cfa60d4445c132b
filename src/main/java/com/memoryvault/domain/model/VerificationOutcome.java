package com.memoryvault.domain.model;

import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Result of a voice or challenge verification. Failures are values, not
 * exceptions: nothing about a refused verification unwinds past the caller.
 */
public sealed interface VerificationOutcome
        permits VerificationOutcome.Authenticated,
                VerificationOutcome.ChallengeRequired,
                VerificationOutcome.Denied {

    /**
     * Best similarity score observed, or the fixed challenge confidence.
     */
    double getScore();

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }

    @Value
    final class Authenticated implements VerificationOutcome {
        @NonNull AuthSession session;

        @Override
        public double getScore() {
            return session.getConfidence();
        }
    }

    /**
     * Voice confidence was ambiguous; a second factor is needed before a
     * session can be issued. {@code challenges} are the prompts already
     * issued for this attempt.
     */
    @Value
    final class ChallengeRequired implements VerificationOutcome {
        double score;
        @NonNull List<Challenge> challenges;
    }

    @Value
    final class Denied implements VerificationOutcome {
        double score;
        @NonNull DenialReason reason;

        public String getMessage() {
            return reason.getDisplayMessage();
        }
    }
}
