package com.memoryvault.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A knowledge prompt shown to the principal. The expected answer is kept
 * server-side and never travels with the prompt.
 */
@Value
public class Challenge {
    @NonNull String id;
    @NonNull ChallengeType type;
    @NonNull String prompt;
}
