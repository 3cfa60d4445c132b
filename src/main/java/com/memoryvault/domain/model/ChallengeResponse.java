package com.memoryvault.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A principal's answer to one issued {@link Challenge}.
 */
@Value
public class ChallengeResponse {
    @NonNull String challengeId;
    String answer;
}
