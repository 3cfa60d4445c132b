package com.memoryvault.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memoryvault.domain.model.AuthenticationAttempt;
import com.memoryvault.domain.model.ConfidenceBand;
import com.memoryvault.domain.model.DenialReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthenticationAttemptResponse {

    private Instant attemptedAt;
    private String channelId;
    private double score;
    private ConfidenceBand band;
    private boolean success;
    private DenialReason reason;
    private boolean challengeRequired;
    private boolean challengePassed;

    public static AuthenticationAttemptResponse from(AuthenticationAttempt attempt) {
        return AuthenticationAttemptResponse.builder()
            .attemptedAt(attempt.getAttemptedAt())
            .channelId(attempt.getChannelId())
            .score(attempt.getScore())
            .band(attempt.getBand())
            .success(attempt.isSuccess())
            .reason(attempt.getReason())
            .challengeRequired(attempt.isChallengeRequired())
            .challengePassed(attempt.isChallengePassed())
            .build();
    }
}
