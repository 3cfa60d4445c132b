package com.memoryvault.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.VerificationOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Outcome of a voice or challenge verification.
 *
 * <p>{@code outcome} is AUTHENTICATED, CHALLENGE_REQUIRED or DENIED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerificationResponse {

    private String outcome;
    private double score;
    private String sessionId;
    private Instant expiresAt;
    private Set<String> factors;
    private List<ChallengeView> challenges;
    private String message;

    public static VerificationResponse from(VerificationOutcome outcome) {
        if (outcome instanceof VerificationOutcome.Authenticated authenticated) {
            AuthSession session = authenticated.getSession();
            return VerificationResponse.builder()
                .outcome("AUTHENTICATED")
                .score(authenticated.getScore())
                .sessionId(session.getSessionId())
                .expiresAt(session.getExpiresAt())
                .factors(SessionResponse.factorNames(session))
                .build();
        }
        if (outcome instanceof VerificationOutcome.ChallengeRequired required) {
            return VerificationResponse.builder()
                .outcome("CHALLENGE_REQUIRED")
                .score(required.getScore())
                .challenges(required.getChallenges().stream().map(ChallengeView::from).toList())
                .build();
        }
        VerificationOutcome.Denied denied = (VerificationOutcome.Denied) outcome;
        return VerificationResponse.builder()
            .outcome("DENIED")
            .score(denied.getScore())
            .message(denied.getMessage())
            .build();
    }
}
