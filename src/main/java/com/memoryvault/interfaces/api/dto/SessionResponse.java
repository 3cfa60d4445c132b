package com.memoryvault.interfaces.api.dto;

import com.memoryvault.domain.model.AuthSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The caller's own session, without its id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResponse {

    private String principalId;
    private String channelId;
    private Instant issuedAt;
    private Instant expiresAt;
    private double confidence;
    private Set<String> factors;
    private String boundCategory;

    public static SessionResponse from(AuthSession session) {
        return SessionResponse.builder()
            .principalId(session.getPrincipalId())
            .channelId(session.getChannelId())
            .issuedAt(session.getIssuedAt())
            .expiresAt(session.getExpiresAt())
            .confidence(session.getConfidence())
            .factors(factorNames(session))
            .boundCategory(session.getBoundCategory().orElse(null))
            .build();
    }

    static Set<String> factorNames(AuthSession session) {
        Set<String> names = new LinkedHashSet<>();
        session.getFactors().forEach(factor -> names.add(factor.name()));
        return names;
    }
}
