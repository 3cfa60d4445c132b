package com.memoryvault.application;

import com.memoryvault.config.AuthProperties;
import com.memoryvault.domain.model.ConfidenceBand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Partitions a voice similarity score into the three authentication bands.
 * Both thresholds are inclusive lower bounds.
 */
@Component
@RequiredArgsConstructor
public class ConfidencePolicy {

    private final AuthProperties properties;

    public ConfidenceBand classify(double score) {
        if (score >= properties.getHighConfidenceThreshold()) {
            return ConfidenceBand.HIGH;
        }
        if (score >= properties.getChallengeThreshold()) {
            return ConfidenceBand.AMBIGUOUS;
        }
        return ConfidenceBand.LOW;
    }
}
