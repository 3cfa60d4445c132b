package com.memoryvault.domain.model;

import lombok.Value;

import java.util.UUID;

/**
 * Matched flags of two disclosures read under the same pair lock.
 */
@Value
public class DisclosurePairState {
    UUID firstRecordId;
    boolean firstMatched;
    UUID secondRecordId;
    boolean secondMatched;

    public boolean isMutuallyMatched() {
        return firstMatched && secondMatched;
    }
}
