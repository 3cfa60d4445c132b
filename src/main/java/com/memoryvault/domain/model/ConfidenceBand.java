package com.memoryvault.domain.model;

/**
 * Partition of a voice similarity score.
 */
public enum ConfidenceBand {
    /** At or above the high threshold: authenticate. */
    HIGH,

    /** Between the low (inclusive) and high (exclusive) thresholds: challenge. */
    AMBIGUOUS,

    /** Below the low threshold: deny. */
    LOW
}
