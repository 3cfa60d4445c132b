package com.memoryvault.domain.model;

public enum ChallengeType {
    /** Date of the most recent memory. */
    TEMPORAL,

    /** Continuation of a truncated memory. */
    CONTENT,

    /** How a person mentioned in a family memory is related. */
    RELATIONSHIP,

    /** Fallback when the principal has no memories yet. */
    IDENTITY
}
