package com.memoryvault.domain.model;

/**
 * Proof mechanism that contributed to an {@link AuthSession}.
 * Declaration order is the order factors are reported in.
 */
public enum SessionFactor {
    VOICE,
    CHALLENGE
}
