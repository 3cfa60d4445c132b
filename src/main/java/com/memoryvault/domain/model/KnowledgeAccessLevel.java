package com.memoryvault.domain.model;

/**
 * Coarse knowledge-access tier a principal grants to one of their contacts.
 * Higher levels see more.
 */
public enum KnowledgeAccessLevel {
    /** Small talk, public facts. */
    GENERAL(1),

    /** Personal but not sensitive. */
    PERSONAL(2),

    /** Trusted with secrets. */
    SECRET(3),

    /** Inner circle. */
    ULTRA_SECRET(4);

    private final int level;

    KnowledgeAccessLevel(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    public boolean meetsOrExceeds(KnowledgeAccessLevel required) {
        return this.level >= required.level;
    }
}
