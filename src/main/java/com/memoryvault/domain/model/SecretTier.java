package com.memoryvault.domain.model;

/**
 * Sensitivity tier of a {@link SecretRecord}, in strictly increasing order.
 */
public enum SecretTier {
    SECRET,
    CONFIDENTIAL,
    ULTRA_SECRET;

    /**
     * Minimum contact knowledge-access level that grants default (non-explicit)
     * read access to a record at this tier.
     *
     * <p>The switch has no default branch: adding a tier without a mapping is
     * a compile error.
     */
    public KnowledgeAccessLevel requiredAccessLevel() {
        return switch (this) {
            case SECRET -> KnowledgeAccessLevel.PERSONAL;
            case CONFIDENTIAL -> KnowledgeAccessLevel.SECRET;
            case ULTRA_SECRET -> KnowledgeAccessLevel.SECRET;
        };
    }

    public boolean isMoreSensitiveThan(SecretTier other) {
        return this.ordinal() > other.ordinal();
    }
}
