package com.memoryvault.domain.model;

/**
 * Rule that decided a secret-record access check, in evaluation order.
 */
public enum AccessBasis {
    OWNER("owner"),
    AUTHORIZED_LIST("authorized"),
    CONTACT_LEVEL("contact-level"),
    NONE("denied");

    private final String logReason;

    AccessBasis(String logReason) {
        this.logReason = logReason;
    }

    /**
     * Reason written to the record's access log.
     */
    public String getLogReason() {
        return logReason;
    }

    public boolean isGranted() {
        return this != NONE;
    }
}
