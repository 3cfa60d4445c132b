package com.memoryvault.domain.model;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One append-only audit line on a {@link SecretRecord}. {@code sequence} is
 * the per-record append order, starting at 1.
 */
@Value
public class AccessLogEntry {

    /** Principal recorded when a request carried no usable session. */
    public static final String UNAUTHENTICATED = "unauthenticated";

    long sequence;
    UUID recordId;
    String principalId;
    Instant timestamp;
    boolean success;
    String reason;
}
