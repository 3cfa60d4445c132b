package com.memoryvault.infrastructure.audit;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record as published on the application event bus. Carries ids and
 * outcomes only, never secret content.
 */
@Value
@Builder
public class AuditEvent {
    String category;
    String action;
    String resourceId;
    String principalId;
    String detail;
    Instant createdAt;
}
