package com.memoryvault.infrastructure.audit;

/**
 * Audit service for recording security-relevant events.
 * Categories in use: AUTHENTICATION, CHALLENGE, VAULT, DISCLOSURE, ACCOUNT.
 */
public interface AuditService {
    void record(String category, String action, String resourceId, String principalId, String detail);
}
