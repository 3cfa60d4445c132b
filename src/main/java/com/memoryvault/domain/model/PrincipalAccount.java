package com.memoryvault.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Authentication-facing view of a user account.
 */
@Value
@Builder
public class PrincipalAccount {
    @NonNull String principalId;
    @NonNull String displayName;
    @With @NonNull EnrollmentStatus status;
    @NonNull Instant createdAt;

    public boolean isEnrolled() {
        return status == EnrollmentStatus.ENROLLED;
    }
}
