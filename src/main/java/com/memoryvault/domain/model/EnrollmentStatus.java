package com.memoryvault.domain.model;

public enum EnrollmentStatus {
    PENDING_ENROLLMENT,
    ENROLLED,
    SUSPENDED
}
