package com.memoryvault.domain.model;

/**
 * Why an authentication or authorization request was refused.
 *
 * <p>{@link #getDisplayMessage()} is what callers may show. Record-level
 * refusals ({@link #RECORD_NOT_FOUND}, {@link #AUTHORIZATION_DENIED}) share one
 * message so a stranger cannot tell a missing record from a forbidden one.
 */
public enum DenialReason {
    NOT_ENROLLED("Voice profile not enrolled"),
    AUTHENTICATION_DENIED("Voice not recognized"),
    RATE_LIMITED("Too many attempts. Please try again later."),
    CHALLENGE_NOT_PENDING("No pending verification challenge"),
    CHALLENGE_FAILED("Challenge answers did not match"),
    CHALLENGE_ATTEMPTS_EXHAUSTED("Maximum attempts exceeded. Please verify your voice again."),
    SESSION_EXPIRED("Session expired"),
    SESSION_NOT_FOUND("No active session"),
    CATEGORY_NOT_COVERED("Session does not cover this category"),
    AUTHORIZATION_DENIED("Access denied"),
    RECORD_NOT_FOUND("Access denied");

    private final String displayMessage;

    DenialReason(String displayMessage) {
        this.displayMessage = displayMessage;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
