package com.memoryvault.application;

/**
 * Compares one response with the answer captured at issue time.
 */
public interface ChallengeResponseVerifier {

    boolean matches(IssuedChallenge challenge, String response);
}
