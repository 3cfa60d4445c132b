package com.memoryvault.application;

import com.memoryvault.domain.model.Challenge;
import com.memoryvault.domain.model.ChallengeType;
import lombok.NonNull;
import lombok.Value;

/**
 * A challenge together with the answer captured when it was issued. Stays
 * server-side; only {@link #getChallenge()} is ever handed out.
 */
@Value
public class IssuedChallenge {
    @NonNull Challenge challenge;
    @NonNull String expectedAnswer;

    public String getId() {
        return challenge.getId();
    }

    public ChallengeType getType() {
        return challenge.getType();
    }

    @Override
    public String toString() {
        return "IssuedChallenge[id=" + challenge.getId() + ", type=" + challenge.getType() + "]";
    }
}
