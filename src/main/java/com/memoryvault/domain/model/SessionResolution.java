package com.memoryvault.domain.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Result of looking a session id up at a given instant.
 */
public sealed interface SessionResolution permits SessionResolution.Active, SessionResolution.Rejected {

    static SessionResolution active(AuthSession session) {
        return new Active(session);
    }

    static SessionResolution rejected(DenialReason reason) {
        return new Rejected(reason);
    }

    default Optional<AuthSession> session() {
        return this instanceof Active active ? Optional.of(active.getSession()) : Optional.empty();
    }

    @Value
    final class Active implements SessionResolution {
        @NonNull AuthSession session;
    }

    @Value
    final class Rejected implements SessionResolution {
        @NonNull DenialReason reason;
    }
}
