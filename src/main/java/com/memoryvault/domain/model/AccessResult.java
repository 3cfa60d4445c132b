package com.memoryvault.domain.model;

import lombok.NonNull;
import lombok.Value;

import java.util.function.Function;

/**
 * Outcome of a guarded read or owner-only mutation.
 *
 * @param <T> payload released on success
 */
public sealed interface AccessResult<T> permits AccessResult.Granted, AccessResult.Denied {

    static <T> AccessResult<T> granted(T value) {
        return new Granted<>(value);
    }

    static <T> AccessResult<T> denied(DenialReason reason) {
        return new Denied<>(reason);
    }

    default boolean isGranted() {
        return this instanceof Granted;
    }

    default <R> AccessResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Granted<T> granted) {
            return new Granted<>(mapper.apply(granted.getValue()));
        }
        return new Denied<>(((Denied<T>) this).getReason());
    }

    @Value
    final class Granted<T> implements AccessResult<T> {
        @NonNull T value;
    }

    @Value
    final class Denied<T> implements AccessResult<T> {
        @NonNull DenialReason reason;

        public String getMessage() {
            return reason.getDisplayMessage();
        }
    }
}
