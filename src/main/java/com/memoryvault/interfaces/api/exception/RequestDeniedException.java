package com.memoryvault.interfaces.api.exception;

import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.DenialReason;

/**
 * Raised at the REST boundary when a service returned a denial value.
 */
public class RequestDeniedException extends RuntimeException {

    private final DenialReason reason;

    public RequestDeniedException(DenialReason reason) {
        super(reason.getDisplayMessage());
        this.reason = reason;
    }

    public DenialReason getReason() {
        return reason;
    }

    /**
     * Unwraps a granted result or throws with the denial reason.
     */
    public static <T> T unwrap(AccessResult<T> result) {
        if (result instanceof AccessResult.Granted<T> granted) {
            return granted.getValue();
        }
        throw new RequestDeniedException(((AccessResult.Denied<T>) result).getReason());
    }
}
