package com.memoryvault.application;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Unordered pair of principal ids: {@code of(a, b).equals(of(b, a))}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PrincipalPair {
    String first;
    String second;

    public static PrincipalPair of(String a, String b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("Both principal ids are required");
        }
        return a.compareTo(b) <= 0 ? new PrincipalPair(a, b) : new PrincipalPair(b, a);
    }
}
