package com.memoryvault.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SecretTierTest {

    @ParameterizedTest
    @CsvSource({
        "SECRET, PERSONAL",
        "CONFIDENTIAL, SECRET",
        "ULTRA_SECRET, SECRET"
    })
    void tierMinimums(SecretTier tier, KnowledgeAccessLevel required) {
        assertEquals(required, tier.requiredAccessLevel());
    }

    @Test
    void tiersAreStrictlyOrdered() {
        assertTrue(SecretTier.ULTRA_SECRET.isMoreSensitiveThan(SecretTier.CONFIDENTIAL));
        assertTrue(SecretTier.CONFIDENTIAL.isMoreSensitiveThan(SecretTier.SECRET));
        assertFalse(SecretTier.SECRET.isMoreSensitiveThan(SecretTier.SECRET));
    }

    @Test
    void accessLevelComparison() {
        assertTrue(KnowledgeAccessLevel.ULTRA_SECRET.meetsOrExceeds(KnowledgeAccessLevel.SECRET));
        assertTrue(KnowledgeAccessLevel.SECRET.meetsOrExceeds(KnowledgeAccessLevel.SECRET));
        assertFalse(KnowledgeAccessLevel.GENERAL.meetsOrExceeds(KnowledgeAccessLevel.PERSONAL));
    }
}
