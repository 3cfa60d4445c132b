package com.memoryvault.domain.model;

/**
 * Relationship of a contact to the principal who keeps the contact list.
 */
public enum RelationshipType {
    FAMILY,
    PARTNER,
    FRIEND,
    COLLEAGUE,
    ACQUAINTANCE,
    OTHER
}
