package com.memoryvault.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Snapshot of how much one principal ({@code ownerId}) trusts one of their
 * contacts ({@code contactId}). Owned by the external contact-management
 * collaborator; the vault only reads it.
 */
@Value
@Builder
public class ContactAuthorizationProfile {
    @NonNull String ownerId;
    @NonNull String contactId;
    @NonNull RelationshipType relationshipType;
    @NonNull KnowledgeAccessLevel knowledgeAccessLevel;
}
