package com.memoryvault.domain.repository;

import com.memoryvault.domain.model.ContactAuthorizationProfile;

import java.util.Optional;

/**
 * Port to the external contact-management collaborator.
 */
public interface ContactDirectory {

    /**
     * Profile {@code ownerId} keeps for {@code contactId}, if any.
     */
    Optional<ContactAuthorizationProfile> findProfile(String ownerId, String contactId);
}
