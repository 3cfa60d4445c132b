package com.memoryvault.infrastructure.persistence;

import com.memoryvault.domain.model.ContactAuthorizationProfile;
import com.memoryvault.domain.repository.ContactDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory stand-in for the contact-management collaborator. Profiles are
 * keyed on the ordered (owner, contact) pair: trust is not symmetric.
 */
@Component
@Slf4j
public class InMemoryContactDirectory implements ContactDirectory {

    private final Map<String, ContactAuthorizationProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<ContactAuthorizationProfile> findProfile(String ownerId, String contactId) {
        return Optional.ofNullable(profiles.get(key(ownerId, contactId)));
    }

    public void save(ContactAuthorizationProfile profile) {
        profiles.put(key(profile.getOwnerId(), profile.getContactId()), profile);
        log.info("Contact profile stored: owner={}, contact={}, level={}",
            profile.getOwnerId(), profile.getContactId(), profile.getKnowledgeAccessLevel());
    }

    private static String key(String ownerId, String contactId) {
        return ownerId + '\u0000' + contactId;
    }
}
