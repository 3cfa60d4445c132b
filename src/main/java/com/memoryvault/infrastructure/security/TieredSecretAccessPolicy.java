package com.memoryvault.infrastructure.security;

import com.memoryvault.domain.model.AccessBasis;
import com.memoryvault.domain.model.ContactAuthorizationProfile;
import com.memoryvault.domain.model.KnowledgeAccessLevel;
import com.memoryvault.domain.model.SecretRecord;
import com.memoryvault.domain.repository.ContactDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Tiered access kernel for secret records.
 *
 * Rules, first match wins:
 * 1. The owner may always read
 * 2. A principal on the record's own authorized list may read
 * 3. A contact whose knowledge-access level, as granted by the owner,
 *    meets the tier minimum may read
 *
 * Authorization is per record. Being on one record's list says nothing about
 * any other record, whatever its tier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TieredSecretAccessPolicy implements SecretAccessPolicy {

    private final ContactDirectory contactDirectory;

    @Override
    public AccessBasis authorizeRead(SecretRecord record, String requesterId) {
        UUID requestId = UUID.randomUUID();

        log.debug("Authorization check [{}]: principal={}, operation=READ, record={}, tier={}",
            requestId, requesterId, record.getId(), record.getTier());

        if (record.isOwnedBy(requesterId)) {
            return granted(requestId, requesterId, record, AccessBasis.OWNER);
        }

        if (record.isExplicitlyAuthorized(requesterId)) {
            return granted(requestId, requesterId, record, AccessBasis.AUTHORIZED_LIST);
        }

        KnowledgeAccessLevel required = record.getTier().requiredAccessLevel();
        Optional<ContactAuthorizationProfile> profile =
            contactDirectory.findProfile(record.getOwnerId(), requesterId);

        if (profile.isPresent() && profile.get().getKnowledgeAccessLevel().meetsOrExceeds(required)) {
            return granted(requestId, requesterId, record, AccessBasis.CONTACT_LEVEL);
        }

        log.warn("AUTHORIZATION DENIED [{}]: principal={}, record={}, required={}, actual={}",
            requestId, requesterId, record.getId(), required,
            profile.map(ContactAuthorizationProfile::getKnowledgeAccessLevel).orElse(null));
        return AccessBasis.NONE;
    }

    private static AccessBasis granted(UUID requestId, String requesterId, SecretRecord record, AccessBasis basis) {
        log.info("AUTHORIZATION GRANTED [{}]: principal={}, operation=READ, record={}, basis={}",
            requestId, requesterId, record.getId(), basis);
        return basis;
    }
}
