package com.memoryvault.application;

import com.memoryvault.application.event.AccessLogEvent;
import com.memoryvault.application.exceptions.DecryptionFailedException;
import com.memoryvault.domain.model.AccessLogEntry;
import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.ContactAuthorizationProfile;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.EncryptedValue;
import com.memoryvault.domain.model.KnowledgeAccessLevel;
import com.memoryvault.domain.model.RelationshipType;
import com.memoryvault.domain.model.SecretRecord;
import com.memoryvault.domain.model.SecretTier;
import com.memoryvault.domain.model.SessionFactor;
import com.memoryvault.support.CoreFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SecretVaultTest {

    private CoreFixture fixture;
    private SecretVault vault;

    @BeforeEach
    void setUp() {
        fixture = new CoreFixture();
        vault = fixture.vault;
        contact("alice", "bob", RelationshipType.FAMILY, KnowledgeAccessLevel.SECRET);
        contact("alice", "carol", RelationshipType.FRIEND, KnowledgeAccessLevel.PERSONAL);
    }

    private void contact(String ownerId, String contactId, RelationshipType type, KnowledgeAccessLevel level) {
        fixture.contacts.save(ContactAuthorizationProfile.builder()
            .ownerId(ownerId)
            .contactId(contactId)
            .relationshipType(type)
            .knowledgeAccessLevel(level)
            .build());
    }

    private AuthSession sessionFor(String principalId) {
        return fixture.sessionIssuer.open(principalId, "sms", 0.92, EnumSet.of(SessionFactor.VOICE), null);
    }

    @Test
    void ownerReadsOwnSecret() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "I still keep the letters", Set.of());

        AccessResult<String> result = vault.get(record.getId(), "alice");

        assertEquals("I still keep the letters", ((AccessResult.Granted<String>) result).getValue());
        assertEquals(1, record.getAccessCount());
        assertEquals(CoreFixture.START, record.getLastAccessAt().orElseThrow());
    }

    @Test
    void contentIsEncryptedAtRest() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "I still keep the letters", Set.of());

        String stored = new String(record.getContent().getCiphertext(), StandardCharsets.UTF_8);
        assertFalse(stored.contains("letters"));
    }

    @Test
    void contactAtSecretLevelReadsUltraSecretButPersonalDoesNot() {
        SecretRecord record = vault.put("alice", SecretTier.ULTRA_SECRET, "The accident", "It was me driving", Set.of());

        assertTrue(vault.get(record.getId(), "bob").isGranted());

        AccessResult<String> denied = vault.get(record.getId(), "carol");
        assertEquals(DenialReason.AUTHORIZATION_DENIED, ((AccessResult.Denied<String>) denied).getReason());

        List<AccessLogEntry> log = record.getAccessLog();
        assertEquals(2, log.size());
        assertEquals("bob", log.get(0).getPrincipalId());
        assertTrue(log.get(0).isSuccess());
        assertEquals("contact-level", log.get(0).getReason());
        assertEquals("carol", log.get(1).getPrincipalId());
        assertFalse(log.get(1).isSuccess());
        assertEquals(2, log.get(1).getSequence());
        assertEquals(1, record.getAccessCount());
    }

    @Test
    void personalContactReadsSecretTier() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Gift", "Bought the ring", Set.of());

        assertTrue(vault.get(record.getId(), "carol").isGranted());
    }

    @Test
    void explicitAuthorizationDoesNotCarryOverToOtherRecords() {
        SecretRecord shared = vault.put("alice", SecretTier.ULTRA_SECRET, "Shared", "for dave", Set.of("dave"));
        SecretRecord other = vault.put("alice", SecretTier.SECRET, "Other", "not for dave", Set.of());

        assertTrue(vault.get(shared.getId(), "dave").isGranted());
        assertFalse(vault.get(other.getId(), "dave").isGranted());
        assertEquals("authorized", shared.getAccessLog().get(0).getReason());
    }

    @Test
    void missingAndForbiddenRecordsLookTheSame() {
        SecretRecord record = vault.put("alice", SecretTier.CONFIDENTIAL, "Plan", "moving abroad", Set.of());

        AccessResult.Denied<String> forbidden = (AccessResult.Denied<String>) vault.get(record.getId(), "mallory");
        AccessResult.Denied<String> missing = (AccessResult.Denied<String>) vault.get(UUID.randomUUID(), "mallory");

        assertEquals(forbidden.getMessage(), missing.getMessage());
        assertEquals("Access denied", missing.getMessage());
    }

    @Test
    void everyAttemptIsPublishedInOrder() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "entry", Set.of());

        vault.get(record.getId(), "alice");
        vault.get(record.getId(), "mallory");
        vault.get(record.getId(), "carol");

        List<AccessLogEvent> published = fixture.eventsOf(AccessLogEvent.class);
        assertEquals(3, published.size());
        assertEquals(List.of(1L, 2L, 3L), published.stream().map(e -> e.getEntry().getSequence()).toList());
        assertTrue(published.stream().allMatch(e -> e.getOwnerId().equals("alice")));
        assertEquals(record.getAccessLog(), published.stream().map(AccessLogEvent::getEntry).toList());
    }

    @Test
    void sessionReadResolvesTheRequester() {
        SecretRecord record = vault.put("alice", SecretTier.ULTRA_SECRET, "Key", "under the mat", Set.of());

        AccessResult<String> result = vault.getWithSession(record.getId(), sessionFor("bob").getSessionId());

        assertTrue(result.isGranted());
        assertEquals("bob", record.getAccessLog().get(0).getPrincipalId());
    }

    @Test
    void unusableSessionIsLoggedAsUnauthenticated() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "entry", Set.of());

        AccessResult<String> result = vault.getWithSession(record.getId(), "bogus");

        assertEquals(DenialReason.SESSION_NOT_FOUND, ((AccessResult.Denied<String>) result).getReason());
        AccessLogEntry entry = record.getAccessLog().get(0);
        assertEquals(AccessLogEntry.UNAUTHENTICATED, entry.getPrincipalId());
        assertEquals("session-not-found", entry.getReason());
        assertFalse(entry.isSuccess());
    }

    @Test
    void expiredSessionCannotRead() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "entry", Set.of());
        String sessionId = sessionFor("alice").getSessionId();
        fixture.clock.advance(Duration.ofMinutes(10));

        AccessResult<String> result = vault.getWithSession(record.getId(), sessionId);

        assertEquals(DenialReason.SESSION_EXPIRED, ((AccessResult.Denied<String>) result).getReason());
        assertEquals("session-expired", record.getAccessLog().get(0).getReason());
    }

    @Test
    void reclassifyMovesSecretToNewId() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Gift", "Bought the ring", Set.of());

        SecretRecord moved = ((AccessResult.Granted<SecretRecord>)
            vault.reclassify(record.getId(), "alice", SecretTier.ULTRA_SECRET)).getValue();

        assertNotEquals(record.getId(), moved.getId());
        assertEquals(SecretTier.ULTRA_SECRET, moved.getTier());
        assertTrue(fixture.secrets.findById(record.getId()).isEmpty());
        assertFalse(vault.get(moved.getId(), "carol").isGranted());
        assertEquals("Bought the ring", ((AccessResult.Granted<String>) vault.get(moved.getId(), "alice")).getValue());
    }

    @Test
    void onlyOwnerMayReclassifyDeleteOrSeeTheLog() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "entry", Set.of("bob"));

        assertFalse(vault.reclassify(record.getId(), "bob", SecretTier.CONFIDENTIAL).isGranted());
        assertFalse(vault.delete(record.getId(), "bob").isGranted());
        assertFalse(vault.accessLog(record.getId(), "bob").isGranted());
        assertTrue(fixture.secrets.findById(record.getId()).isPresent());

        assertTrue(vault.delete(record.getId(), "alice").isGranted());
        assertTrue(fixture.secrets.findById(record.getId()).isEmpty());
    }

    @Test
    void listOwnedReturnsOnlyOwnersSecrets() {
        vault.put("alice", SecretTier.SECRET, "One", "1", Set.of());
        vault.put("alice", SecretTier.CONFIDENTIAL, "Two", "2", Set.of());
        vault.put("bob", SecretTier.SECRET, "Three", "3", Set.of());

        assertEquals(2, vault.listOwned("alice").size());
    }

    @Test
    void undecryptableContentIsAnIntegrityFault() {
        EncryptedValue garbage = EncryptedValue.builder()
            .ciphertext(new byte[] {1, 2, 3, 4})
            .wrappedKey(new byte[60])
            .keyId("unknown-key")
            .iv(new byte[12])
            .authTag(new byte[16])
            .build();
        SecretRecord record = SecretRecord.create(UUID.randomUUID(), "Broken", SecretTier.SECRET, "alice",
            garbage, Set.of(), CoreFixture.START);
        fixture.secrets.save(record);

        DecryptionFailedException thrown = assertThrows(DecryptionFailedException.class,
            () -> vault.get(record.getId(), "alice"));

        assertEquals(record.getId(), thrown.getRecordId());
        AccessLogEntry entry = record.getAccessLog().get(0);
        assertFalse(entry.isSuccess());
        assertEquals("decryption-failed", entry.getReason());
        assertEquals(0, record.getAccessCount());
    }

    @Test
    void asyncReadCompletes() throws Exception {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "entry", Set.of());

        AccessResult<String> result = vault.getAsync(record.getId(), "alice").get(5, TimeUnit.SECONDS);

        assertTrue(result.isGranted());
    }

    @Test
    void nullContentIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> vault.put("alice", SecretTier.SECRET, "Diary", null, Set.of()));
    }

    @Test
    void reclassifiedIdKeepsItsAccessLog() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Gift", "Bought the ring", Set.of());
        assertFalse(vault.get(record.getId(), "mallory").isGranted());

        SecretRecord moved = ((AccessResult.Granted<SecretRecord>)
            vault.reclassify(record.getId(), "alice", SecretTier.ULTRA_SECRET)).getValue();
        AccessResult<String> late = vault.get(record.getId(), "bob");

        assertEquals(DenialReason.RECORD_NOT_FOUND, ((AccessResult.Denied<String>) late).getReason());
        List<AccessLogEntry> oldLog = ((AccessResult.Granted<List<AccessLogEntry>>)
            vault.accessLog(record.getId(), "alice")).getValue();
        assertEquals(2, oldLog.size());
        assertEquals("mallory", oldLog.get(0).getPrincipalId());
        assertFalse(oldLog.get(0).isSuccess());
        assertEquals("bob", oldLog.get(1).getPrincipalId());
        assertEquals("record-retired", oldLog.get(1).getReason());
        assertTrue(((AccessResult.Granted<List<AccessLogEntry>>) vault.accessLog(moved.getId(), "alice")).getValue().isEmpty());
        assertFalse(vault.accessLog(record.getId(), "bob").isGranted());
        assertFalse(vault.reclassify(record.getId(), "alice", SecretTier.CONFIDENTIAL).isGranted());
    }

    @Test
    void deletedSecretKeepsItsAccessLog() {
        SecretRecord record = vault.put("alice", SecretTier.SECRET, "Diary", "entry", Set.of());
        assertTrue(vault.get(record.getId(), "carol").isGranted());

        assertTrue(vault.delete(record.getId(), "alice").isGranted());

        assertFalse(vault.get(record.getId(), "alice").isGranted());
        List<AccessLogEntry> log = ((AccessResult.Granted<List<AccessLogEntry>>)
            vault.accessLog(record.getId(), "alice")).getValue();
        assertEquals(List.of(1L, 2L), log.stream().map(AccessLogEntry::getSequence).toList());
        assertTrue(log.get(0).isSuccess());
        assertFalse(log.get(1).isSuccess());
        assertFalse(vault.delete(record.getId(), "alice").isGranted());
    }
}
