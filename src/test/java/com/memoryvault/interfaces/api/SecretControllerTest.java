package com.memoryvault.interfaces.api;

import com.memoryvault.application.SecretVault;
import com.memoryvault.application.SessionContextProvider;
import com.memoryvault.domain.model.AccessLogEntry;
import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.EncryptedValue;
import com.memoryvault.domain.model.SecretRecord;
import com.memoryvault.domain.model.SecretTier;
import com.memoryvault.interfaces.api.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SecretControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-14T10:00:00Z");

    @Mock
    private SecretVault secretVault;

    @Mock
    private SessionContextProvider sessionContext;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SecretController(secretVault, sessionContext))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static SecretRecord record(SecretTier tier) {
        EncryptedValue content = EncryptedValue.builder()
            .ciphertext(new byte[] {1})
            .wrappedKey(new byte[60])
            .keyId("test-key")
            .iv(new byte[12])
            .authTag(new byte[16])
            .build();
        return SecretRecord.create(UUID.randomUUID(), "Diary", tier, "alice", content, Set.of("bob"), NOW);
    }

    @Test
    void createReturnsMetadataWithoutContent() throws Exception {
        SecretRecord record = record(SecretTier.CONFIDENTIAL);
        when(sessionContext.currentPrincipalId()).thenReturn("alice");
        when(secretVault.put(eq("alice"), eq(SecretTier.CONFIDENTIAL), eq("Diary"), eq("dear diary"), any()))
            .thenReturn(record);

        mockMvc.perform(post("/api/v1/secrets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Diary\",\"tier\":\"CONFIDENTIAL\",\"content\":\"dear diary\","
                    + "\"authorizedPrincipals\":[\"bob\"]}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(record.getId().toString()))
            .andExpect(jsonPath("$.tier").value("CONFIDENTIAL"))
            .andExpect(jsonPath("$.authorizedCount").value(1))
            .andExpect(jsonPath("$.content").doesNotExist());
    }

    @Test
    void createRejectsMissingTier() throws Exception {
        mockMvc.perform(post("/api/v1/secrets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Diary\",\"content\":\"dear diary\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.validationErrors[0].field").value("tier"));

        verifyNoInteractions(secretVault);
    }

    @Test
    void createRejectsUnknownTier() throws Exception {
        mockMvc.perform(post("/api/v1/secrets")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"Diary\",\"tier\":\"TOP\",\"content\":\"x\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Malformed request"));
    }

    @Test
    void readReleasesContent() throws Exception {
        UUID id = UUID.randomUUID();
        when(secretVault.getWithSession(id, "session-1")).thenReturn(AccessResult.granted("dear diary"));

        mockMvc.perform(get("/api/v1/secrets/{id}", id).header("X-Auth-Session", "session-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content").value("dear diary"));
    }

    @Test
    void deniedReadIsForbiddenWithUniformMessage() throws Exception {
        UUID id = UUID.randomUUID();
        when(secretVault.getWithSession(id, "session-1")).thenReturn(AccessResult.denied(DenialReason.RECORD_NOT_FOUND));

        mockMvc.perform(get("/api/v1/secrets/{id}", id).header("X-Auth-Session", "session-1"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value("Access denied"));
    }

    @Test
    void expiredSessionIsUnauthorized() throws Exception {
        UUID id = UUID.randomUUID();
        when(secretVault.getWithSession(id, "old")).thenReturn(AccessResult.denied(DenialReason.SESSION_EXPIRED));

        mockMvc.perform(get("/api/v1/secrets/{id}", id).header("X-Auth-Session", "old"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void readWithoutSessionHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/secrets/{id}", UUID.randomUUID()))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(secretVault);
    }

    @Test
    void accessLogIsOwnerOnly() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionContext.currentPrincipalId()).thenReturn("bob");
        when(secretVault.accessLog(id, "bob")).thenReturn(AccessResult.denied(DenialReason.AUTHORIZATION_DENIED));

        mockMvc.perform(get("/api/v1/secrets/{id}/access-log", id))
            .andExpect(status().isForbidden());
    }

    @Test
    void accessLogListsEntriesInOrder() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionContext.currentPrincipalId()).thenReturn("alice");
        when(secretVault.accessLog(id, "alice")).thenReturn(AccessResult.granted(List.of(
            new AccessLogEntry(1, id, "bob", NOW, true, "authorized"),
            new AccessLogEntry(2, id, AccessLogEntry.UNAUTHENTICATED, NOW, false, "session-not-found"))));

        mockMvc.perform(get("/api/v1/secrets/{id}/access-log", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(2)))
            .andExpect(jsonPath("$[1].principalId").value("unauthenticated"))
            .andExpect(jsonPath("$[1].success").value(false));
    }

    @Test
    void reclassifyReturnsNewId() throws Exception {
        UUID id = UUID.randomUUID();
        SecretRecord replacement = record(SecretTier.ULTRA_SECRET);
        when(sessionContext.currentPrincipalId()).thenReturn("alice");
        when(secretVault.reclassify(id, "alice", SecretTier.ULTRA_SECRET)).thenReturn(AccessResult.granted(replacement));

        mockMvc.perform(put("/api/v1/secrets/{id}/tier", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"tier\":\"ULTRA_SECRET\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(replacement.getId().toString()));
    }

    @Test
    void deleteReturnsNoContent() throws Exception {
        UUID id = UUID.randomUUID();
        when(sessionContext.currentPrincipalId()).thenReturn("alice");
        when(secretVault.delete(id, "alice")).thenReturn(AccessResult.granted(id));

        mockMvc.perform(delete("/api/v1/secrets/{id}", id))
            .andExpect(status().isNoContent());

        verify(secretVault).delete(id, "alice");
    }

    @Test
    void missingSessionIsUnauthorized() throws Exception {
        when(sessionContext.currentPrincipalId()).thenThrow(new AuthenticationCredentialsNotFoundException("No active session"));

        mockMvc.perform(get("/api/v1/secrets"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.message").value("No active session"));

        verify(secretVault, never()).listOwned(anyString());
    }
}
