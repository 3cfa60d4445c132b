package com.memoryvault.interfaces.api;

import com.memoryvault.application.DisclosureService;
import com.memoryvault.application.SessionContextProvider;
import com.memoryvault.domain.model.AccessResult;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.DisclosureRecord;
import com.memoryvault.domain.model.EncryptedValue;
import com.memoryvault.interfaces.api.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class DisclosureControllerTest {

    @Mock
    private DisclosureService disclosureService;

    @Mock
    private SessionContextProvider sessionContext;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DisclosureController(disclosureService, sessionContext))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    private static DisclosureRecord record(String target) {
        EncryptedValue content = EncryptedValue.builder()
            .ciphertext(new byte[] {1})
            .wrappedKey(new byte[60])
            .keyId("test-key")
            .iv(new byte[12])
            .authTag(new byte[16])
            .build();
        return DisclosureRecord.create(UUID.randomUUID(), "About Bob", content, "alice", true, target, "Bob",
            Instant.parse("2026-03-14T10:00:00Z"));
    }

    @Test
    void createReturnsClassificationWithoutContent() throws Exception {
        DisclosureRecord record = record("bob");
        when(sessionContext.currentPrincipalId()).thenReturn("alice");
        when(disclosureService.create("alice", "About Bob", "I love Bob", "bob", "Bob")).thenReturn(record);

        mockMvc.perform(post("/api/v1/disclosures")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"About Bob\",\"content\":\"I love Bob\","
                    + "\"targetPrincipalId\":\"bob\",\"targetName\":\"Bob\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.romanticIntent").value(true))
            .andExpect(jsonPath("$.matched").value(false))
            .andExpect(jsonPath("$.content").doesNotExist());
    }

    @Test
    void createRequiresContent() throws Exception {
        mockMvc.perform(post("/api/v1/disclosures")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\":\"About Bob\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.validationErrors[0].field").value("content"));
    }

    @Test
    void readerSeesContent() throws Exception {
        UUID id = UUID.randomUUID();
        when(disclosureService.readWithSession(id, "session-1")).thenReturn(AccessResult.granted("I love Bob"));

        mockMvc.perform(get("/api/v1/disclosures/{id}", id).header("X-Auth-Session", "session-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content").value("I love Bob"));
    }

    @Test
    void nonReaderIsForbidden() throws Exception {
        UUID id = UUID.randomUUID();
        when(disclosureService.readWithSession(id, "session-1"))
            .thenReturn(AccessResult.denied(DenialReason.AUTHORIZATION_DENIED));

        mockMvc.perform(get("/api/v1/disclosures/{id}", id).header("X-Auth-Session", "session-1"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value("Access denied"));
    }

    @Test
    void designateReaderReturnsTheReader() throws Exception {
        DisclosureRecord record = record(null);
        record.assignDesignatedReader("carol");
        when(sessionContext.currentPrincipalId()).thenReturn("alice");
        when(disclosureService.setDesignatedReader(record.getId(), "alice", "carol"))
            .thenReturn(AccessResult.granted(record));

        mockMvc.perform(put("/api/v1/disclosures/{id}/reader", record.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"readerId\":\"carol\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.designatedReaderId").value("carol"));
    }
}
