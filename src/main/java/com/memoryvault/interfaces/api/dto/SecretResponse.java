package com.memoryvault.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memoryvault.domain.model.SecretRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Secret metadata, with the plaintext only when it was released by a read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SecretResponse {

    private UUID id;
    private String title;
    private String tier;
    private String ownerId;
    private Integer authorizedCount;
    private Long accessCount;
    private Instant createdAt;
    private Instant lastAccessAt;
    private String content;

    public static SecretResponse metadata(SecretRecord record) {
        return SecretResponse.builder()
            .id(record.getId())
            .title(record.getTitle())
            .tier(record.getTier().name())
            .ownerId(record.getOwnerId())
            .authorizedCount(record.getAuthorizedPrincipals().size())
            .accessCount(record.getAccessCount())
            .createdAt(record.getCreatedAt())
            .lastAccessAt(record.getLastAccessAt().orElse(null))
            .build();
    }

    public static SecretResponse content(UUID id, String plaintext) {
        return SecretResponse.builder()
            .id(id)
            .content(plaintext)
            .build();
    }
}
