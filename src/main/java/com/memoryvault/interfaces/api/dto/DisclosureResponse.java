package com.memoryvault.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.memoryvault.domain.model.DisclosureRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Disclosure metadata as seen by its owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DisclosureResponse {

    private UUID id;
    private String title;
    private String ownerId;
    private boolean romanticIntent;
    private String designatedReaderId;
    private String targetPrincipalId;
    private String targetName;
    private boolean matched;
    private Instant matchedAt;
    private String matchedWith;
    private Instant createdAt;
    private String content;

    public static DisclosureResponse from(DisclosureRecord record) {
        return DisclosureResponse.builder()
            .id(record.getId())
            .title(record.getTitle())
            .ownerId(record.getOwnerId())
            .romanticIntent(record.isRomanticIntent())
            .designatedReaderId(record.getDesignatedReaderId().orElse(null))
            .targetPrincipalId(record.getTargetPrincipalId().orElse(null))
            .targetName(record.getTargetName().orElse(null))
            .matched(record.isMatched())
            .matchedAt(record.getMatchedAt().orElse(null))
            .matchedWith(record.getMatchedWith().orElse(null))
            .createdAt(record.getCreatedAt())
            .build();
    }

    public static DisclosureResponse content(UUID id, String plaintext) {
        return DisclosureResponse.builder()
            .id(id)
            .content(plaintext)
            .build();
    }
}
