package com.memoryvault.interfaces.api.dto;

import com.memoryvault.domain.model.AccessLogEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessLogEntryResponse {

    private long sequence;
    private String principalId;
    private Instant timestamp;
    private boolean success;
    private String reason;

    public static AccessLogEntryResponse from(AccessLogEntry entry) {
        return new AccessLogEntryResponse(
            entry.getSequence(), entry.getPrincipalId(), entry.getTimestamp(), entry.isSuccess(), entry.getReason());
    }
}
