package com.memoryvault.interfaces.api.dto;

import com.memoryvault.domain.model.Voiceprint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Voiceprint metadata. The embedding never leaves the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VoiceprintResponse {

    private UUID id;
    private String modelVersion;
    private Instant enrolledAt;
    private String deviceHint;
    private double enrollmentConfidence;
    private int sampleCount;

    public static VoiceprintResponse from(Voiceprint voiceprint) {
        return VoiceprintResponse.builder()
            .id(voiceprint.getId())
            .modelVersion(voiceprint.getModelVersion())
            .enrolledAt(voiceprint.getEnrolledAt())
            .deviceHint(voiceprint.getDeviceHint())
            .enrollmentConfidence(voiceprint.getEnrollmentConfidence())
            .sampleCount(voiceprint.getSampleCount())
            .build();
    }
}
