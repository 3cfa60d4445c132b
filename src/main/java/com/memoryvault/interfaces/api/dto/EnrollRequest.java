package com.memoryvault.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for voice enrollment. Samples are Base64 in JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrollRequest {

    @NotBlank(message = "Principal id is required")
    @Size(max = 128, message = "Principal id must not exceed 128 characters")
    private String principalId;

    @Size(max = 200, message = "Display name must not exceed 200 characters")
    private String displayName;

    @NotEmpty(message = "At least one voice sample is required")
    private List<byte[]> samples;

    @Size(max = 200, message = "Device hint must not exceed 200 characters")
    private String deviceHint;
}
