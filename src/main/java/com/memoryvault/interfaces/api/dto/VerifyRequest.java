package com.memoryvault.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerifyRequest {

    @NotBlank(message = "Principal id is required")
    private String principalId;

    @NotBlank(message = "Channel id is required")
    private String channelId;

    @NotNull(message = "Voice sample is required")
    @Size(min = 1, message = "Voice sample must not be empty")
    private byte[] sample;

    @Size(max = 64, message = "Category must not exceed 64 characters")
    private String category;
}
