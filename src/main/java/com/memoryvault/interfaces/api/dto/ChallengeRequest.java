package com.memoryvault.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeRequest {

    @NotBlank(message = "Principal id is required")
    private String principalId;

    @NotBlank(message = "Channel id is required")
    private String channelId;

    @Size(max = 64, message = "Category must not exceed 64 characters")
    private String category;
}
