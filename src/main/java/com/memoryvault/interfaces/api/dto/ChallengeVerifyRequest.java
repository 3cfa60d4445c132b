package com.memoryvault.interfaces.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeVerifyRequest {

    @NotBlank(message = "Principal id is required")
    private String principalId;

    @NotBlank(message = "Channel id is required")
    private String channelId;

    @NotEmpty(message = "Answers are required")
    @Valid
    private List<Answer> responses;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Answer {

        @NotBlank(message = "Challenge id is required")
        private String challengeId;

        @Size(max = 500, message = "Answer must not exceed 500 characters")
        private String answer;
    }
}
