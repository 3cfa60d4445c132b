package com.memoryvault.interfaces.api.dto;

import com.memoryvault.domain.model.Challenge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A challenge prompt as shown to the principal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeView {

    private String id;
    private String type;
    private String prompt;

    public static ChallengeView from(Challenge challenge) {
        return new ChallengeView(challenge.getId(), challenge.getType().name(), challenge.getPrompt());
    }
}
