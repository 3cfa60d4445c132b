package com.memoryvault.interfaces.api.dto;

import com.memoryvault.domain.model.SecretTier;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReclassifyRequest {

    @NotNull(message = "Tier is required")
    private SecretTier tier;
}
