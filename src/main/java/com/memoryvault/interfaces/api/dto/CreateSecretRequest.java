package com.memoryvault.interfaces.api.dto;

import com.memoryvault.domain.model.SecretTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Request DTO for storing a secret. The caller's session principal is the owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSecretRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must not exceed 200 characters")
    private String title;

    @NotNull(message = "Tier is required")
    private SecretTier tier;

    @NotNull(message = "Content is required")
    @Size(max = 65536, message = "Content must not exceed 65536 characters")
    private String content;

    @Size(max = 100, message = "At most 100 principals may be authorized")
    private Set<@NotBlank String> authorizedPrincipals;
}
