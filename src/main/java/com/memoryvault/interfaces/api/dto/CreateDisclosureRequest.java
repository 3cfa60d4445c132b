package com.memoryvault.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a designated disclosure. Target fields are optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDisclosureRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must not exceed 200 characters")
    private String title;

    @NotBlank(message = "Content is required")
    @Size(max = 65536, message = "Content must not exceed 65536 characters")
    private String content;

    @Size(max = 128, message = "Target principal id must not exceed 128 characters")
    private String targetPrincipalId;

    @Size(max = 200, message = "Target name must not exceed 200 characters")
    private String targetName;
}
