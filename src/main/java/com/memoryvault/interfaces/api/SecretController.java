package com.memoryvault.interfaces.api;

import com.memoryvault.application.SecretVault;
import com.memoryvault.application.SessionContextProvider;
import com.memoryvault.domain.model.SecretRecord;
import com.memoryvault.infrastructure.security.SessionAuthenticationFilter;
import com.memoryvault.interfaces.api.dto.AccessLogEntryResponse;
import com.memoryvault.interfaces.api.dto.CreateSecretRequest;
import com.memoryvault.interfaces.api.dto.ErrorResponse;
import com.memoryvault.interfaces.api.dto.ReclassifyRequest;
import com.memoryvault.interfaces.api.dto.SecretResponse;
import com.memoryvault.interfaces.api.exception.RequestDeniedException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for the tiered secret vault.
 *
 * Every read goes through the vault's access policy and is appended to the
 * record's access log. Listing, reclassification, deletion and the access
 * log are owner-only.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/secrets")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Secrets", description = "Tiered secret storage")
public class SecretController {

    private final SecretVault secretVault;
    private final SessionContextProvider sessionContext;

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Store secret",
        description = "Encrypts and stores a secret owned by the caller"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Secret stored",
            content = @Content(schema = @Schema(implementation = SecretResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<SecretResponse> createSecret(@Valid @RequestBody CreateSecretRequest request) {

        String ownerId = sessionContext.currentPrincipalId();
        SecretRecord record = secretVault.put(
            ownerId, request.getTier(), request.getTitle(), request.getContent(), request.getAuthorizedPrincipals());

        if (log.isInfoEnabled()) {
            log.info("Secret stored: id={}, tier={}", record.getId(), record.getTier());
        }

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(SecretResponse.metadata(record));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List the caller's secrets", description = "Metadata only, content stays encrypted")
    public ResponseEntity<List<SecretResponse>> listSecrets() {

        List<SecretResponse> secrets = secretVault.listOwned(sessionContext.currentPrincipalId())
            .stream()
            .map(SecretResponse::metadata)
            .toList();

        return ResponseEntity.ok(secrets);
    }

    /**
     * Read a secret's content.
     */
    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Read secret",
        description = "Releases the content to the owner, an authorized principal, "
            + "or a contact whose access level meets the tier"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Content released",
            content = @Content(schema = @Schema(implementation = SecretResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "500",
            description = "Stored content failed its integrity check",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<SecretResponse> getSecret(
            @PathVariable UUID id,
            @RequestHeader(SessionAuthenticationFilter.SESSION_HEADER) String sessionId) {

        String content = RequestDeniedException.unwrap(secretVault.getWithSession(id, sessionId.strip()));

        return ResponseEntity.ok(SecretResponse.content(id, content));
    }

    @GetMapping(value = "/{id}/access-log", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Access log", description = "Every read attempt on the secret, in order. Owner only")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Access log"),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<List<AccessLogEntryResponse>> accessLog(@PathVariable UUID id) {

        List<AccessLogEntryResponse> entries = RequestDeniedException.unwrap(
                secretVault.accessLog(id, sessionContext.currentPrincipalId()))
            .stream()
            .map(AccessLogEntryResponse::from)
            .toList();

        return ResponseEntity.ok(entries);
    }

    /**
     * Move a secret to another tier. The secret gets a new id; the old id stops resolving.
     */
    @PutMapping(
        value = "/{id}/tier",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Reclassify secret")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Secret reclassified under a new id",
            content = @Content(schema = @Schema(implementation = SecretResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<SecretResponse> reclassify(
            @PathVariable UUID id,
            @Valid @RequestBody ReclassifyRequest request) {

        SecretRecord replacement = RequestDeniedException.unwrap(
            secretVault.reclassify(id, sessionContext.currentPrincipalId(), request.getTier()));

        if (log.isInfoEnabled()) {
            log.info("Secret reclassified: id={} -> id={}, tier={}", id, replacement.getId(), replacement.getTier());
        }

        return ResponseEntity.ok(SecretResponse.metadata(replacement));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete secret")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Secret deleted"),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<Void> deleteSecret(@PathVariable UUID id) {

        RequestDeniedException.unwrap(secretVault.delete(id, sessionContext.currentPrincipalId()));

        if (log.isWarnEnabled()) {
            log.warn("Secret deleted: id={}", id);
        }

        return ResponseEntity.noContent().build();
    }
}
