package com.memoryvault.interfaces.api;

import com.memoryvault.application.DisclosureService;
import com.memoryvault.application.SessionContextProvider;
import com.memoryvault.domain.model.DisclosureRecord;
import com.memoryvault.infrastructure.security.SessionAuthenticationFilter;
import com.memoryvault.interfaces.api.dto.CreateDisclosureRequest;
import com.memoryvault.interfaces.api.dto.DesignateReaderRequest;
import com.memoryvault.interfaces.api.dto.DisclosureResponse;
import com.memoryvault.interfaces.api.dto.ErrorResponse;
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
 * REST controller for designated disclosures.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/disclosures")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Disclosures", description = "Designated disclosures and mutual matching")
public class DisclosureController {

    private final DisclosureService disclosureService;
    private final SessionContextProvider sessionContext;

    @PostMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Create disclosure",
        description = "Stores an encrypted disclosure; a romantic disclosure with a target may match a reciprocal one"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Disclosure stored",
            content = @Content(schema = @Schema(implementation = DisclosureResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DisclosureResponse> createDisclosure(@Valid @RequestBody CreateDisclosureRequest request) {

        DisclosureRecord record = disclosureService.create(
            sessionContext.currentPrincipalId(),
            request.getTitle(),
            request.getContent(),
            request.getTargetPrincipalId(),
            request.getTargetName()
        );

        if (log.isInfoEnabled()) {
            log.info("Disclosure created: id={}, matched={}", record.getId(), record.isMatched());
        }

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(DisclosureResponse.from(record));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List the caller's disclosures")
    public ResponseEntity<List<DisclosureResponse>> listDisclosures() {

        List<DisclosureResponse> disclosures = disclosureService.listOwned(sessionContext.currentPrincipalId())
            .stream()
            .map(DisclosureResponse::from)
            .toList();

        return ResponseEntity.ok(disclosures);
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Read disclosure",
        description = "Releases the content to the owner, the designated reader, or the matched counterpart"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Content released",
            content = @Content(schema = @Schema(implementation = DisclosureResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DisclosureResponse> readDisclosure(
            @PathVariable UUID id,
            @RequestHeader(SessionAuthenticationFilter.SESSION_HEADER) String sessionId) {

        String content = RequestDeniedException.unwrap(disclosureService.readWithSession(id, sessionId.strip()));

        return ResponseEntity.ok(DisclosureResponse.content(id, content));
    }

    @PutMapping(
        value = "/{id}/reader",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Designate reader", description = "Replaces any previous designated reader. Owner only")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Reader designated"),
        @ApiResponse(
            responseCode = "403",
            description = "Access denied",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<DisclosureResponse> designateReader(
            @PathVariable UUID id,
            @Valid @RequestBody DesignateReaderRequest request) {

        DisclosureRecord record = RequestDeniedException.unwrap(
            disclosureService.setDesignatedReader(id, sessionContext.currentPrincipalId(), request.getReaderId()));

        return ResponseEntity.ok(DisclosureResponse.from(record));
    }

    @DeleteMapping(value = "/{id}/reader", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Remove designated reader")
    public ResponseEntity<DisclosureResponse> clearReader(@PathVariable UUID id) {

        DisclosureRecord record = RequestDeniedException.unwrap(
            disclosureService.clearDesignatedReader(id, sessionContext.currentPrincipalId()));

        return ResponseEntity.ok(DisclosureResponse.from(record));
    }

    /**
     * Drop the romantic target. An existing match is kept.
     */
    @DeleteMapping(value = "/{id}/target", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Remove romantic target")
    public ResponseEntity<DisclosureResponse> removeTarget(@PathVariable UUID id) {

        DisclosureRecord record = RequestDeniedException.unwrap(
            disclosureService.removeTarget(id, sessionContext.currentPrincipalId()));

        return ResponseEntity.ok(DisclosureResponse.from(record));
    }
}
