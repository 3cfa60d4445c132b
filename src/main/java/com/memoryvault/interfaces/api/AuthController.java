package com.memoryvault.interfaces.api;

import com.memoryvault.application.ChallengeIssuer;
import com.memoryvault.application.ConfidenceAuthenticator;
import com.memoryvault.application.SessionContextProvider;
import com.memoryvault.application.SessionGuard;
import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.ChallengeResponse;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.SessionResolution;
import com.memoryvault.domain.model.VerificationOutcome;
import com.memoryvault.domain.model.Voiceprint;
import com.memoryvault.interfaces.api.dto.AuthenticationAttemptResponse;
import com.memoryvault.interfaces.api.dto.ChallengeRequest;
import com.memoryvault.interfaces.api.dto.ChallengeVerifyRequest;
import com.memoryvault.interfaces.api.dto.ChallengeView;
import com.memoryvault.interfaces.api.dto.EnrollRequest;
import com.memoryvault.interfaces.api.dto.ErrorResponse;
import com.memoryvault.interfaces.api.dto.SessionResponse;
import com.memoryvault.interfaces.api.dto.VerificationResponse;
import com.memoryvault.interfaces.api.dto.VerifyRequest;
import com.memoryvault.interfaces.api.dto.VoiceprintResponse;
import com.memoryvault.interfaces.api.exception.GlobalExceptionHandler;
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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for voice authentication.
 *
 * Provides endpoints for:
 * - Enrolling voice samples
 * - Voice verification, with a knowledge challenge when confidence is ambiguous
 * - Inspecting and closing the caller's session
 * - Reviewing the caller's past verification attempts
 * - Deleting the caller's account and voiceprints
 *
 * Enrollment, verification and challenges are open endpoints; everything
 * else requires a live session in the X-Auth-Session header.
 *
 * @since 1.0.0
 */
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Authentication", description = "Voice confidence authentication and sessions")
public class AuthController {

    private final ConfidenceAuthenticator authenticator;
    private final ChallengeIssuer challengeIssuer;
    private final SessionGuard sessionGuard;
    private final SessionContextProvider sessionContext;

    /**
     * Enroll voice samples. An already enrolled principal can only add
     * samples from one of their own sessions.
     */
    @PostMapping(
        value = "/enroll",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Enroll voice",
        description = "Averages the samples into a new encrypted voiceprint"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Voiceprint stored",
            content = @Content(schema = @Schema(implementation = VoiceprintResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Principal already enrolled and caller is not that principal",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Account suspended",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<VoiceprintResponse> enroll(@Valid @RequestBody EnrollRequest request) {

        if (authenticator.isEnrolled(request.getPrincipalId())) {
            boolean self = sessionContext.currentSession()
                .map(session -> session.getPrincipalId().equals(request.getPrincipalId()))
                .orElse(false);
            if (!self) {
                throw new RequestDeniedException(DenialReason.AUTHORIZATION_DENIED);
            }
        }

        authenticator.register(request.getPrincipalId(), request.getDisplayName());
        Voiceprint voiceprint = authenticator.enroll(
            request.getPrincipalId(), request.getSamples(), request.getDeviceHint());

        if (log.isInfoEnabled()) {
            log.info("Enrollment accepted: principal={}, voiceprint={}", request.getPrincipalId(), voiceprint.getId());
        }

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(VoiceprintResponse.from(voiceprint));
    }

    @PostMapping(
        value = "/verify",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Verify voice",
        description = "Scores a sample against the principal's voiceprints and issues a session, "
            + "a challenge, or a denial"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Authenticated, or a challenge is required",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class))
        ),
        @ApiResponse(
            responseCode = "401",
            description = "Voice not recognized or principal not enrolled",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class))
        ),
        @ApiResponse(
            responseCode = "429",
            description = "Too many verification attempts",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class))
        )
    })
    public ResponseEntity<VerificationResponse> verify(@Valid @RequestBody VerifyRequest request) {

        VerificationOutcome outcome = authenticator.verify(
            request.getPrincipalId(), request.getSample(), request.getChannelId(), request.getCategory());

        return respond(outcome);
    }

    /**
     * Fresh challenge set for a caller that passed voice verification with
     * ambiguous confidence on the same channel.
     */
    @PostMapping(
        value = "/challenges",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Reissue knowledge challenges")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Challenges issued"),
        @ApiResponse(
            responseCode = "409",
            description = "No pending voice verification on this channel",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<List<ChallengeView>> reissueChallenges(@Valid @RequestBody ChallengeRequest request) {

        List<ChallengeView> challenges = RequestDeniedException.unwrap(
                challengeIssuer.reissue(request.getPrincipalId(), request.getChannelId(), request.getCategory()))
            .stream()
            .map(ChallengeView::from)
            .toList();

        return ResponseEntity.ok(challenges);
    }

    @PostMapping(
        value = "/challenges/verify",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Answer knowledge challenges",
        description = "Issues a session with VOICE and CHALLENGE factors when every answer matches"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Authenticated",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class))
        ),
        @ApiResponse(
            responseCode = "401",
            description = "Answers did not match, or attempts exhausted",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "No pending challenge",
            content = @Content(schema = @Schema(implementation = VerificationResponse.class))
        )
    })
    public ResponseEntity<VerificationResponse> verifyChallenges(@Valid @RequestBody ChallengeVerifyRequest request) {

        List<ChallengeResponse> responses = request.getResponses().stream()
            .map(answer -> new ChallengeResponse(
                answer.getChallengeId(), answer.getAnswer() != null ? answer.getAnswer() : ""))
            .toList();

        VerificationOutcome outcome = challengeIssuer.verify(
            request.getPrincipalId(), request.getChannelId(), responses);

        return respond(outcome);
    }

    @GetMapping(value = "/sessions/current", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Current session",
        description = "Describes the caller's session; with a category, also checks the session covers it"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Session is live"),
        @ApiResponse(
            responseCode = "401",
            description = "No live session",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Session is bound to another category",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<SessionResponse> currentSession(
            @RequestParam(value = "category", required = false) String category) {

        AuthSession session = sessionContext.requireSession();
        SessionResolution resolution = sessionGuard.resolveFor(session.getSessionId(), category);
        if (resolution instanceof SessionResolution.Rejected rejected) {
            throw new RequestDeniedException(rejected.getReason());
        }

        return ResponseEntity.ok(SessionResponse.from(((SessionResolution.Active) resolution).getSession()));
    }

    @DeleteMapping("/sessions/current")
    @Operation(summary = "Log out")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Session closed"),
        @ApiResponse(responseCode = "401", description = "No live session")
    })
    public ResponseEntity<Void> logout() {

        AuthSession session = sessionContext.requireSession();
        authenticator.logout(session.getSessionId());

        if (log.isInfoEnabled()) {
            log.info("Logout: principal={}", session.getPrincipalId());
        }

        return ResponseEntity.noContent().build();
    }

    @GetMapping(value = "/voiceprints", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List the caller's voiceprints")
    public ResponseEntity<List<VoiceprintResponse>> listVoiceprints() {

        List<VoiceprintResponse> voiceprints = authenticator.listVoiceprints(sessionContext.currentPrincipalId())
            .stream()
            .map(VoiceprintResponse::from)
            .toList();

        return ResponseEntity.ok(voiceprints);
    }

    @GetMapping(value = "/attempts", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Authentication log",
        description = "The caller's own voice and challenge verification attempts, newest first"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Attempts returned"),
        @ApiResponse(responseCode = "401", description = "No live session")
    })
    public ResponseEntity<List<AuthenticationAttemptResponse>> authenticationLog(
            @RequestParam(value = "limit", defaultValue = "20") int limit) {

        List<AuthenticationAttemptResponse> attempts = authenticator
            .authenticationLog(sessionContext.currentPrincipalId(), limit)
            .stream()
            .map(AuthenticationAttemptResponse::from)
            .toList();

        return ResponseEntity.ok(attempts);
    }

    /**
     * Delete the caller's account, voiceprints and sessions.
     */
    @DeleteMapping("/account")
    @Operation(
        summary = "Delete account",
        description = "Removes the account, every voiceprint and every session of the caller"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Account deleted"),
        @ApiResponse(responseCode = "401", description = "No live session")
    })
    public ResponseEntity<Void> deleteAccount() {

        String principalId = sessionContext.currentPrincipalId();

        if (log.isWarnEnabled()) {
            log.warn("Deleting account: principal={}", principalId);
        }

        authenticator.deleteAccount(principalId);

        return ResponseEntity.noContent().build();
    }

    private static ResponseEntity<VerificationResponse> respond(VerificationOutcome outcome) {
        HttpStatus status = outcome instanceof VerificationOutcome.Denied denied
            ? GlobalExceptionHandler.statusFor(denied.getReason())
            : HttpStatus.OK;
        return ResponseEntity.status(status).body(VerificationResponse.from(outcome));
    }
}
