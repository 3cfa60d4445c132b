package com.memoryvault.application;

import com.memoryvault.domain.model.AuthSession;
import com.memoryvault.domain.model.AuthenticationAttempt;
import com.memoryvault.domain.model.Challenge;
import com.memoryvault.domain.model.ChallengeResponse;
import com.memoryvault.domain.model.ChallengeType;
import com.memoryvault.domain.model.ConfidenceBand;
import com.memoryvault.domain.model.DenialReason;
import com.memoryvault.domain.model.EnrollmentStatus;
import com.memoryvault.domain.model.SessionFactor;
import com.memoryvault.domain.model.SessionResolution;
import com.memoryvault.domain.model.VerificationOutcome;
import com.memoryvault.domain.model.Voiceprint;
import com.memoryvault.support.CoreFixture;
import com.memoryvault.support.FixedVectorExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static com.memoryvault.support.FixedVectorExtractor.sample;
import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAuthenticatorTest {

    private CoreFixture fixture;
    private ConfidenceAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        fixture = new CoreFixture();
        FixedVectorExtractor extractor = new FixedVectorExtractor()
            .with("enrolled", 1, 0)
            .with("near", 24, 7)     // 0.96
            .with("close", 4, 3)     // 0.80
            .with("far", 3, 4)       // 0.60
            .with("other", 0, 1);    // 0.00
        authenticator = fixture.authenticator(extractor);
    }

    @Test
    void exactSampleAuthenticatesWithScoreOne() {
        authenticator.enroll("alice", List.of(sample("enrolled")), "phone");

        VerificationOutcome outcome = authenticator.verify("alice", sample("enrolled"), "sms");

        AuthSession session = assertInstanceOf(VerificationOutcome.Authenticated.class, outcome).getSession();
        assertEquals(1.0, outcome.getScore());
        assertEquals("alice", session.getPrincipalId());
        assertEquals("sms", session.getChannelId());
        assertEquals(Set.of(SessionFactor.VOICE), session.getFactors());
        assertEquals(CoreFixture.START.plus(Duration.ofMinutes(10)), session.getExpiresAt());
        assertInstanceOf(SessionResolution.Active.class, fixture.sessionGuard.resolve(session.getSessionId()));
    }

    @Test
    void highScoreBelowOneStillAuthenticatesWithThatConfidence() {
        authenticator.enroll("alice", List.of(sample("enrolled")), null);

        VerificationOutcome outcome = authenticator.verify("alice", sample("near"), "sms");

        AuthSession session = assertInstanceOf(VerificationOutcome.Authenticated.class, outcome).getSession();
        assertEquals(0.96, session.getConfidence(), 1e-12);
    }

    @Test
    void ambiguousScoreRequiresChallengeAndOpensNoSession() {
        authenticator.register("alice", "Alice Moreau");
        authenticator.enroll("alice", List.of(sample("enrolled")), null);

        VerificationOutcome outcome = authenticator.verify("alice", sample("close"), "sms");

        VerificationOutcome.ChallengeRequired required =
            assertInstanceOf(VerificationOutcome.ChallengeRequired.class, outcome);
        assertEquals(0.8, required.getScore());
        assertEquals(1, required.getChallenges().size());
        assertEquals(ChallengeType.IDENTITY, required.getChallenges().get(0).getType());
        assertEquals(0, fixture.sessions.size());
    }

    @Test
    void lowScoreIsDeniedWithItsScore() {
        authenticator.enroll("alice", List.of(sample("enrolled")), null);

        VerificationOutcome outcome = authenticator.verify("alice", sample("far"), "sms");

        VerificationOutcome.Denied denied = assertInstanceOf(VerificationOutcome.Denied.class, outcome);
        assertEquals(0.6, denied.getScore());
        assertEquals(DenialReason.AUTHENTICATION_DENIED, denied.getReason());
        assertEquals("Voice not recognized", denied.getMessage());
    }

    @Test
    void unknownPrincipalIsDeniedNotThrown() {
        VerificationOutcome outcome = authenticator.verify("nobody", sample("enrolled"), "sms");

        assertEquals(DenialReason.NOT_ENROLLED,
            assertInstanceOf(VerificationOutcome.Denied.class, outcome).getReason());
    }

    @Test
    void registeredButNotEnrolledIsDenied() {
        authenticator.register("bob", "Bob");

        VerificationOutcome outcome = authenticator.verify("bob", sample("enrolled"), "sms");

        assertEquals(DenialReason.NOT_ENROLLED,
            assertInstanceOf(VerificationOutcome.Denied.class, outcome).getReason());
    }

    @Test
    void bestOfSeveralVoiceprintsIsUsed() {
        authenticator.enroll("alice", List.of(sample("other")), "old phone");
        authenticator.enroll("alice", List.of(sample("enrolled")), "new phone");

        assertEquals(2, authenticator.listVoiceprints("alice").size());
        assertTrue(authenticator.verify("alice", sample("enrolled"), "sms").isAuthenticated());
    }

    @Test
    void enrollmentAveragesSamplesAndMarksAccountEnrolled() {
        Voiceprint voiceprint = authenticator.enroll(
            "carol", List.of(sample("enrolled"), sample("enrolled")), "laptop");

        assertEquals(2, voiceprint.getSampleCount());
        assertEquals(1.0, voiceprint.getEnrollmentConfidence(), 1e-12);
        assertEquals("fixed-test-v1", voiceprint.getModelVersion());
        assertTrue(authenticator.isEnrolled("carol"));
        assertEquals(EnrollmentStatus.ENROLLED, fixture.accounts.findById("carol").orElseThrow().getStatus());
    }

    @Test
    void enrollmentWithoutSamplesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> authenticator.enroll("carol", List.of(), null));
        assertFalse(authenticator.isEnrolled("carol"));
    }

    @Test
    void suspendedAccountCannotEnroll() {
        authenticator.register("dave", "Dave");
        fixture.accounts.save(fixture.accounts.findById("dave").orElseThrow().withStatus(EnrollmentStatus.SUSPENDED));

        assertThrows(IllegalStateException.class,
            () -> authenticator.enroll("dave", List.of(sample("enrolled")), null));
    }

    @Test
    void fourthAttemptInsideTheWindowIsRateLimited() {
        authenticator.enroll("erin", List.of(sample("enrolled")), null);
        for (int i = 0; i < 3; i++) {
            authenticator.verify("erin", sample("far"), "sms");
        }

        VerificationOutcome limited = authenticator.verify("erin", sample("enrolled"), "sms");
        assertEquals(DenialReason.RATE_LIMITED,
            assertInstanceOf(VerificationOutcome.Denied.class, limited).getReason());

        fixture.clock.advance(Duration.ofSeconds(61));
        assertTrue(authenticator.verify("erin", sample("enrolled"), "sms").isAuthenticated());
    }

    @Test
    void voiceprintsFromAnotherModelAreIgnored() {
        authenticator.enroll("frank", List.of(sample("enrolled")), null);
        ConfidenceAuthenticator upgraded = fixture.authenticator(new FixedVectorExtractor() {
            @Override
            public String modelVersion() {
                return "fixed-test-v2";
            }
        }.with("enrolled", 1, 0));

        VerificationOutcome outcome = upgraded.verify("frank", sample("enrolled"), "sms");

        assertEquals(DenialReason.NOT_ENROLLED,
            assertInstanceOf(VerificationOutcome.Denied.class, outcome).getReason());
    }

    @Test
    void ambiguousVoicePlusCorrectAnswerOpensTwoFactorSession() {
        authenticator.register("alice", "Alice Moreau");
        authenticator.enroll("alice", List.of(sample("enrolled")), null);

        VerificationOutcome first = authenticator.verify("alice", sample("close"), "sms");
        Challenge challenge = ((VerificationOutcome.ChallengeRequired) first).getChallenges().get(0);

        VerificationOutcome second = fixture.challengeIssuer.verify(
            "alice", "sms", List.of(new ChallengeResponse(challenge.getId(), "alice moreau")));

        AuthSession session = assertInstanceOf(VerificationOutcome.Authenticated.class, second).getSession();
        assertEquals(EnumSet.of(SessionFactor.VOICE, SessionFactor.CHALLENGE), session.getFactors());
        assertEquals(0.75, session.getConfidence());
    }

    @Test
    void categoryRequestedAtVerificationIsBoundToTheSession() {
        authenticator.enroll("gina", List.of(sample("enrolled")), null);

        AuthSession session = ((VerificationOutcome.Authenticated)
            authenticator.verify("gina", sample("enrolled"), "sms", "health")).getSession();

        assertEquals("health", session.getBoundCategory().orElseThrow());
        assertInstanceOf(SessionResolution.Active.class,
            fixture.sessionGuard.resolveFor(session.getSessionId(), "health"));
        assertEquals(DenialReason.CATEGORY_NOT_COVERED,
            ((SessionResolution.Rejected) fixture.sessionGuard.resolveFor(session.getSessionId(), "money")).getReason());
    }

    @Test
    void logoutMakesTheSessionUnreachable() {
        authenticator.enroll("hana", List.of(sample("enrolled")), null);
        String sessionId = ((VerificationOutcome.Authenticated)
            authenticator.verify("hana", sample("enrolled"), "sms")).getSession().getSessionId();

        assertTrue(authenticator.logout(sessionId));
        assertFalse(authenticator.logout(sessionId));
        assertEquals(DenialReason.SESSION_NOT_FOUND,
            ((SessionResolution.Rejected) fixture.sessionGuard.resolve(sessionId)).getReason());
    }

    @Test
    void deletingTheAccountRemovesVoiceprintsAndSessions() {
        authenticator.enroll("ivan", List.of(sample("enrolled")), null);
        authenticator.enroll("ivan", List.of(sample("near")), null);
        String sessionId = ((VerificationOutcome.Authenticated)
            authenticator.verify("ivan", sample("enrolled"), "sms")).getSession().getSessionId();

        assertEquals(2, authenticator.deleteAccount("ivan"));

        assertTrue(authenticator.listVoiceprints("ivan").isEmpty());
        assertFalse(authenticator.isEnrolled("ivan"));
        assertInstanceOf(SessionResolution.Rejected.class, fixture.sessionGuard.resolve(sessionId));
        assertEquals(DenialReason.NOT_ENROLLED,
            ((VerificationOutcome.Denied) authenticator.verify("ivan", sample("enrolled"), "sms")).getReason());
    }

    @Test
    void asyncVerificationCompletesOnTheExecutor() throws Exception {
        authenticator.enroll("judy", List.of(sample("enrolled")), null);

        VerificationOutcome outcome = authenticator
            .verifyAsync("judy", sample("enrolled"), "sms", null)
            .get(5, TimeUnit.SECONDS);

        assertTrue(outcome.isAuthenticated());
    }

    @Test
    void blankIdentifiersAreProgrammingErrors() {
        assertThrows(IllegalArgumentException.class, () -> authenticator.verify(" ", sample("enrolled"), "sms"));
        assertThrows(IllegalArgumentException.class, () -> authenticator.verify("alice", sample("enrolled"), ""));
    }

    @Test
    void authenticationLogListsAttemptsNewestFirst() {
        authenticator.register("alice", "Alice Moreau");
        authenticator.enroll("alice", List.of(sample("enrolled")), null);

        VerificationOutcome ambiguous = authenticator.verify("alice", sample("close"), "sms");
        Challenge challenge = ((VerificationOutcome.ChallengeRequired) ambiguous).getChallenges().get(0);
        fixture.clock.advance(Duration.ofSeconds(5));
        fixture.challengeIssuer.verify("alice", "sms", List.of(new ChallengeResponse(challenge.getId(), "Alice Moreau")));
        fixture.clock.advance(Duration.ofSeconds(5));
        authenticator.verify("alice", sample("other"), "whatsapp");

        List<AuthenticationAttempt> log = authenticator.authenticationLog("alice", 10);

        assertEquals(3, log.size());
        assertEquals(ConfidenceBand.LOW, log.get(0).getBand());
        assertEquals(DenialReason.AUTHENTICATION_DENIED, log.get(0).getReason());
        assertEquals("whatsapp", log.get(0).getChannelId());
        assertTrue(log.get(1).isSuccess());
        assertTrue(log.get(1).isChallengeRequired());
        assertTrue(log.get(1).isChallengePassed());
        assertFalse(log.get(2).isSuccess());
        assertTrue(log.get(2).isChallengeRequired());
        assertNull(log.get(2).getReason());
        assertEquals(0.8, log.get(2).getScore());
        assertTrue(log.get(0).getAttemptedAt().isAfter(log.get(2).getAttemptedAt()));
    }

    @Test
    void authenticationLogHonoursTheLimit() {
        authenticator.enroll("alice", List.of(sample("enrolled")), null);
        authenticator.verify("alice", sample("enrolled"), "sms");
        authenticator.verify("alice", sample("far"), "sms");
        authenticator.verify("alice", sample("other"), "sms");

        assertEquals(2, authenticator.authenticationLog("alice", 2).size());
        assertEquals(1, authenticator.authenticationLog("alice", 0).size());
        assertEquals(3, authenticator.authenticationLog("alice", 1_000).size());
        assertTrue(authenticator.authenticationLog("bob", 10).isEmpty());
    }

    @Test
    void refusalsBeforeScoringAreLoggedWithoutBand() {
        authenticator.verify("nobody", sample("enrolled"), "sms");

        AuthenticationAttempt attempt = authenticator.authenticationLog("nobody", 10).get(0);
        assertNull(attempt.getBand());
        assertEquals(DenialReason.NOT_ENROLLED, attempt.getReason());
        assertFalse(attempt.isSuccess());
    }
}
