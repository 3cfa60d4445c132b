package com.memoryvault.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Voice authentication and challenge settings ({@code memoryvault.auth.*}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "memoryvault.auth")
public class AuthProperties {

    /** Score at or above which a voice sample alone opens a session. */
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double highConfidenceThreshold = 0.85;

    /** Score at or above which a knowledge challenge is offered. */
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double challengeThreshold = 0.70;

    @NotNull
    private Duration sessionTtl = Duration.ofMinutes(10);

    /** Confidence recorded on sessions opened through a challenge. */
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double challengeConfidence = 0.75;

    @Min(1)
    private int maxChallenges = 2;

    @NotNull
    private Duration challengeTtl = Duration.ofMinutes(5);

    @Min(1)
    private int maxChallengeAttempts = 3;

    /** Characters of a memory shown in a content challenge. */
    @Min(1)
    private int contentHintLength = 30;

    @Min(1)
    private int rateLimitMaxAttempts = 3;

    @NotNull
    private Duration rateLimitWindow = Duration.ofSeconds(60);

    @NotNull
    private Duration verificationTimeout = Duration.ofSeconds(5);

    /** Zone used to render and compare dates in temporal challenges. */
    @NotNull
    private ZoneId challengeZone = ZoneId.of("UTC");

    /** Expired-session sweep period. */
    @NotNull
    private Duration sessionSweepInterval = Duration.ofSeconds(60);
}
