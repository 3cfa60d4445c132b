package com.memoryvault.config;

import com.memoryvault.domain.model.AccessBasis;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks:
 * - Repository operation latency
 * - Authorization decision latency and outcome
 * - Envelope encryption latency
 * - Voice verification and vault access latency
 * - Business counters (verification outcomes, vault decisions, matches)
 *
 * Security: metric tags carry outcomes and method names only, never
 * principal ids or content.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing repository operations.
     */
    @Aspect
    @Component
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.memoryvault.domain.repository.*.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing secret-record authorization checks.
     */
    @Aspect
    @Component
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.memoryvault.infrastructure.security.SecretAccessPolicy.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            String methodName = joinPoint.getSignature().toShortString();
            Timer.Sample sample = Timer.start(meterRegistry);

            Object result = joinPoint.proceed();

            String outcome = result instanceof AccessBasis basis && basis.isGranted() ? "granted" : "denied";
            sample.stop(Timer.builder("security.authorization")
                .tag("method", methodName)
                .tag("outcome", outcome)
                .description("Authorization check timing")
                .register(meterRegistry));
            return result;
        }
    }

    /**
     * Aspect for timing encryption/decryption operations.
     */
    @Aspect
    @Component
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.memoryvault.infrastructure.crypto.CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "crypto.operation", "Cryptographic operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing the authenticator and the vault.
     */
    @Aspect
    @Component
    public static class AccessCheckPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public AccessCheckPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(public * com.memoryvault.application.ConfidenceAuthenticator.*(..))"
            + " || execution(public * com.memoryvault.application.SecretVault.*(..))")
        public Object timeAccessCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "access.operation", "Authentication and vault operation timing", joinPoint);
        }
    }

    private static Object timed(
            MeterRegistry meterRegistry,
            String metric,
            String description,
            ProceedingJoinPoint joinPoint) throws Throwable {

        String methodName = joinPoint.getSignature().toShortString();
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(metric)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Custom metrics for business operations.
     */
    @Component
    @Slf4j
    public static class BusinessMetrics {

        private final MeterRegistry meterRegistry;

        public BusinessMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized business metrics");
        }

        /**
         * Record a voice verification outcome (authenticated, challenge, denied).
         */
        public void recordVerification(String outcome) {
            meterRegistry.counter("business.auth.verifications", "outcome", outcome).increment();
        }

        public void recordChallengeVerification(boolean passed) {
            meterRegistry.counter("business.auth.challenges",
                "outcome", passed ? "passed" : "failed").increment();
        }

        public void recordEnrollment() {
            meterRegistry.counter("business.auth.enrollments").increment();
        }

        /**
         * Record a vault access decision by the rule that decided it.
         */
        public void recordVaultDecision(AccessBasis basis) {
            meterRegistry.counter("business.vault.decisions", "basis", basis.name()).increment();
        }

        public void recordSecretStored(String tier) {
            meterRegistry.counter("business.vault.stored", "tier", tier).increment();
        }

        public void recordDisclosureCreated(boolean romantic) {
            meterRegistry.counter("business.disclosures.created",
                "romantic", Boolean.toString(romantic)).increment();
        }

        public void recordMutualMatch() {
            meterRegistry.counter("business.disclosures.matches").increment();
        }
    }
}
