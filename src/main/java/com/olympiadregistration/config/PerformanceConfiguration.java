package com.olympiadregistration.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance monitoring.
 *
 * Tracks:
 * - auditor latency per operation
 * - repository operation latency
 * - access-control decision latency and outcome
 * - business counters for registrations, imports and scores
 *
 * No personal data is used as a tag.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Times every auditor call.
     */
    @Aspect
    @Component
    @Slf4j
    public static class AuditorPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public AuditorPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.olympiadregistration.domain.audit.*Auditor.audit*(..))")
        public Object timeAudit(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "registration.audit", "Auditor timing", joinPoint,
                "passed", "rejected");
        }
    }

    /**
     * Times repository adapter operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.olympiadregistration.infrastructure.persistence.*RepositoryAdapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "repository.operation", "Repository operation timing", joinPoint,
                "success", "failure");
        }
    }

    /**
     * Times access-control decisions.
     */
    @Aspect
    @Component
    @Slf4j
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.olympiadregistration.infrastructure.security.RegistrationAccessKernel.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "security.authorization", "Authorization check timing", joinPoint,
                "granted", "denied");
        }
    }

    private static Object timed(MeterRegistry meterRegistry, String name, String description,
                                ProceedingJoinPoint joinPoint, String success, String failure) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", success)
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", failure)
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Custom metrics for registration operations.
     */
    @Component
    @Slf4j
    public static class RegistrationMetrics {

        private final MeterRegistry meterRegistry;

        public RegistrationMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized registration metrics");
        }

        /**
         * Record a country or person create, edit or retirement.
         */
        public void recordRegistration(String category, String action) {
            meterRegistry.counter("registration.records", "category", category, "action", action).increment();
        }

        /**
         * Record a bulk import outcome.
         */
        public void recordBulkImport(String kind, String outcome, int rows) {
            meterRegistry.counter("registration.bulk.imports", "kind", kind, "outcome", outcome).increment();
            meterRegistry.counter("registration.bulk.rows", "kind", kind, "outcome", outcome).increment(rows);
        }

        /**
         * Record changed score cells.
         */
        public void recordScoresEntered(int cells) {
            meterRegistry.counter("registration.scores.entered").increment(cells);
        }

        /**
         * Record a file download decision.
         */
        public void recordFileAccess(String kind, boolean granted) {
            meterRegistry.counter("registration.files.served", "kind", kind,
                "outcome", granted ? "granted" : "denied").increment();
        }
    }
}
