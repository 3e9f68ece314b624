package com.phiguard.config;

import com.phiguard.domain.model.RotationStatus;
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
 * - Cipher codec latency (encrypt/decrypt, success/failure)
 * - Persistence adapter latency
 * - Rotation throughput and row failures
 *
 * Security: metrics carry method names and key version labels only.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing persistence adapter operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class RepositoryPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public RepositoryPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.phiguard.infrastructure.persistence.*Adapter.*(..))")
        public Object timeRepositoryMethod(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "repository.operation", "Repository operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing crypto operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.phiguard.infrastructure.crypto.CipherCodec.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return time(meterRegistry, "crypto.operation", "Cryptographic operation timing", joinPoint);
        }
    }

    private static Object time(MeterRegistry meterRegistry, String name, String description,
                               ProceedingJoinPoint joinPoint) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();

            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));

            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(name)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));

            throw e;
        }
    }

    /**
     * Counters for rotation progress.
     */
    @Component
    @Slf4j
    public static class RotationMetrics {

        private final MeterRegistry meterRegistry;

        public RotationMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized rotation metrics");
        }

        public void recordBatch(String targetVersion, long migrated, long skipped, long failed) {
            meterRegistry.counter("rotation.rows.migrated", "target", targetVersion).increment(migrated);
            meterRegistry.counter("rotation.rows.skipped", "target", targetVersion).increment(skipped);
            meterRegistry.counter("rotation.rows.failed", "target", targetVersion).increment(failed);
            meterRegistry.counter("rotation.batches", "target", targetVersion).increment();
        }

        public void recordTransition(RotationStatus status) {
            meterRegistry.counter("rotation.jobs", "status", status.name()).increment();
        }

        public void recordKeyRetired(String label) {
            meterRegistry.counter("keys.retired", "version", label).increment();
        }
    }
}
