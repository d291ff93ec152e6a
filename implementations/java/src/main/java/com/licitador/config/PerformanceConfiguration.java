package com.licitador.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Timing of key-pair store and cipher calls.
 *
 * Metrics carry the method signature and outcome only. No key material,
 * plaintext or ciphertext ends up in a tag.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing key-pair store operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class KeyPairStorePerformanceAspect {

        private final MeterRegistry meterRegistry;

        public KeyPairStorePerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.licitador.infrastructure.persistence.*Adapter.*(..))")
        public Object timeStoreOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "keypair.store.operation",
                "Key-pair store operation timing", joinPoint);
        }
    }

    /**
     * Aspect for timing encryption/decryption operations.
     */
    @Aspect
    @Component
    @Slf4j
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.licitador.infrastructure.crypto.*CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, "crypto.operation",
                "Cryptographic operation timing", joinPoint);
        }
    }

    /**
     * Counters for the key-pair lifecycle.
     */
    @Component
    @Slf4j
    public static class KeyPairMetrics {

        private final MeterRegistry meterRegistry;

        public KeyPairMetrics(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            log.info("Initialized key-pair metrics");
        }

        public void recordKeyPairIssued() {
            meterRegistry.counter("keypair.issued").increment();
        }

        public void recordKeyPairConsumed() {
            meterRegistry.counter("keypair.consumed").increment();
        }

        /**
         * @param reason short, fixed reason code such as {@code not_found} or {@code already_used}
         */
        public void recordRejected(String reason) {
            meterRegistry.counter("keypair.rejected", "reason", reason).increment();
        }
    }

    private static Object timed(MeterRegistry meterRegistry, String name, String description,
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
}
