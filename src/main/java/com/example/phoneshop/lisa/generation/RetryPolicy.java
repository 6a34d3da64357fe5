package com.example.phoneshop.lisa.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff: attempt {@code n} (0-based) waits {@code baseDelay * 2^n} before
 * the next try. Only failures accepted by {@code retryable} are retried; once
 * {@code maxAttempts} calls have failed the last error propagates unchanged.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Predicate<Throwable> retryable) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(retryable, "retryable");
    }

    public static RetryPolicy transientFailures(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, TransientFailures::isTransient);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO, e -> false);
    }

    public Retry toRetry(String operation) {
        return Retry.backoff(maxAttempts - 1, baseDelay)
                .jitter(0)
                .filter(retryable)
                .doBeforeRetry(signal -> log.warn("{} failed (attempt {}/{}), retrying: {}",
                        operation, signal.totalRetries() + 1, maxAttempts, signal.failure().toString()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public <T> Mono<T> applyTo(Mono<T> call, String operation) {
        if (maxAttempts == 1) {
            return call;
        }
        return call.retryWhen(toRetry(operation));
    }

    public <T> Flux<T> applyTo(Flux<T> call, String operation) {
        if (maxAttempts == 1) {
            return call;
        }
        return call.retryWhen(toRetry(operation));
    }
}
