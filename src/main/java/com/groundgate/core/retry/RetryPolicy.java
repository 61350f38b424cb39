package com.groundgate.core.retry;

import com.groundgate.core.model.EvaluationResult;
import com.groundgate.core.model.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Callable;

/**
 * Attempt-count bound with exponential backoff.
 * <p>
 * Delay before attempt {@code n + 1} is {@code min(maxDelay, baseDelay * 2^(n-1))}, multiplied
 * by a factor in [0.5, 1.5) when jitter is on. Waits block the calling thread.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final boolean jitter;
    private final Random random;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts) {
        this(maxAttempts, Duration.ofMillis(500), Duration.ofSeconds(8), true, new Random(), Sleeper.THREAD);
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay,
                       boolean jitter, Random random, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("delays must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.random = random;
        this.sleeper = sleeper;
    }

    /**
     * Calls {@code fn} until it returns normally or {@code maxAttempts} calls have failed,
     * in which case the last exception is re-thrown.
     */
    public <T> T execute(Callable<T> fn) throws Exception {
        Exception last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return fn.call();
            } catch (Exception e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = delayFor(attempt);
                log.warn("Attempt {}/{} failed: {}; retrying in {}ms",
                        attempt, maxAttempts, e.getMessage(), delay.toMillis());
                pause(delay);
            }
        }
        log.warn("All {} attempts failed", maxAttempts);
        throw last;
    }

    /**
     * Retry decision for an evaluated attempt. Never retries once {@code attempt >= maxAttempts}.
     */
    public RetryDecision decide(EvaluationResult evaluation, int attempt) {
        if (evaluation.ok()) {
            return new RetryDecision(false, "");
        }
        if (attempt >= maxAttempts) {
            return new RetryDecision(false, RetryDecision.MAX_ATTEMPTS_REACHED);
        }
        return new RetryDecision(true, RetryDecision.VALIDATION_FAILED);
    }

    /**
     * Delay after failed attempt {@code attempt} (1-based), jitter applied.
     */
    public Duration delayFor(int attempt) {
        Duration capped = baseDelayFor(attempt);
        if (!jitter) {
            return capped;
        }
        double factor = 0.5 + random.nextDouble();
        return Duration.ofMillis(Math.round(capped.toMillis() * factor));
    }

    /** Un-jittered delay: {@code min(maxDelay, baseDelay * 2^(attempt-1))}. */
    public Duration baseDelayFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 30));
        long millis = baseDelay.toMillis();
        long scaled = millis > (Long.MAX_VALUE >> exponent) ? Long.MAX_VALUE : millis << exponent;
        return Duration.ofMillis(Math.min(maxDelay.toMillis(), scaled));
    }

    /**
     * Sleeps the backoff that follows {@code attempt}.
     */
    public void backoff(int attempt) {
        pause(delayFor(attempt));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private void pause(Duration delay) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", e);
        }
    }
}
