package com.groundgate.core.model;

import java.io.Serializable;

/**
 * Whether another attempt is allowed.
 *
 * @param shouldRetry true to run another attempt
 * @param reason      {@code validation_failed}, {@code max_attempts_reached}, or empty
 */
public record RetryDecision(boolean shouldRetry, String reason) implements Serializable {

    public static final String VALIDATION_FAILED = "validation_failed";
    public static final String MAX_ATTEMPTS_REACHED = "max_attempts_reached";
}
