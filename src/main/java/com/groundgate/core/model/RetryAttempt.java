package com.groundgate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Ledger entry for one attempt of a task.
 *
 * @param attempt   1-based attempt number
 * @param changes   remediation actions applied before this attempt
 * @param improved  whether this attempt had fewer blocking problems than the previous one
 * @param cost      cost charged for this attempt
 * @param timeMs    wall time of the attempt in milliseconds
 * @param timestamp when the attempt was recorded
 */
public record RetryAttempt(
    int attempt,
    List<String> changes,
    boolean improved,
    double cost,
    long timeMs,
    Instant timestamp
) implements Serializable {

    public RetryAttempt {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
