package com.groundgate.core.retry;

import com.groundgate.core.model.RetryAttempt;

import java.util.List;

/**
 * Snapshot of a {@link RetryManager} ledger.
 */
public record RetrySummary(
    int totalAttempts,
    double totalCost,
    List<RetryAttempt> attempts,
    boolean anyImproved
) {}
