package com.groundgate.core.budget;

/**
 * Per-run limits on external calls.
 *
 * @param maxToolCalls Router invocations allowed in one run, across all subtasks
 * @param maxRetries   retries allowed in one run, across all subtasks
 */
public record BudgetSpec(int maxToolCalls, int maxRetries) {

    public BudgetSpec {
        if (maxToolCalls < 1) {
            throw new IllegalArgumentException("maxToolCalls must be at least 1: " + maxToolCalls);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
    }

    public static BudgetSpec defaults() {
        return new BudgetSpec(20, 10);
    }
}
