package com.groundgate.core.budget;

/**
 * Decides whether the run's budget still allows another attempt.
 */
public class BudgetPolicy {

    public BudgetDecision decide(BudgetSpec spec, BudgetTracker tracker) {
        if (tracker.toolCalls() >= spec.maxToolCalls()) {
            return new BudgetDecision(false, "tool_call_limit");
        }
        if (tracker.retries() >= spec.maxRetries()) {
            return new BudgetDecision(false, "retry_limit");
        }
        return new BudgetDecision(true, null);
    }
}
