package com.groundgate.core.budget;

/**
 * @param allowRetry    whether the budget leaves room for another attempt
 * @param degradeReason why not, or {@code null}
 */
public record BudgetDecision(boolean allowRetry, String degradeReason) {}
