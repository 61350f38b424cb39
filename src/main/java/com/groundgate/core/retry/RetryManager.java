package com.groundgate.core.retry;

import com.groundgate.core.model.FailCode;
import com.groundgate.core.model.Remediation;
import com.groundgate.core.model.RetryAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fail-code aware retry gate with a cost budget.
 * <p>
 * Grounding and quality codes map to a fixed remediation. Safety and infrastructure codes
 * are terminal no matter how much budget is left. One instance per run; not thread-safe.
 */
public class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    private static final Map<FailCode, Remediation> REMEDIATIONS = new EnumMap<>(Map.of(
            FailCode.CITATION_MISSING, new Remediation(FailCode.CITATION_MISSING, "add_search",
                    "Add additional paper search to find citations"),
            FailCode.LOCATOR_MISSING, new Remediation(FailCode.LOCATOR_MISSING, "extract_locators",
                    "Re-extract evidence with locator information"),
            FailCode.EVIDENCE_WEAK, new Remediation(FailCode.EVIDENCE_WEAK, "expand_search",
                    "Expand search to find more supporting evidence"),
            FailCode.ASSERTION_DANGER, new Remediation(FailCode.ASSERTION_DANGER, "soften_language",
                    "Rewrite with hedging language")
    ));

    private final int maxRetries;
    private final double costLimit;
    private final List<RetryAttempt> attempts = new ArrayList<>();
    private double totalCost;

    public RetryManager(int maxRetries, double costLimit) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.costLimit = costLimit;
    }

    public static boolean isRetryable(FailCode code) {
        return REMEDIATIONS.containsKey(code);
    }

    public boolean shouldRetry(Collection<FailCode> failCodes, int attempt) {
        return blockReason(failCodes, attempt).isEmpty();
    }

    /**
     * Why another attempt is not allowed, or empty when it is.
     */
    public Optional<String> blockReason(Collection<FailCode> failCodes, int attempt) {
        if (attempt >= maxRetries) {
            log.info("Max retries ({}) reached", maxRetries);
            return Optional.of("max_retries_reached");
        }
        if (!withinCostLimit()) {
            log.info("Cost limit ({}) reached at {}", costLimit, totalCost);
            return Optional.of("cost_limit_reached");
        }
        var terminal = failCodes.stream().filter(FailCode::isTerminal).toList();
        if (!terminal.isEmpty()) {
            return Optional.of("non_retryable:" + terminal);
        }
        if (failCodes.stream().noneMatch(RetryManager::isRetryable)) {
            return Optional.of("no_retryable_code");
        }
        return Optional.empty();
    }

    public boolean withinCostLimit() {
        return totalCost < costLimit;
    }

    /**
     * Remediations for the retryable codes in {@code failCodes}, first occurrence order.
     */
    public List<Remediation> remediationsFor(Collection<FailCode> failCodes) {
        var result = new ArrayList<Remediation>();
        for (FailCode code : new LinkedHashSet<>(failCodes)) {
            Remediation remediation = REMEDIATIONS.get(code);
            if (remediation != null) {
                result.add(remediation);
            }
        }
        return result;
    }

    public void recordAttempt(int attempt, List<String> changes, boolean improved, double cost, long timeMs) {
        attempts.add(new RetryAttempt(attempt, changes, improved, cost, timeMs, Instant.now()));
        if (cost > 0) {
            totalCost += cost;
        }
        log.debug("Recorded attempt {} (cost {}, total {})", attempt, cost, totalCost);
    }

    /** Clears the attempt ledger and accumulated cost before a new run. */
    public void reset() {
        attempts.clear();
        totalCost = 0;
    }

    public double totalCost() {
        return totalCost;
    }

    public List<RetryAttempt> attempts() {
        return List.copyOf(attempts);
    }

    public RetrySummary summary() {
        return new RetrySummary(attempts.size(), totalCost, List.copyOf(attempts),
                attempts.stream().anyMatch(RetryAttempt::improved));
    }
}
