package com.groundgate.core.budget;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts tool calls and retries for one run and remembers why the run degraded.
 * Owned by a single engine thread.
 */
public class BudgetTracker {

    /** One entry of the tracker's event log. */
    public record Entry(String event, Map<String, Object> detail, Instant timestamp) {}

    private int toolCalls;
    private int retries;
    private final List<String> degradeReasons = new ArrayList<>();
    private final List<Entry> events = new ArrayList<>();

    public void recordToolCall() {
        toolCalls++;
    }

    public void recordRetry() {
        retries++;
    }

    public void recordDegrade(String reason) {
        if (!degradeReasons.contains(reason)) {
            degradeReasons.add(reason);
        }
        log("degrade", Map.of("reason", reason));
    }

    public void log(String event, Map<String, Object> detail) {
        events.add(new Entry(event, detail, Instant.now()));
    }

    public int toolCalls() {
        return toolCalls;
    }

    public int retries() {
        return retries;
    }

    public boolean degraded() {
        return !degradeReasons.isEmpty();
    }

    public List<String> degradeReasons() {
        return List.copyOf(degradeReasons);
    }

    public List<Entry> entries() {
        return List.copyOf(events);
    }

    public Map<String, Object> toSummary(BudgetSpec spec) {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("tool_calls", toolCalls);
        summary.put("max_tool_calls", spec.maxToolCalls());
        summary.put("retries", retries);
        summary.put("max_retries", spec.maxRetries());
        summary.put("degraded", degraded());
        summary.put("degrade_reasons", degradeReasons());
        return summary;
    }
}
