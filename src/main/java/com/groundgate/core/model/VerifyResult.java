package com.groundgate.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of one quality-gate pass.
 * <p>
 * {@code gatePassed} must equal "no fail reason has severity ERROR"; the canonical
 * constructor rejects any other combination, so use {@link #of} to build passing results.
 *
 * @param gatePassed  true iff no ERROR-level fail reason is present
 * @param failReasons ordered fail reasons, warnings included
 * @param metrics     numeric gate metrics (citation_count, locator_coverage, ...)
 * @param verified    false only when the gate itself was skipped
 */
public record VerifyResult(
    boolean gatePassed,
    List<FailReason> failReasons,
    Map<String, Number> metrics,
    boolean verified
) implements Serializable {

    public VerifyResult {
        failReasons = failReasons == null ? List.of() : List.copyOf(failReasons);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        boolean noErrors = failReasons.stream().noneMatch(FailReason::isError);
        if (gatePassed != noErrors) {
            throw new IllegalArgumentException(
                    "gatePassed=" + gatePassed + " contradicts fail reasons " + failReasons);
        }
    }

    public static VerifyResult of(List<FailReason> failReasons, Map<String, Number> metrics) {
        boolean passed = failReasons.stream().noneMatch(FailReason::isError);
        return new VerifyResult(passed, failReasons, metrics, true);
    }

    public static VerifyResult unverified() {
        return new VerifyResult(false,
                List.of(FailReason.error(FailCode.VERIFY_NOT_RUN, "Quality gate verification was not executed.")),
                Map.of(), false);
    }

    public Set<FailCode> failCodes() {
        var codes = new LinkedHashSet<FailCode>();
        failReasons.forEach(r -> codes.add(r.code()));
        return codes;
    }

    public Set<FailCode> errorCodes() {
        var codes = new LinkedHashSet<FailCode>();
        failReasons.stream().filter(FailReason::isError).forEach(r -> codes.add(r.code()));
        return codes;
    }

    public List<FailReason> errors() {
        return failReasons.stream().filter(FailReason::isError).toList();
    }

    /**
     * Eval-summary view consumed by reporting tools.
     */
    public Map<String, Object> toEvalSummary(String runId) {
        var summary = new LinkedHashMap<String, Object>();
        summary.put("run_id", runId);
        summary.put("status", gatePassed ? "pass" : "fail");
        summary.put("gate_passed", gatePassed);
        summary.put("fail_reasons", failReasons.stream().map(FailReason::toMap).toList());
        summary.put("metrics", metrics);
        summary.put("verified", verified);
        return summary;
    }
}
