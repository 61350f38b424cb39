package com.groundgate.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Verdict on one attempt, either from the engine's objective checks or from a
 * host-supplied evaluator.
 */
public record EvaluationResult(boolean ok, List<String> errors) implements Serializable {

    public EvaluationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static EvaluationResult passed() {
        return new EvaluationResult(true, List.of());
    }

    public static EvaluationResult failed(List<String> errors) {
        return new EvaluationResult(false, errors);
    }

    /**
     * Combines two verdicts: ok only if both are ok, errors concatenated in order.
     */
    public EvaluationResult and(EvaluationResult other) {
        if (other == null) {
            return this;
        }
        var merged = new ArrayList<>(errors);
        merged.addAll(other.errors());
        return new EvaluationResult(ok && other.ok(), merged);
    }
}
