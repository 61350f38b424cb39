package com.groundgate.core.engine;

import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.EvaluationResult;

/**
 * Optional host-supplied check run after the engine's own checks. Receives the result
 * with citations already replaced by their validated form.
 */
@FunctionalInterface
public interface Evaluator {

    EvaluationResult evaluate(AgentResult result);
}
