package com.groundgate.core.engine;

import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.EvaluationResult;
import com.groundgate.core.model.VerifyResult;

/**
 * Everything the engine learned from one attempt.
 *
 * @param result     agent result with citations replaced by their validated form
 * @param resolution engine-computed status and warnings
 * @param verify     quality-gate result, or the unverified result when the gate was skipped
 * @param evaluation combined verdict used for the retry decision
 */
record AttemptOutcome(
    AgentResult result,
    StatusResolution resolution,
    VerifyResult verify,
    EvaluationResult evaluation
) {

    int problemCount() {
        return evaluation.errors().size();
    }
}
