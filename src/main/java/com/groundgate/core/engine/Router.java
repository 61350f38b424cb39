package com.groundgate.core.engine;

import com.groundgate.core.model.AgentResult;
import com.groundgate.core.model.Task;

/**
 * Dispatches a task to an agent and returns its raw result. Called once per attempt.
 * <p>
 * Implementations own network timeouts. Transport failures should surface as
 * {@link RouterException}; the returned result is always treated as untrusted.
 */
@FunctionalInterface
public interface Router {

    AgentResult run(Task task);
}
