package com.groundgate.core.engine;

import com.groundgate.core.model.Task;

import java.util.List;

/**
 * Splits a root task into ordered subtasks. Called once per root task.
 */
@FunctionalInterface
public interface Planner {

    List<Task> plan(Task root);

    /** Planner that executes the root task itself as the only subtask. */
    static Planner identity() {
        return root -> List.of(root);
    }
}
