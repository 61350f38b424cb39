package com.groundgate.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work executed by the engine.
 * <p>
 * Status only moves forward (see {@link TaskStatus#canTransitionTo}) and history is
 * append-only. A task is owned by a single engine thread; it is not thread-safe.
 */
public final class Task {

    private final String id;
    private final TaskInputs inputs;
    private final int priority;
    private final String title;
    private TaskStatus status = TaskStatus.PENDING;
    private final List<HistoryEvent> history = new ArrayList<>();

    public Task(String id, String title, TaskInputs inputs, int priority) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.inputs = Objects.requireNonNull(inputs, "inputs");
        this.priority = priority;
    }

    public static Task generic(String id, String query) {
        return new Task(id, query, new TaskInputs.Generic(query), 0);
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public TaskCategory category() {
        return inputs.category();
    }

    public TaskInputs inputs() {
        return inputs;
    }

    public int priority() {
        return priority;
    }

    public TaskStatus status() {
        return status;
    }

    public List<HistoryEvent> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Moves the task to {@code next}.
     *
     * @throws IllegalStateException if the transition would move status backwards
     */
    public void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    public HistoryEvent appendHistory(String event, Map<String, Object> payload) {
        var entry = new HistoryEvent(event, status, payload, Instant.now());
        history.add(entry);
        return entry;
    }

    @Override
    public String toString() {
        return "Task[" + id + ", " + category() + ", " + status + "]";
    }
}
