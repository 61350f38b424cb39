package com.groundgate.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a task. Transitions only move forward:
 * PENDING → RUNNING → {DONE, FAILED}, or PENDING → BLOCKED.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == BLOCKED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    private Set<TaskStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, BLOCKED);
            case RUNNING -> EnumSet.of(DONE, FAILED);
            case DONE, FAILED, BLOCKED -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
