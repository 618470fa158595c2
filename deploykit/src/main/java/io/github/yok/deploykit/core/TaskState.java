package io.github.yok.deploykit.core;

/**
 * Result state of one task within a run.
 *
 * <p>
 * Allowed transitions:
 * </p>
 * <ul>
 * <li>{@code PENDING → RUNNING | SKIPPED}</li>
 * <li>{@code PENDING → FAILED} when a required connection is not available; such a task never
 * runs</li>
 * <li>{@code RUNNING → SUCCEEDED | FAILED}</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum TaskState {

    PENDING, RUNNING, SUCCEEDED, FAILED, SKIPPED;

    /**
     * Returns whether the transition to {@code next} is allowed.
     *
     * @param next target state
     * @return {@code true} when allowed
     */
    public boolean canTransitionTo(TaskState next) {
        switch (this) {
            case PENDING:
                return next == RUNNING || next == SKIPPED || next == FAILED;
            case RUNNING:
                return next == SUCCEEDED || next == FAILED;
            default:
                return false;
        }
    }

    /**
     * Returns whether no further transition is possible.
     *
     * @return {@code true} for terminal states
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
