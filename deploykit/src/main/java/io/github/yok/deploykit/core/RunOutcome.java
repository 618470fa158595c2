package io.github.yok.deploykit.core;

import java.util.List;

/**
 * Overall outcome of a run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RunOutcome {

    /** Every task succeeded. */
    SUCCESS,

    /** Only idempotent tasks failed and at least one later task still succeeded. */
    PARTIAL_FAILURE,

    /** A non-idempotent task failed and halted the run, or nothing succeeded after a failure. */
    FAILURE;

    /**
     * Derives the outcome from the final task states.
     *
     * @param tasks task descriptors in declared order, all in a terminal state
     * @param halted whether a failed non-idempotent task halted the run
     * @param cancelled whether the run was cancelled before all tasks ran
     * @return outcome
     */
    public static RunOutcome evaluate(List<TaskDescriptor> tasks, boolean halted,
            boolean cancelled) {
        boolean allSucceeded =
                tasks.stream().allMatch(t -> t.getState() == TaskState.SUCCEEDED);
        if (allSucceeded && !cancelled) {
            return SUCCESS;
        }
        if (halted || cancelled) {
            return FAILURE;
        }
        int firstFailure = -1;
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).getState() == TaskState.FAILED) {
                firstFailure = i;
                break;
            }
        }
        if (firstFailure < 0) {
            return FAILURE;
        }
        for (int i = firstFailure + 1; i < tasks.size(); i++) {
            if (tasks.get(i).getState() == TaskState.SUCCEEDED) {
                return PARTIAL_FAILURE;
            }
        }
        return FAILURE;
    }
}
