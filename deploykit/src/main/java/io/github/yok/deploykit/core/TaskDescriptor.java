package io.github.yok.deploykit.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import lombok.Getter;

/**
 * Execution ledger entry of one task within a run.
 *
 * <p>
 * Created by the {@link TaskRunner} at run start in state {@link TaskState#PENDING}, mutated only
 * by the runner, and frozen when the {@link RunRecord} is finalized. Read access is public; the
 * mutators are package-private.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class TaskDescriptor {

    private final String name;
    // 1-based position in the declared sequence
    private final int position;
    private final List<String> requiredConnections;
    private final boolean idempotent;
    private TaskState state = TaskState.PENDING;
    private Instant startedAt;
    private Instant endedAt;
    private Throwable error;
    private boolean frozen;

    TaskDescriptor(Task task, int position) {
        this.name = task.getName();
        this.position = position;
        this.requiredConnections = ImmutableList.copyOf(task.getRequiredConnections());
        this.idempotent = task.isIdempotent();
    }

    /**
     * Returns the failure message, if any.
     *
     * @return error message, or {@code null}
     */
    public String getErrorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    /**
     * Moves the task to the next state.
     *
     * @param next target state
     * @param at transition time
     * @param failure failure to record, may be {@code null}
     * @return previous state
     */
    TaskState transition(TaskState next, Instant at, Throwable failure) {
        Preconditions.checkState(!frozen, "task %s belongs to a finalized run", name);
        Preconditions.checkState(state.canTransitionTo(next),
                "Illegal task state transition for '%s': %s -> %s", name, state, next);
        TaskState previous = state;
        if (next == TaskState.RUNNING) {
            startedAt = at;
        }
        if (next.isTerminal()) {
            endedAt = at;
        }
        if (failure != null) {
            error = failure;
        }
        state = next;
        return previous;
    }

    void freeze() {
        frozen = true;
    }

    @Override
    public String toString() {
        return "TaskDescriptor[" + position + ":" + name + "=" + state + "]";
    }
}
