package io.github.yok.deploykit.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.deploykit.db.ConnectionStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.Getter;

/**
 * Outcome ledger of one execution of a task sequence.
 *
 * <p>
 * Created by the {@link TaskRunner} per invocation and immutable once finalized: the task
 * descriptors it holds are frozen at the same moment.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class RunRecord {

    private final String runId;
    // Logical "as of" instant the run computes for
    private final Instant asOf;
    private final List<TaskDescriptor> tasks;
    private final List<ConnectionStatus> connections;
    private final Instant startedAt;
    private final Instant endedAt;
    private final RunOutcome outcome;
    private final boolean cancelled;
    private final Throwable failure;

    private RunRecord(String runId, Instant asOf, List<TaskDescriptor> tasks,
            List<ConnectionStatus> connections, Instant startedAt, Instant endedAt,
            RunOutcome outcome, boolean cancelled, Throwable failure) {
        this.runId = runId;
        this.asOf = asOf;
        this.tasks = ImmutableList.copyOf(tasks);
        this.connections = ImmutableList.copyOf(connections);
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.outcome = outcome;
        this.cancelled = cancelled;
        this.failure = failure;
    }

    /**
     * Freezes the task descriptors and finalizes the record.
     *
     * @param runId run identifier
     * @param asOf logical as-of instant
     * @param tasks task descriptors in declared order
     * @param connections connection statuses at the end of the run
     * @param startedAt start time
     * @param endedAt end time
     * @param outcome overall outcome
     * @param cancelled whether the run was cancelled
     * @param failure run-level failure such as a configuration error, may be {@code null}
     * @return finalized record
     */
    static RunRecord seal(String runId, Instant asOf, List<TaskDescriptor> tasks,
            List<ConnectionStatus> connections, Instant startedAt, Instant endedAt,
            RunOutcome outcome, boolean cancelled, Throwable failure) {
        for (TaskDescriptor task : tasks) {
            task.freeze();
        }
        return new RunRecord(runId, asOf, tasks, connections, startedAt, endedAt, outcome,
                cancelled, failure);
    }

    /**
     * Creates a failed record for a run that was rejected before a task sequence existed, for
     * example because the configuration could not be turned into tasks.
     *
     * @param asOf logical as-of instant
     * @param startedAt start time
     * @param endedAt end time
     * @param failure cause of the rejection
     * @return finalized {@link RunOutcome#FAILURE} record without tasks
     */
    public static RunRecord rejected(Instant asOf, Instant startedAt, Instant endedAt,
            Throwable failure) {
        return new RunRecord(UUID.randomUUID().toString(), asOf, ImmutableList.of(),
                ImmutableList.of(), startedAt, endedAt, RunOutcome.FAILURE, false, failure);
    }

    /**
     * Returns the descriptor of the named task.
     *
     * @param name task name
     * @return descriptor, or empty when the run has no such task
     */
    public Optional<TaskDescriptor> task(String name) {
        return tasks.stream().filter(t -> t.getName().equals(name)).findFirst();
    }

    /**
     * Returns the number of tasks in the given state.
     *
     * @param state task state
     * @return count
     */
    public long count(TaskState state) {
        return tasks.stream().filter(t -> t.getState() == state).count();
    }

    /**
     * Returns the wall-clock duration of the run.
     *
     * @return duration
     */
    public Duration duration() {
        return Duration.between(startedAt, endedAt);
    }

    @Override
    public String toString() {
        return "RunRecord[" + runId + ", outcome=" + outcome + ", tasks=" + tasks + "]";
    }
}
