package io.github.yok.deploykit.core;

import java.time.Instant;

/**
 * Receives the structured events of a run, for logging or telemetry sinks.
 *
 * <p>
 * Called on the run thread. Exceptions thrown by a listener are logged and otherwise ignored.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface RunEventListener {

    /**
     * Called once before any task is validated or run.
     *
     * @param runId run identifier
     * @param taskCount number of tasks in the sequence
     * @param startedAt start time
     */
    default void onRunStarted(String runId, int taskCount, Instant startedAt) {}

    /**
     * Called for every task state transition.
     *
     * @param event transition
     */
    default void onTaskTransition(TaskEvent event) {}

    /**
     * Called once with the finalized record.
     *
     * @param record finalized run record
     */
    default void onRunFinished(RunRecord record) {}
}
