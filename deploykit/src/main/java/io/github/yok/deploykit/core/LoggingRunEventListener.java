package io.github.yok.deploykit.core;

import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Default {@link RunEventListener} that writes one {@code key=value} line per event.
 *
 * <p>
 * The run id is put into the MDC under {@value #MDC_RUN_ID} while the run is in progress and the
 * task name under {@value #MDC_TASK} for each task transition, so the Logback pattern can show
 * them on every line logged in between.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LoggingRunEventListener implements RunEventListener {

    /** MDC key of the current run id. */
    public static final String MDC_RUN_ID = "runId";

    /** MDC key of the current task name. */
    public static final String MDC_TASK = "task";

    @Override
    public void onRunStarted(String runId, int taskCount, Instant startedAt) {
        MDC.put(MDC_RUN_ID, runId);
        log.info("event=run_started run={} tasks={} at={}", runId, taskCount, startedAt);
    }

    @Override
    public void onTaskTransition(TaskEvent event) {
        MDC.put(MDC_TASK, event.getTaskName());
        try {
            if (event.getError() != null) {
                log.warn("event=task_transition run={} task={} position={} from={} to={} at={}"
                        + " error=\"{}\"", event.getRunId(), event.getTaskName(),
                        event.getPosition(), event.getFrom(), event.getTo(), event.getTimestamp(),
                        event.getError());
            } else {
                log.info("event=task_transition run={} task={} position={} from={} to={} at={}",
                        event.getRunId(), event.getTaskName(), event.getPosition(),
                        event.getFrom(), event.getTo(), event.getTimestamp());
            }
        } finally {
            MDC.remove(MDC_TASK);
        }
    }

    @Override
    public void onRunFinished(RunRecord record) {
        try {
            log.info("event=run_finished run={} outcome={} cancelled={} succeeded={} failed={}"
                    + " skipped={} durationMs={}", record.getRunId(), record.getOutcome(),
                    record.isCancelled(), record.count(TaskState.SUCCEEDED),
                    record.count(TaskState.FAILED), record.count(TaskState.SKIPPED),
                    record.duration().toMillis());
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }
}
