package io.github.yok.deploykit.core;

import java.time.Instant;
import lombok.Data;

/**
 * Structured record of one task state transition.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class TaskEvent {

    private final String runId;
    private final String taskName;
    private final int position;
    private final TaskState from;
    private final TaskState to;
    private final Instant timestamp;
    // Failure detail for transitions to FAILED, otherwise null
    private final String error;
}
