package io.github.yok.deploykit.core;

import io.github.yok.deploykit.DeployKitException;

/**
 * Wraps a failure raised by a task's unit of work.
 *
 * <p>
 * Recorded on the task descriptor. Whether it halts the run depends on the task's idempotency
 * flag.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class TaskException extends DeployKitException {

    private static final long serialVersionUID = 1L;

    private final String taskName;

    /**
     * Creates a task error.
     *
     * @param taskName failing task
     * @param message detail message
     * @param cause failure raised by the unit of work
     */
    public TaskException(String taskName, String message, Throwable cause) {
        super(message, cause);
        this.taskName = taskName;
    }

    public String getTaskName() {
        return taskName;
    }
}
