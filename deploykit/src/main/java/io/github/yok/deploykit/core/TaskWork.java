package io.github.yok.deploykit.core;

/**
 * The unit of work of a task.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface TaskWork {

    /**
     * Runs the work.
     *
     * @param context leased connections and run information
     * @throws Exception any failure; the runner records it on the task
     */
    void execute(TaskContext context) throws Exception;
}
