package io.github.yok.deploykit.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.db.ConnectionBroker;
import io.github.yok.deploykit.db.ConnectionHandle;
import io.github.yok.deploykit.db.ConnectionException;
import io.github.yok.deploykit.db.ConnectionState;
import io.github.yok.deploykit.db.ConnectionStatus;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Executes a task sequence strictly in declared order on the calling thread.
 *
 * <p>
 * Each call to {@link #run(List, Instant)} creates a fresh {@link RunRecord}:
 * </p>
 * <ol>
 * <li>The sequence is validated before anything executes. Duplicate task names or references to
 * connections the broker does not know raise {@link ConfigurationException} carrying a
 * finalized {@link RunOutcome#FAILURE} record in which every task is
 * {@link TaskState#SKIPPED}.</li>
 * <li>Every referenced connection is resolved. Failures are recorded on the connection, not
 * thrown.</li>
 * <li>A task whose connections are not all {@link ConnectionState#CONNECTED} fails without
 * running. Otherwise its connections are leased, its work invoked and the leases released on
 * every exit path.</li>
 * <li>A failed non-idempotent task halts the run; a failed idempotent task does not.</li>
 * <li>The cancellation token is checked between tasks. Once set, the remaining tasks are
 * skipped and the record is marked cancelled.</li>
 * </ol>
 *
 * <p>
 * The runner never opens or closes connections itself; it only leases them from the
 * {@link ConnectionBroker}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TaskRunner {

    private final ConnectionBroker broker;
    private final List<RunEventListener> listeners;
    private final Clock clock;
    private final CancellationToken cancellation;

    /**
     * Creates a runner that logs events and uses the system clock.
     *
     * @param broker connection broker of this run
     * @param cancellation cancellation token checked between tasks
     */
    public TaskRunner(ConnectionBroker broker, CancellationToken cancellation) {
        this(broker, ImmutableList.of(new LoggingRunEventListener()), Clock.systemUTC(),
                cancellation);
    }

    /**
     * Creates a runner.
     *
     * @param broker connection broker of this run
     * @param listeners event listeners, called in order
     * @param clock clock for timestamps
     * @param cancellation cancellation token checked between tasks
     */
    public TaskRunner(ConnectionBroker broker, List<RunEventListener> listeners, Clock clock,
            CancellationToken cancellation) {
        this.broker = Preconditions.checkNotNull(broker, "broker");
        this.listeners = ImmutableList.copyOf(listeners);
        this.clock = Preconditions.checkNotNull(clock, "clock");
        this.cancellation = Preconditions.checkNotNull(cancellation, "cancellation");
    }

    /**
     * Runs the sequence with the run start as the as-of instant.
     *
     * @param tasks tasks in execution order
     * @return finalized record
     * @throws ConfigurationException when the sequence is invalid
     */
    public RunRecord run(List<Task> tasks) {
        return run(tasks, null);
    }

    /**
     * Runs the sequence.
     *
     * @param tasks tasks in execution order
     * @param asOf logical as-of instant; the run start when {@code null}
     * @return finalized record
     * @throws ConfigurationException when the sequence is invalid
     */
    public RunRecord run(List<Task> tasks, Instant asOf) {
        Preconditions.checkNotNull(tasks, "tasks");
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        Instant effectiveAsOf = asOf != null ? asOf : startedAt;

        List<TaskDescriptor> descriptors = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            descriptors.add(new TaskDescriptor(
                    Preconditions.checkNotNull(tasks.get(i), "task at position %s", i + 1),
                    i + 1));
        }
        fireRunStarted(runId, descriptors.size(), startedAt);

        List<String> problems = validate(tasks);
        if (!problems.isEmpty()) {
            String message = "Invalid task sequence: " + String.join("; ", problems);
            ConfigurationException problem = new ConfigurationException(message);
            skipRemaining(runId, descriptors, 0);
            RunRecord record = finish(runId, effectiveAsOf, descriptors, startedAt,
                    RunOutcome.FAILURE, false, problem);
            throw new ConfigurationException(message, problem, record);
        }

        Set<String> referenced = new LinkedHashSet<>();
        for (Task task : tasks) {
            referenced.addAll(task.getRequiredConnections());
        }
        broker.resolveAll(referenced);

        boolean halted = false;
        boolean cancelled = false;
        for (int i = 0; i < tasks.size(); i++) {
            if (cancellation.isCancellationRequested()) {
                log.warn("Run {} cancelled before task '{}': {}", runId, tasks.get(i).getName(),
                        cancellation.getReason());
                cancelled = true;
                skipRemaining(runId, descriptors, i);
                break;
            }
            boolean succeeded = execute(runId, effectiveAsOf, tasks.get(i), descriptors.get(i));
            if (!succeeded && !tasks.get(i).isIdempotent()) {
                log.error("Run {} halted by non-idempotent task '{}'", runId,
                        tasks.get(i).getName());
                halted = true;
                skipRemaining(runId, descriptors, i + 1);
                break;
            }
        }

        RunOutcome outcome = RunOutcome.evaluate(descriptors, halted, cancelled);
        return finish(runId, effectiveAsOf, descriptors, startedAt, outcome, cancelled, null);
    }

    private List<String> validate(List<Task> tasks) {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Task task : tasks) {
            if (StringUtils.isBlank(task.getName())) {
                problems.add("blank task name");
                continue;
            }
            if (!seen.add(task.getName())) {
                problems.add("duplicate task name '" + task.getName() + "'");
            }
            for (String connection : task.getRequiredConnections()) {
                if (!broker.contains(connection)) {
                    problems.add("task '" + task.getName() + "' references unknown connection '"
                            + connection + "'");
                }
            }
        }
        return problems;
    }

    private boolean execute(String runId, Instant asOf, Task task, TaskDescriptor descriptor) {
        List<String> unavailable = new ArrayList<>();
        for (String connection : task.getRequiredConnections()) {
            if (broker.state(connection) != ConnectionState.CONNECTED) {
                unavailable.add(connection);
            }
        }
        if (!unavailable.isEmpty()) {
            ConnectionStatus status = broker.status(unavailable.get(0));
            ConnectionException failure = new ConnectionException(status.getName(),
                    status.getAttempts(), "Task '" + task.getName()
                            + "' requires unavailable connection(s) " + unavailable,
                    null);
            transition(runId, descriptor, TaskState.FAILED, failure);
            return false;
        }

        transition(runId, descriptor, TaskState.RUNNING, null);
        Map<String, ConnectionHandle> handles = new LinkedHashMap<>();
        Throwable failure = null;
        try {
            for (String connection : task.getRequiredConnections()) {
                handles.put(connection, broker.acquire(connection));
            }
            task.getWork().execute(
                    new TaskContext(runId, task.getName(), asOf, handles, cancellation));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel("interrupted during task '" + task.getName() + "'");
            failure = wrap(task, e);
        } catch (Throwable e) {
            // Any failure of the work, errors included, ends in FAILED so the record is sealed
            failure = wrap(task, e);
        } finally {
            List<ConnectionHandle> leased = new ArrayList<>(handles.values());
            for (int i = leased.size() - 1; i >= 0; i--) {
                leased.get(i).release();
            }
        }

        if (failure != null) {
            transition(runId, descriptor, TaskState.FAILED, failure);
            return false;
        }
        transition(runId, descriptor, TaskState.SUCCEEDED, null);
        return true;
    }

    private static TaskException wrap(Task task, Throwable e) {
        if (e instanceof TaskException) {
            return (TaskException) e;
        }
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
        return new TaskException(task.getName(),
                "Task '" + task.getName() + "' failed: " + detail, e);
    }

    private void skipRemaining(String runId, List<TaskDescriptor> descriptors, int from) {
        for (int i = from; i < descriptors.size(); i++) {
            if (descriptors.get(i).getState() == TaskState.PENDING) {
                transition(runId, descriptors.get(i), TaskState.SKIPPED, null);
            }
        }
    }

    private void transition(String runId, TaskDescriptor descriptor, TaskState next,
            Throwable failure) {
        Instant at = clock.instant();
        TaskState previous = descriptor.transition(next, at, failure);
        TaskEvent event = new TaskEvent(runId, descriptor.getName(), descriptor.getPosition(),
                previous, next, at, failure != null ? descriptor.getErrorMessage() : null);
        for (RunEventListener listener : listeners) {
            try {
                listener.onTaskTransition(event);
            } catch (RuntimeException e) {
                log.warn("Run event listener {} failed on task transition: {}",
                        listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    private RunRecord finish(String runId, Instant asOf, List<TaskDescriptor> descriptors,
            Instant startedAt, RunOutcome outcome, boolean cancelled, Throwable failure) {
        List<ConnectionStatus> connections = new ArrayList<>();
        for (String name : broker.names()) {
            connections.add(broker.status(name));
        }
        RunRecord record = RunRecord.seal(runId, asOf, descriptors, connections, startedAt,
                clock.instant(), outcome, cancelled, failure);
        for (RunEventListener listener : listeners) {
            try {
                listener.onRunFinished(record);
            } catch (RuntimeException e) {
                log.warn("Run event listener {} failed on run finish: {}",
                        listener.getClass().getName(), e.getMessage(), e);
            }
        }
        return record;
    }

    private void fireRunStarted(String runId, int taskCount, Instant startedAt) {
        for (RunEventListener listener : listeners) {
            try {
                listener.onRunStarted(runId, taskCount, startedAt);
            } catch (RuntimeException e) {
                log.warn("Run event listener {} failed on run start: {}",
                        listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
