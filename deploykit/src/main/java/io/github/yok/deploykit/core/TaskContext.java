package io.github.yok.deploykit.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import io.github.yok.deploykit.db.ConnectionHandle;
import java.sql.Connection;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * What a task's work sees while it runs: its leased connections, the run id, the as-of instant
 * and the cancellation token.
 *
 * <p>
 * Connections are looked up by the names the task declared. Asking for any other name is a
 * programming error and raises {@link IllegalArgumentException}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class TaskContext {

    @Getter
    private final String runId;
    @Getter
    private final String taskName;
    @Getter
    private final Instant asOf;
    private final Map<String, ConnectionHandle> handles;
    private final CancellationToken cancellation;

    TaskContext(String runId, String taskName, Instant asOf, Map<String, ConnectionHandle> handles,
            CancellationToken cancellation) {
        this.runId = runId;
        this.taskName = taskName;
        this.asOf = asOf;
        this.handles = ImmutableMap.copyOf(handles);
        this.cancellation = cancellation;
    }

    /**
     * Returns the lease of a declared connection.
     *
     * @param name connection name
     * @return handle
     * @throws IllegalArgumentException when the task did not declare the connection
     */
    public ConnectionHandle handle(String name) {
        ConnectionHandle handle = handles.get(name);
        Preconditions.checkArgument(handle != null,
                "Task '%s' did not declare connection '%s' (declared: %s)", taskName, name,
                handles.keySet());
        return handle;
    }

    /**
     * Returns the lease of the only connection of a task that declared exactly one.
     *
     * @return handle
     * @throws IllegalStateException when the task declared none or several
     */
    public ConnectionHandle handle() {
        Preconditions.checkState(handles.size() == 1,
                "Task '%s' declares %s connections; name the one to use", taskName,
                handles.size());
        return handles.values().iterator().next();
    }

    /**
     * Returns the guarded JDBC connection of a declared connection.
     *
     * @param name connection name
     * @return connection, valid while the task runs
     * @throws IllegalArgumentException when the task did not declare the connection
     */
    public Connection connection(String name) {
        return handle(name).connection();
    }

    /**
     * Returns the only connection of a task that declared exactly one.
     *
     * @return connection
     * @throws IllegalStateException when the task declared none or several
     */
    public Connection connection() {
        return handle().connection();
    }

    /**
     * Returns the declared connection names.
     *
     * @return names in declared order
     */
    public Set<String> connectionNames() {
        return handles.keySet();
    }

    /**
     * Returns whether cancellation has been requested. Long-running work may poll this and stop
     * early.
     *
     * @return {@code true} once the run is being cancelled
     */
    public boolean isCancellationRequested() {
        return cancellation.isCancellationRequested();
    }
}
