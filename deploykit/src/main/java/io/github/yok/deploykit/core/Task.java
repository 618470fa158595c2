package io.github.yok.deploykit.core;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;

/**
 * One named unit of work in a deployment run.
 *
 * <p>
 * A task declares the connections its work needs and whether it is idempotent. A failed
 * idempotent task lets the run continue; a failed non-idempotent task halts it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class Task {

    private final String name;
    private final List<String> requiredConnections;
    private final boolean idempotent;
    private final TaskWork work;

    private Task(String name, List<String> requiredConnections, boolean idempotent,
            TaskWork work) {
        this.name = name;
        this.requiredConnections = ImmutableList.copyOf(requiredConnections);
        this.idempotent = idempotent;
        this.work = work;
    }

    /**
     * Starts a task definition.
     *
     * @param name task name, unique within a run
     * @return builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "Task[" + name + ", connections=" + requiredConnections + ", idempotent="
                + idempotent + "]";
    }

    /**
     * Builder for {@link Task}.
     */
    public static final class Builder {

        private final String name;
        private final List<String> connections = new ArrayList<>();
        private boolean idempotent;
        private TaskWork work;

        private Builder(String name) {
            this.name = name;
        }

        public Builder connections(String... names) {
            return connections(Arrays.asList(names));
        }

        public Builder connections(List<String> names) {
            if (names != null) {
                connections.addAll(names);
            }
            return this;
        }

        public Builder idempotent(boolean idempotent) {
            this.idempotent = idempotent;
            return this;
        }

        public Builder work(TaskWork work) {
            this.work = work;
            return this;
        }

        /**
         * Builds the task.
         *
         * @return task
         * @throws NullPointerException when the name or work is missing
         * @throws IllegalArgumentException when a connection name is blank or repeated
         */
        public Task build() {
            Preconditions.checkNotNull(name, "task name must not be null");
            Preconditions.checkNotNull(work, "work must not be null for task %s", name);
            List<String> distinct = new ArrayList<>();
            // The broker matches connection names case-insensitively
            Set<String> keys = new HashSet<>();
            for (String connection : connections) {
                Preconditions.checkArgument(connection != null && !connection.isBlank(),
                        "blank connection name in task %s", name);
                String trimmed = connection.trim();
                Preconditions.checkArgument(keys.add(trimmed.toLowerCase(Locale.ROOT)),
                        "connection %s listed twice in task %s", trimmed, name);
                distinct.add(trimmed);
            }
            return new Task(name.trim(), distinct, idempotent, work);
        }
    }
}
