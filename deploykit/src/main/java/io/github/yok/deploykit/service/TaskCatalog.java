package io.github.yok.deploykit.service;

import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.config.RunnerConfig;
import io.github.yok.deploykit.core.Task;
import io.github.yok.deploykit.core.TaskWork;
import io.github.yok.deploykit.core.task.SqlScriptWork;
import io.github.yok.deploykit.core.task.TableCheckWork;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Turns the configured task entries into a {@link Task} sequence.
 *
 * <p>
 * Supported task types:
 * </p>
 * <ul>
 * <li>{@code sql-script}: runs {@code script} in a transaction on its single connection</li>
 * <li>{@code table-check}: checks that every table in {@code tables} exists</li>
 * <li>{@code bean}: delegates to the Spring bean named {@code bean}, which must implement
 * {@link TaskWork}</li>
 * </ul>
 *
 * <p>
 * A selection narrows the sequence to the named tasks while keeping their declared order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskCatalog {

    public static final String SQL_SCRIPT = "sql-script";
    public static final String TABLE_CHECK = "table-check";
    public static final String BEAN = "bean";

    // Locates sql-script resources
    private final ResourceLoader resourceLoader;

    // Looks up bean tasks
    private final BeanFactory beanFactory;

    /**
     * Builds the task sequence.
     *
     * @param entries configured task entries in declared order
     * @param selection task names to keep; all tasks when {@code null} or empty
     * @return tasks in declared order
     * @throws ConfigurationException when an entry is invalid or a selected name is unknown
     */
    public List<Task> build(List<RunnerConfig.TaskEntry> entries, List<String> selection) {
        List<RunnerConfig.TaskEntry> declared = entries != null ? entries : new ArrayList<>();
        Set<String> wanted = new LinkedHashSet<>();
        if (selection != null) {
            for (String name : selection) {
                if (StringUtils.isNotBlank(name)) {
                    wanted.add(name.trim());
                }
            }
        }
        Set<String> known = new LinkedHashSet<>();
        for (RunnerConfig.TaskEntry entry : declared) {
            if (entry != null && entry.getName() != null) {
                known.add(entry.getName().trim());
            }
        }
        Set<String> unknown = new LinkedHashSet<>(wanted);
        unknown.removeAll(known);
        if (!unknown.isEmpty()) {
            throw new ConfigurationException(
                    "Unknown task(s) selected: " + unknown + " (declared: " + known + ")");
        }

        List<Task> tasks = new ArrayList<>();
        int index = 0;
        for (RunnerConfig.TaskEntry entry : declared) {
            if (entry == null || StringUtils.isBlank(entry.getName())) {
                throw new ConfigurationException(
                        "deploykit.runner.tasks[" + index + "].name is required.");
            }
            index++;
            if (!wanted.isEmpty() && !wanted.contains(entry.getName().trim())) {
                continue;
            }
            tasks.add(toTask(entry));
        }
        log.info("Task sequence: {}", tasks.stream().map(Task::getName).toArray());
        return tasks;
    }

    /**
     * Builds one task.
     *
     * @param entry task entry
     * @return task
     */
    private Task toTask(RunnerConfig.TaskEntry entry) {
        String name = entry.getName().trim();
        String type = StringUtils.defaultString(entry.getType()).trim().toLowerCase(Locale.ROOT);
        TaskWork work;
        switch (type) {
            case SQL_SCRIPT:
                if (entry.getConnections() == null || entry.getConnections().size() != 1) {
                    throw new ConfigurationException(
                            "sql-script task '" + name + "' must declare exactly one connection");
                }
                work = new SqlScriptWork(resourceLoader, entry.getScript());
                break;
            case TABLE_CHECK:
                if (entry.getConnections() == null || entry.getConnections().size() != 1) {
                    throw new ConfigurationException("table-check task '" + name
                            + "' must declare exactly one connection");
                }
                work = new TableCheckWork(entry.getTables());
                break;
            case BEAN:
                work = lookupBean(name, entry.getBean());
                break;
            default:
                throw new ConfigurationException(
                        "Unknown type '" + entry.getType() + "' for task '" + name + "'");
        }
        try {
            return Task.builder(name).connections(entry.getConnections())
                    .idempotent(entry.isIdempotent()).work(work).build();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private TaskWork lookupBean(String taskName, String beanName) {
        if (StringUtils.isBlank(beanName)) {
            throw new ConfigurationException("bean task '" + taskName + "' requires a bean name");
        }
        try {
            return beanFactory.getBean(beanName.trim(), TaskWork.class);
        } catch (BeansException e) {
            throw new ConfigurationException("No TaskWork bean '" + beanName.trim()
                    + "' for task '" + taskName + "'", e);
        }
    }
}
