package io.github.yok.deploykit.core;

import io.github.yok.deploykit.db.ConnectionStatus;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Writes a finalized {@link RunRecord} as a block-style YAML document.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings and enums by name, so the file can be read back
 * with any YAML parser without DeployKit on the classpath.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RunRecordYamlWriter {

    private final Yaml yaml;

    public RunRecordYamlWriter() {
        DumperOptions opts = new DumperOptions();
        opts.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        opts.setPrettyFlow(true);
        this.yaml = new Yaml(opts);
    }

    /**
     * Writes the record to a file, creating parent directories as needed.
     *
     * @param record finalized record
     * @param target output file, overwritten when present
     * @throws IOException when the file cannot be written
     */
    public void write(RunRecord record, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            yaml.dump(toMap(record), writer);
        }
        log.info("Run record written: {}", target);
    }

    /**
     * Renders the record as YAML text.
     *
     * @param record finalized record
     * @return YAML document
     */
    public String toYaml(RunRecord record) {
        StringWriter writer = new StringWriter();
        yaml.dump(toMap(record), writer);
        return writer.toString();
    }

    Map<String, Object> toMap(RunRecord record) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("runId", record.getRunId());
        root.put("outcome", record.getOutcome().name());
        root.put("cancelled", record.isCancelled());
        root.put("asOf", text(record.getAsOf()));
        root.put("startedAt", text(record.getStartedAt()));
        root.put("endedAt", text(record.getEndedAt()));
        if (record.getFailure() != null) {
            root.put("failure", ExceptionUtils.getMessage(record.getFailure()));
        }

        List<Map<String, Object>> tasks = new ArrayList<>();
        for (TaskDescriptor task : record.getTasks()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", task.getName());
            entry.put("position", task.getPosition());
            entry.put("state", task.getState().name());
            entry.put("idempotent", task.isIdempotent());
            entry.put("connections", new ArrayList<>(task.getRequiredConnections()));
            entry.put("startedAt", text(task.getStartedAt()));
            entry.put("endedAt", text(task.getEndedAt()));
            if (task.getError() != null) {
                entry.put("error", task.getErrorMessage());
            }
            tasks.add(entry);
        }
        root.put("tasks", tasks);

        List<Map<String, Object>> connections = new ArrayList<>();
        for (ConnectionStatus status : record.getConnections()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", status.getName());
            entry.put("driverKind", status.getDriverKind().name());
            entry.put("state", status.getState().name());
            entry.put("attempts", status.getAttempts());
            if (status.getLastError() != null) {
                entry.put("lastError", status.getLastError());
            }
            connections.add(entry);
        }
        root.put("connections", connections);
        return root;
    }

    private static String text(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
