package io.github.yok.deploykit.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Task sequence and process settings bound from {@code deploykit.runner}.
 *
 * <pre>
 * deploykit:
 *   runner:
 *     record-path: /var/run/deploykit/last-run.yml
 *     shutdown-grace: 20s
 *     tasks:
 *       - name: check
 *         type: table-check
 *         connections: [warehouse]
 *         idempotent: true
 *         tables: [dbo.predictions]
 *       - name: publish
 *         type: sql-script
 *         connections: [warehouse]
 *         script: classpath:sql/publish.sql
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "deploykit.runner")
@Data
public class RunnerConfig {

    /**
     * Tasks in execution order.
     */
    private List<TaskEntry> tasks = new ArrayList<>();

    /**
     * Where to write the finalized run record; not written when blank.
     */
    private String recordPath;

    /**
     * How long the shutdown hook waits for the run record before halting.
     */
    private Duration shutdownGrace = Duration.ofSeconds(30);

    /**
     * Process exit codes per outcome.
     */
    private ExitCodes exitCodes = new ExitCodes();

    /**
     * One task definition.
     */
    @Data
    public static class TaskEntry {
        // Unique task name
        private String name;
        // sql-script, table-check or bean
        private String type;
        // Connection names the task leases
        private List<String> connections = new ArrayList<>();
        // Whether a failure lets the run continue
        private boolean idempotent;
        // Script location for sql-script (classpath: or file:)
        private String script;
        // Tables for table-check
        private List<String> tables = new ArrayList<>();
        // Bean name for bean
        private String bean;
    }

    /**
     * Exit code mapping.
     */
    @Data
    public static class ExitCodes {
        private int success = 0;
        private int failure = 1;
        private int partialFailure = 2;
        // 128 + SIGTERM
        private int cancelled = 143;
    }
}
