package io.github.yok.deploykit.service;

import com.google.common.collect.ImmutableList;
import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.config.ConnectionConfig;
import io.github.yok.deploykit.config.ConnectionConfigValidator;
import io.github.yok.deploykit.config.RunnerConfig;
import io.github.yok.deploykit.core.CancellationToken;
import io.github.yok.deploykit.core.LoggingRunEventListener;
import io.github.yok.deploykit.core.RunRecord;
import io.github.yok.deploykit.core.RunRecordYamlWriter;
import io.github.yok.deploykit.core.Task;
import io.github.yok.deploykit.core.TaskRunner;
import io.github.yok.deploykit.db.ConnectionBroker;
import io.github.yok.deploykit.db.ConnectionDescriptor;
import io.github.yok.deploykit.util.ErrorHandler;
import io.github.yok.deploykit.util.MaskingLogUtil;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs one deployment from configuration to exit code.
 *
 * <p>
 * For each call to {@link #execute(RunRequest)}:
 * </p>
 * <ol>
 * <li>a shutdown hook is installed so SIGTERM cancels the run,</li>
 * <li>connection descriptors and the task sequence are built from configuration,</li>
 * <li>a fresh {@link ConnectionBroker} is created, the {@link TaskRunner} runs the sequence, and
 * the broker is closed,</li>
 * <li>the finalized record is written when a record path is set, and mapped to the exit
 * code.</li>
 * </ol>
 *
 * <p>
 * Configuration errors and unexpected failures are reported through {@link ErrorHandler} and
 * still produce a finalized FAILURE record.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class DeployKitService {

    private final ConnectionConfig connectionConfig;
    private final RunnerConfig runnerConfig;
    private final ConnectionConfigValidator validator;
    private final TaskCatalog catalog;
    private final BrokerFactory brokerFactory;
    private final ProcessControl processControl;
    private final Clock clock;
    private final RunRecordYamlWriter recordWriter = new RunRecordYamlWriter();

    @Autowired
    public DeployKitService(ConnectionConfig connectionConfig, RunnerConfig runnerConfig,
            TaskCatalog catalog, BrokerFactory brokerFactory) {
        this(connectionConfig, runnerConfig, new ConnectionConfigValidator(), catalog,
                brokerFactory, ProcessControl.runtime(), Clock.systemUTC());
    }

    DeployKitService(ConnectionConfig connectionConfig, RunnerConfig runnerConfig,
            ConnectionConfigValidator validator, TaskCatalog catalog, BrokerFactory brokerFactory,
            ProcessControl processControl, Clock clock) {
        this.connectionConfig = connectionConfig;
        this.runnerConfig = runnerConfig;
        this.validator = validator;
        this.catalog = catalog;
        this.brokerFactory = brokerFactory;
        this.processControl = processControl;
        this.clock = clock;
    }

    /**
     * Runs the deployment.
     *
     * @param request command-line options
     * @return process exit code
     */
    public int execute(RunRequest request) {
        ExitCodeMapper exitCodes;
        ConfigurationException invalidExitCodes = null;
        try {
            exitCodes = new ExitCodeMapper(runnerConfig.getExitCodes());
        } catch (ConfigurationException e) {
            // Report with the default codes; the run itself is rejected below
            invalidExitCodes = e;
            exitCodes = new ExitCodeMapper(new RunnerConfig.ExitCodes());
        }
        ShutdownCoordinator shutdown = new ShutdownCoordinator(processControl,
                runnerConfig.getShutdownGrace(), exitCodes);
        shutdown.install();

        Instant startedAt = clock.instant();
        RunRecord record = null;
        try {
            if (invalidExitCodes != null) {
                throw invalidExitCodes;
            }
            record = run(request, shutdown.getCancellation());
        } catch (ConfigurationException e) {
            record = e.getRunRecord().orElseGet(() -> rejected(request, startedAt, e));
            ErrorHandler.fatal("Configuration error: " + e.getMessage(), e);
        } catch (RuntimeException | Error e) {
            record = rejected(request, startedAt, e);
            ErrorHandler.fatal("Fatal error: " + e.getMessage(), e);
        } finally {
            persist(record, request);
            shutdown.complete(record);
        }
        int code = exitCodes.map(record);
        log.info("Run {} finished: outcome={}, cancelled={}, exit code={}", record.getRunId(),
                record.getOutcome(), record.isCancelled(), code);
        return code;
    }

    private RunRecord run(RunRequest request, CancellationToken cancellation) {
        List<ConnectionDescriptor> descriptors = validator.toDescriptors(connectionConfig);
        for (ConnectionDescriptor descriptor : descriptors) {
            log.info("Connection: {}", MaskingLogUtil.describe(descriptor));
        }
        List<Task> tasks = catalog.build(runnerConfig.getTasks(), request.getTasks());
        try (ConnectionBroker broker = brokerFactory.create(descriptors)) {
            TaskRunner runner = new TaskRunner(broker,
                    ImmutableList.of(new LoggingRunEventListener()), clock, cancellation);
            return runner.run(tasks, request.getAsOf());
        }
    }

    private RunRecord rejected(RunRequest request, Instant startedAt, Throwable cause) {
        Instant asOf = request.getAsOf() != null ? request.getAsOf() : startedAt;
        return RunRecord.rejected(asOf, startedAt, clock.instant(), cause);
    }

    private void persist(RunRecord record, RunRequest request) {
        String path = StringUtils.defaultIfBlank(request.getRecordPath(),
                runnerConfig.getRecordPath());
        if (record == null || StringUtils.isBlank(path)) {
            return;
        }
        try {
            recordWriter.write(record, Paths.get(path.trim()));
        } catch (IOException e) {
            log.error("Failed to write run record to {}: {}", path, e.getMessage(), e);
        }
    }
}
