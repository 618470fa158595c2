package io.github.yok.deploykit;

import io.github.yok.deploykit.config.ConnectionConfig;
import io.github.yok.deploykit.config.RunnerConfig;
import io.github.yok.deploykit.service.DeployKitService;
import io.github.yok.deploykit.service.RunRequest;
import io.github.yok.deploykit.util.ErrorHandler;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point of a deployment container.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --tasks a,b} or {@code -t a,b} runs only the named tasks, in their declared
 * order.</li>
 * <li>{@code --record path} or {@code -r path} writes the run record to {@code path} instead of
 * {@code deploykit.runner.record-path}.</li>
 * <li>{@code --as-of instant} or {@code -a instant} sets the ISO-8601 as-of instant of the
 * run.</li>
 * </ul>
 *
 * <p>
 * Unknown arguments are logged and ignored. The outcome of the run becomes the process exit code
 * (see {@link RunnerConfig.ExitCodes}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties({ConnectionConfig.class, RunnerConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final DeployKitService service;
    private final RunnerConfig runnerConfig;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the run's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        System.exit(launch(args));
    }

    /**
     * Runs the application and closes the context.
     *
     * @param args command-line arguments
     * @return exit code
     */
    static int launch(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        // The run's own shutdown hook decides the exit code on SIGTERM
        app.setRegisterShutdownHook(false);
        return SpringApplication.exit(app.run(args));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        RunRequest request;
        try {
            request = parse(args);
        } catch (DateTimeParseException e) {
            ErrorHandler.fatal("Invalid --as-of value: " + e.getParsedString(), e);
            exitCode = runnerConfig.getExitCodes().getFailure();
            return;
        } catch (IllegalArgumentException e) {
            ErrorHandler.fatal("Invalid arguments: " + e.getMessage(), e);
            exitCode = runnerConfig.getExitCodes().getFailure();
            return;
        }
        log.info("Tasks: {}, Record: {}, As of: {}",
                request.getTasks().isEmpty() ? "<all>" : request.getTasks(),
                request.getRecordPath(), request.getAsOf());
        exitCode = service.execute(request);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Parses the command-line options.
     *
     * @param args arguments
     * @return request
     * @throws DateTimeParseException when the as-of value is not an ISO-8601 instant
     * @throws IllegalArgumentException when {@code --tasks} names no task
     */
    static RunRequest parse(String... args) {
        RunRequest request = new RunRequest();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--tasks":
                case "-t":
                    String option = args[i];
                    List<String> tasks = i + 1 < args.length
                            ? Arrays.stream(args[++i].split(",")).map(String::trim)
                                    .filter(s -> !s.isEmpty()).collect(Collectors.toList())
                            : Collections.emptyList();
                    if (tasks.isEmpty()) {
                        throw new IllegalArgumentException(
                                option + " requires at least one task name");
                    }
                    request.setTasks(tasks);
                    break;
                case "--record":
                case "-r":
                    request.setRecordPath(i + 1 < args.length ? args[++i] : null);
                    break;
                case "--as-of":
                case "-a":
                    if (i + 1 < args.length) {
                        request.setAsOf(Instant.parse(args[++i].trim()));
                    }
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }
        return request;
    }
}
