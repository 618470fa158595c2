package io.github.yok.deploykit.service;

import io.github.yok.deploykit.core.CancellationToken;
import io.github.yok.deploykit.core.RunRecord;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a JVM shutdown (SIGTERM forwarded by the container's init process) into a cancelled run.
 *
 * <p>
 * While installed, the shutdown hook requests cancellation, waits up to the grace period for the
 * run to hand over its finalized record through {@link #complete(RunRecord)}, then halts the JVM
 * with the exit code of that record. When the grace period runs out first, it halts with the
 * cancelled code.
 * </p>
 *
 * <p>
 * One coordinator serves one run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ShutdownCoordinator {

    private final ProcessControl process;
    private final Duration grace;
    private final ExitCodeMapper exitCodes;
    private final CancellationToken cancellation = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicReference<RunRecord> record = new AtomicReference<>();
    private Thread hook;

    /**
     * Creates a coordinator.
     *
     * @param process process control
     * @param grace how long to wait for the run record
     * @param exitCodes exit code mapping
     */
    public ShutdownCoordinator(ProcessControl process, Duration grace, ExitCodeMapper exitCodes) {
        this.process = process;
        this.grace = grace != null && !grace.isNegative() ? grace : Duration.ZERO;
        this.exitCodes = exitCodes;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    /**
     * Registers the shutdown hook.
     */
    public synchronized void install() {
        if (hook == null) {
            hook = new Thread(this::onShutdown, "deploykit-shutdown");
            process.addShutdownHook(hook);
        }
    }

    /**
     * Hands over the finalized record and unregisters the hook when the JVM is not already
     * shutting down.
     *
     * @param finalRecord finalized record, may be {@code null} when none could be produced
     */
    public void complete(RunRecord finalRecord) {
        record.set(finalRecord);
        finished.countDown();
        uninstall();
    }

    private synchronized void uninstall() {
        if (hook == null) {
            return;
        }
        try {
            process.removeShutdownHook(hook);
            hook = null;
        } catch (IllegalStateException e) {
            // Shutdown already in progress; the hook halts with the record's exit code.
            log.debug("Shutdown hook left in place: {}", e.getMessage());
        }
    }

    /**
     * Body of the shutdown hook.
     */
    void onShutdown() {
        log.warn("Shutdown requested; cancelling run (grace period {})", grace);
        cancellation.cancel("shutdown requested");
        boolean done;
        try {
            done = finished.await(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            done = false;
        }
        if (!done) {
            log.error("Run did not finish within the grace period {}; halting", grace);
            process.halt(exitCodes.cancelled());
            return;
        }
        int code = exitCodes.map(record.get());
        log.info("Run finalized during shutdown; halting with exit code {}", code);
        process.halt(code);
    }
}
