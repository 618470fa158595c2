package io.github.yok.deploykit.core;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag shared between the adapter and the task runner.
 *
 * <p>
 * The runner checks it between tasks only, never inside one, so an in-flight task always finishes
 * and releases its connections before the run halts. Long tasks may poll it themselves through
 * {@link TaskContext#isCancellationRequested()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CancellationToken {

    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * Requests cancellation. Only the first reason is kept.
     *
     * @param why human-readable reason, e.g. the signal received
     */
    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    /**
     * Returns whether cancellation has been requested.
     *
     * @return {@code true} after {@link #cancel(String)}
     */
    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    /**
     * Returns the reason given to the first {@link #cancel(String)} call.
     *
     * @return reason, or {@code null} when not cancelled
     */
    public String getReason() {
        return reason.get();
    }
}
