package io.github.yok.deploykit.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports fatal errors: logs them with the stack trace and echoes a concise message to
 * {@code System.err} for the container log.
 *
 * <p>
 * The handler never ends the process; the caller still finalizes the run record and returns the
 * failure exit code. In tests, callers can switch the current thread to throwing an
 * {@link IllegalStateException} instead.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    private static final ThreadLocal<Boolean> THROW_ENABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes {@link #fatal} throw instead of printing, for the current thread.
     */
    public static void throwForCurrentThread() {
        THROW_ENABLED.set(Boolean.TRUE);
    }

    /**
     * Restores normal behavior for the current thread.
     */
    public static void restoreForCurrentThread() {
        THROW_ENABLED.remove();
    }

    /**
     * Logs the message and root cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void fatal(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Logs the message at error level and prints it to {@code System.err}.
     *
     * @param message message to log
     */
    public static void fatal(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(THROW_ENABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
