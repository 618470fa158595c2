package io.github.yok.deploykit.config;

import io.github.yok.deploykit.DeployKitException;
import io.github.yok.deploykit.core.RunRecord;
import java.util.Optional;

/**
 * Raised for a bad or missing descriptor, or a dependency that cannot be resolved.
 *
 * <p>
 * Always fatal and always surfaced before any task runs. When raised by the task runner it also
 * carries the finalized {@link RunRecord} of the rejected run, so the adapter can still report a
 * run outcome.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends DeployKitException {

    private static final long serialVersionUID = 1L;

    private final transient RunRecord runRecord;

    /**
     * Creates a configuration error.
     *
     * @param message detail message
     */
    public ConfigurationException(String message) {
        this(message, null, null);
    }

    /**
     * Creates a configuration error with a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public ConfigurationException(String message, Throwable cause) {
        this(message, cause, null);
    }

    /**
     * Creates a configuration error that carries the finalized record of the rejected run.
     *
     * @param message detail message
     * @param cause root cause, may be {@code null}
     * @param runRecord finalized run record, may be {@code null}
     */
    public ConfigurationException(String message, Throwable cause, RunRecord runRecord) {
        super(message, cause);
        this.runRecord = runRecord;
    }

    /**
     * Returns the finalized record of the rejected run, if the runner produced one.
     *
     * @return run record
     */
    public Optional<RunRecord> getRunRecord() {
        return Optional.ofNullable(runRecord);
    }
}
