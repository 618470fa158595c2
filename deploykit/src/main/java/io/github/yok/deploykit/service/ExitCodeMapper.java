package io.github.yok.deploykit.service;

import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.config.RunnerConfig;
import io.github.yok.deploykit.core.RunRecord;

/**
 * Maps a finalized run record to the process exit status.
 *
 * <p>
 * A cancelled run maps to the cancelled code whatever its outcome; otherwise the outcome decides.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ExitCodeMapper {

    private final RunnerConfig.ExitCodes codes;

    /**
     * Creates a mapper.
     *
     * @param codes configured codes, the defaults when {@code null}
     * @throws ConfigurationException when failure or partial failure maps to 0, or both map to
     *         the same code
     */
    public ExitCodeMapper(RunnerConfig.ExitCodes codes) {
        this.codes = codes != null ? codes : new RunnerConfig.ExitCodes();
        if (this.codes.getFailure() == 0 || this.codes.getPartialFailure() == 0) {
            throw new ConfigurationException(
                    "deploykit.runner.exit-codes.failure and partial-failure must be non-zero.");
        }
        if (this.codes.getFailure() == this.codes.getPartialFailure()) {
            throw new ConfigurationException("deploykit.runner.exit-codes.failure and "
                    + "partial-failure must differ (both " + this.codes.getFailure() + ").");
        }
    }

    /**
     * Returns the exit code for the record.
     *
     * @param record finalized record, {@code null} when no record could be produced
     * @return exit code
     */
    public int map(RunRecord record) {
        if (record == null) {
            return codes.getFailure();
        }
        if (record.isCancelled()) {
            return codes.getCancelled();
        }
        switch (record.getOutcome()) {
            case SUCCESS:
                return codes.getSuccess();
            case PARTIAL_FAILURE:
                return codes.getPartialFailure();
            default:
                return codes.getFailure();
        }
    }

    public int cancelled() {
        return codes.getCancelled();
    }

    public int failure() {
        return codes.getFailure();
    }
}
