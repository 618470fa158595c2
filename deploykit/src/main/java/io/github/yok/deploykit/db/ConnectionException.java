package io.github.yok.deploykit.db;

import io.github.yok.deploykit.DeployKitException;

/**
 * Raised when a connection cannot be established or acquired.
 *
 * <p>
 * Carries the descriptor name and the number of connect attempts made. The cause is the last
 * underlying failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConnectionException extends DeployKitException {

    private static final long serialVersionUID = 1L;

    private final String descriptorName;
    private final int attempts;

    /**
     * Creates a connection error.
     *
     * @param descriptorName name of the connection descriptor
     * @param attempts number of connect attempts made (0 when none was made)
     * @param message detail message
     * @param cause last underlying failure, may be {@code null}
     */
    public ConnectionException(String descriptorName, int attempts, String message,
            Throwable cause) {
        super(message, cause);
        this.descriptorName = descriptorName;
        this.attempts = attempts;
    }

    /**
     * Creates a connection error that involved no connect attempt.
     *
     * @param descriptorName name of the connection descriptor
     * @param message detail message
     */
    public ConnectionException(String descriptorName, String message) {
        this(descriptorName, 0, message, null);
    }

    public String getDescriptorName() {
        return descriptorName;
    }

    public int getAttempts() {
        return attempts;
    }
}
