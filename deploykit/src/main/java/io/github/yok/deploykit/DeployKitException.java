package io.github.yok.deploykit;

/**
 * Base class of every failure raised by DeployKit.
 *
 * <p>
 * The hierarchy is unchecked. Callers that only care about "something in the deployment run went
 * wrong" can catch this type; the adapter maps the concrete subtypes to the run record and the
 * process exit code.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DeployKitException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates an exception with a message.
     *
     * @param message detail message
     */
    public DeployKitException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and a cause.
     *
     * @param message detail message
     * @param cause root cause
     */
    public DeployKitException(String message, Throwable cause) {
        super(message, cause);
    }
}
