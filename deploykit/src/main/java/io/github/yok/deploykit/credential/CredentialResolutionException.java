package io.github.yok.deploykit.credential;

import io.github.yok.deploykit.DeployKitException;

/**
 * Raised when a credential reference cannot be turned into a secret.
 *
 * @author Yasuharu.Okawauchi
 */
public class CredentialResolutionException extends DeployKitException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a resolution error.
     *
     * @param message detail message; must never contain the secret itself
     */
    public CredentialResolutionException(String message) {
        super(message);
    }

    /**
     * Creates a resolution error with a cause.
     *
     * @param message detail message; must never contain the secret itself
     * @param cause root cause
     */
    public CredentialResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
