package io.github.yok.deploykit.credential;

/**
 * Turns a credential reference into the secret it points to.
 *
 * <p>
 * A reference has the form {@code scheme:locator}, for example {@code env:WAREHOUSE_PASSWORD} or
 * {@code file:/secrets/warehouse/password}. Secrets are never part of a connection descriptor;
 * only references are.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface CredentialResolver {

    /**
     * Returns whether this resolver understands the given reference.
     *
     * @param reference credential reference
     * @return {@code true} when {@link #resolve(String)} can be called with it
     */
    boolean supports(String reference);

    /**
     * Resolves the reference.
     *
     * @param reference credential reference
     * @return the secret value
     * @throws CredentialResolutionException when the secret is missing or unreadable
     */
    String resolve(String reference);
}
