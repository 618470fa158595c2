package io.github.yok.deploykit.credential;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Dispatches a credential reference to the first resolver that supports its scheme.
 *
 * @author Yasuharu.Okawauchi
 */
public class DelegatingCredentialResolver implements CredentialResolver {

    private final List<CredentialResolver> delegates;

    /**
     * Creates a resolver over the given delegates, consulted in order.
     *
     * @param delegates resolvers
     */
    public DelegatingCredentialResolver(List<CredentialResolver> delegates) {
        this.delegates = ImmutableList.copyOf(delegates);
    }

    /**
     * Creates the default chain: environment variables, then secret files.
     *
     * @return default resolver
     */
    public static DelegatingCredentialResolver defaults() {
        return new DelegatingCredentialResolver(
                List.of(new EnvironmentCredentialResolver(), new FileCredentialResolver()));
    }

    @Override
    public boolean supports(String reference) {
        return delegates.stream().anyMatch(d -> d.supports(reference));
    }

    @Override
    public String resolve(String reference) {
        for (CredentialResolver delegate : delegates) {
            if (delegate.supports(reference)) {
                return delegate.resolve(reference);
            }
        }
        throw new CredentialResolutionException(
                "Unsupported credential reference scheme: " + schemeOf(reference));
    }

    /**
     * Returns the scheme part of a reference for diagnostics, never the locator.
     *
     * @param reference credential reference
     * @return scheme including the colon, or {@code <none>}
     */
    static String schemeOf(String reference) {
        if (reference == null) {
            return "<none>";
        }
        int idx = reference.indexOf(':');
        return idx < 0 ? "<none>" : reference.substring(0, idx + 1);
    }
}
