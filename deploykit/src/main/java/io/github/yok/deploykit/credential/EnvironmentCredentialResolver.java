package io.github.yok.deploykit.credential;

import java.util.Objects;
import java.util.function.Function;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves {@code env:NAME} references from the process environment.
 *
 * @author Yasuharu.Okawauchi
 */
public class EnvironmentCredentialResolver implements CredentialResolver {

    /** Reference scheme handled by this resolver. */
    public static final String SCHEME = "env:";

    private final Function<String, String> environment;

    /**
     * Creates a resolver backed by {@link System#getenv(String)}.
     */
    public EnvironmentCredentialResolver() {
        this(System::getenv);
    }

    /**
     * Creates a resolver backed by the given lookup.
     *
     * @param environment variable lookup
     */
    public EnvironmentCredentialResolver(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public boolean supports(String reference) {
        return reference != null && reference.startsWith(SCHEME);
    }

    @Override
    public String resolve(String reference) {
        String name = StringUtils.removeStart(reference, SCHEME).trim();
        if (name.isEmpty()) {
            throw new CredentialResolutionException(
                    "Environment variable name is missing in credential reference: " + reference);
        }
        String value = environment.apply(name);
        if (value == null) {
            throw new CredentialResolutionException("Environment variable is not set: " + name);
        }
        return value;
    }
}
