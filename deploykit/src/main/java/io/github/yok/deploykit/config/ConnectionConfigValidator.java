package io.github.yok.deploykit.config;

import io.github.yok.deploykit.db.ConnectionDescriptor;
import io.github.yok.deploykit.db.RetryPolicy;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates the bound connection entries and converts them into descriptors.
 *
 * <p>
 * Blank values are treated as absent, retry settings left out take the {@link RetryPolicy}
 * defaults, and entries without a name or with a name used twice (ignoring case) are rejected
 * before any descriptor is built. The descriptor builder then checks the remaining parameters.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConnectionConfigValidator {

    /**
     * Validates the configuration and builds one descriptor per entry.
     *
     * @param config bound configuration
     * @return descriptors in declared order
     * @throws ConfigurationException on the first invalid entry
     */
    public List<ConnectionDescriptor> toDescriptors(ConnectionConfig config) {
        if (config == null || config.getConnections() == null) {
            return new ArrayList<>();
        }
        List<ConnectionDescriptor> descriptors = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (ConnectionConfig.Entry entry : config.getConnections()) {
            if (entry == null) {
                throw new ConfigurationException(
                        "deploykit.broker.connections[" + index + "] is empty.");
            }
            String name = StringUtils.trimToNull(entry.getName());
            if (name == null) {
                throw new ConfigurationException(
                        "deploykit.broker.connections[" + index + "].name is required.");
            }
            if (!names.add(name.toLowerCase(Locale.ROOT))) {
                throw new ConfigurationException("Duplicate connection name: " + name);
            }
            descriptors.add(toDescriptor(name, entry));
            index++;
        }
        return descriptors;
    }

    /**
     * Builds the descriptor of one entry.
     *
     * @param name trimmed name
     * @param entry bound entry
     * @return descriptor
     */
    private ConnectionDescriptor toDescriptor(String name, ConnectionConfig.Entry entry) {
        ConnectionDescriptor.Builder builder = ConnectionDescriptor.builder(name)
                .driverKind(entry.getDriverKind())
                .host(StringUtils.trimToNull(entry.getHost()))
                .port(entry.getPort())
                .database(StringUtils.trimToNull(entry.getDatabase()))
                .user(StringUtils.trimToNull(entry.getUser()))
                .credentialRef(StringUtils.trimToNull(entry.getCredentialRef()))
                .url(StringUtils.trimToNull(entry.getUrl()))
                .driverClass(StringUtils.trimToNull(entry.getDriverClass()))
                .retryPolicy(toRetryPolicy(name, entry.getRetry()));
        if (entry.getConnectTimeout() != null) {
            builder.connectTimeout(entry.getConnectTimeout());
        }
        return builder.build();
    }

    /**
     * Fills defaults into the retry settings.
     *
     * @param name connection name, for messages
     * @param retry bound settings, may be {@code null}
     * @return retry policy
     */
    private RetryPolicy toRetryPolicy(String name, ConnectionConfig.Retry retry) {
        if (retry == null) {
            return RetryPolicy.defaults();
        }
        try {
            return new RetryPolicy(
                    retry.getMaxAttempts() != null ? retry.getMaxAttempts()
                            : RetryPolicy.DEFAULT_MAX_ATTEMPTS,
                    retry.getInitialDelay() != null ? retry.getInitialDelay()
                            : RetryPolicy.DEFAULT_INITIAL_DELAY,
                    retry.getMultiplier() != null ? retry.getMultiplier()
                            : RetryPolicy.DEFAULT_MULTIPLIER,
                    retry.getMaxDelay() != null ? retry.getMaxDelay()
                            : RetryPolicy.DEFAULT_MAX_DELAY,
                    retry.getJitter() == null || retry.getJitter());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "Invalid retry settings for connection '" + name + "': " + e.getMessage(), e);
        }
    }
}
