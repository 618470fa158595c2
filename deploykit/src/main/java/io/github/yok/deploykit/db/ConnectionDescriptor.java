package io.github.yok.deploykit.db;

import io.github.yok.deploykit.config.ConfigurationException;
import java.time.Duration;
import java.util.regex.Pattern;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

/**
 * Named configuration identifying how to reach one backing data store.
 *
 * <p>
 * The set of fields is fixed. Instances are immutable and validated when built: unusable
 * combinations (a tabular-stream descriptor without host, a generic descriptor without URL, a
 * credential given as a literal instead of a reference) fail with {@link ConfigurationException}.
 * The connection state is not part of the descriptor; it is tracked by the
 * {@link ConnectionBroker} that owns it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class ConnectionDescriptor {

    /** Default login timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);

    // scheme:locator, e.g. env:WAREHOUSE_PASSWORD
    private static final Pattern CREDENTIAL_REF = Pattern.compile("^[a-z][a-z0-9+.-]*:.+$");

    private final String name;
    private final DriverKind driverKind;
    private final String host;
    private final Integer port;
    private final String database;
    private final String user;
    private final String credentialRef;
    private final Duration connectTimeout;
    private final RetryPolicy retryPolicy;
    private final String url;
    private final String driverClass;

    private ConnectionDescriptor(Builder b, DriverKind kind, Integer port) {
        this.name = b.name.trim();
        this.driverKind = kind;
        this.host = StringUtils.trimToNull(b.host);
        this.port = port;
        this.database = StringUtils.trimToNull(b.database);
        this.user = StringUtils.trimToNull(b.user);
        this.credentialRef = StringUtils.trimToNull(b.credentialRef);
        this.connectTimeout = b.connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : b.connectTimeout;
        this.retryPolicy = b.retryPolicy == null ? RetryPolicy.defaults() : b.retryPolicy;
        this.url = StringUtils.trimToNull(b.url);
        this.driverClass = StringUtils.trimToNull(b.driverClass);
    }

    /**
     * Starts a descriptor for the given connection name.
     *
     * @param name unique connection name
     * @return builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Returns the JDBC URL used to connect.
     *
     * <p>
     * An explicit URL always wins. Otherwise a tabular-stream URL is assembled from host, port,
     * database and the login timeout.
     * </p>
     *
     * @return JDBC URL
     */
    public String toJdbcUrl() {
        if (url != null) {
            return url;
        }
        StringBuilder sb = new StringBuilder("jdbc:sqlserver://").append(host);
        if (port != null) {
            sb.append(':').append(port);
        }
        if (database != null) {
            sb.append(";databaseName=").append(database);
        }
        sb.append(";loginTimeout=").append(loginTimeoutSeconds());
        return sb.toString();
    }

    /**
     * Returns the login timeout rounded up to whole seconds, at least 1.
     *
     * @return login timeout in seconds
     */
    public int loginTimeoutSeconds() {
        long millis = connectTimeout.toMillis();
        long seconds = (millis + 999) / 1000;
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
    }

    /**
     * Returns the driver class to load explicitly.
     *
     * @return configured class, the kind's default, or {@code null} for JDBC auto-loading
     */
    public String effectiveDriverClass() {
        return driverClass != null ? driverClass : driverKind.getDefaultDriverClass();
    }

    @Override
    public String toString() {
        return "ConnectionDescriptor[name=" + name + ", kind=" + driverKind + "]";
    }

    /**
     * Builder for {@link ConnectionDescriptor}.
     */
    public static final class Builder {

        private final String name;
        private DriverKind driverKind;
        private String host;
        private Integer port;
        private String database;
        private String user;
        private String credentialRef;
        private Duration connectTimeout;
        private RetryPolicy retryPolicy;
        private String url;
        private String driverClass;

        private Builder(String name) {
            this.name = name;
        }

        public Builder driverKind(DriverKind driverKind) {
            this.driverKind = driverKind;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder credentialRef(String credentialRef) {
            this.credentialRef = credentialRef;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder driverClass(String driverClass) {
            this.driverClass = driverClass;
            return this;
        }

        /**
         * Validates the fields and builds the descriptor.
         *
         * @return descriptor
         * @throws ConfigurationException when the combination of fields is unusable
         */
        public ConnectionDescriptor build() {
            if (StringUtils.isBlank(name)) {
                throw new ConfigurationException("Connection name is required.");
            }
            String label = name.trim();
            DriverKind kind = driverKind != null ? driverKind : DriverKind.infer(driverClass, url);
            if (kind == null) {
                throw new ConfigurationException("driver-kind is required for connection '"
                        + label + "' (it could not be inferred from driver-class or url)");
            }
            switch (kind) {
                case TABULAR_STREAM:
                    if (StringUtils.isBlank(url) && StringUtils.isBlank(host)) {
                        throw new ConfigurationException(
                                "host or url is required for connection '" + label + "'");
                    }
                    break;
                case GENERIC_SQL:
                    if (StringUtils.isBlank(url)) {
                        throw new ConfigurationException(
                                "url is required for connection '" + label + "'");
                    }
                    break;
                default:
                    if (StringUtils.isBlank(url) || StringUtils.isBlank(driverClass)) {
                        throw new ConfigurationException("url and driver-class are required for "
                                + "connection '" + label + "' of kind OTHER");
                    }
                    break;
            }
            Integer effectivePort = port != null ? port : kind.getDefaultPort();
            if (effectivePort != null && (effectivePort < 1 || effectivePort > 65535)) {
                throw new ConfigurationException(
                        "port out of range for connection '" + label + "': " + effectivePort);
            }
            if (connectTimeout != null && (connectTimeout.isNegative() || connectTimeout.isZero())) {
                throw new ConfigurationException(
                        "connect-timeout must be positive for connection '" + label + "'");
            }
            if (StringUtils.isNotBlank(credentialRef)
                    && !CREDENTIAL_REF.matcher(credentialRef.trim()).matches()) {
                // Never echo the value: it may be a plaintext secret.
                throw new ConfigurationException("credential-ref of connection '" + label
                        + "' must be a reference such as env:NAME or file:/path");
            }
            return new ConnectionDescriptor(this, kind, effectivePort);
        }
    }
}
