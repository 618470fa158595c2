package io.github.yok.deploykit.config;

import io.github.yok.deploykit.db.DriverKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection descriptors bound from {@code deploykit.broker} in {@code application.yml}.
 *
 * <pre>
 * deploykit:
 *   broker:
 *     connections:
 *       - name: warehouse
 *         driver-kind: tabular-stream
 *         host: mssql.internal
 *         database: analytics
 *         user: deploy
 *         credential-ref: env:WAREHOUSE_PASSWORD
 *         connect-timeout: 15s
 *         retry:
 *           max-attempts: 5
 *           initial-delay: 2s
 * </pre>
 *
 * <p>
 * Unknown keys are rejected at startup. In particular a literal {@code password} key fails the
 * binding: secrets are only ever referenced through {@code credential-ref}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "deploykit.broker", ignoreUnknownFields = false)
@Data
public class ConnectionConfig {

    /**
     * List of connection entries.
     */
    private List<Entry> connections = new ArrayList<>();

    /**
     * One connection descriptor.
     */
    @Data
    public static class Entry {
        // Unique logical name (e.g., "warehouse")
        private String name;
        // Driver family; inferred from driverClass or url when omitted
        private DriverKind driverKind;
        // Server host for tabular-stream connections
        private String host;
        // Server port; the driver family default when omitted
        private Integer port;
        // Database (catalog) name
        private String database;
        // Database user name
        private String user;
        // Secret reference such as env:NAME or file:/run/secrets/db
        private String credentialRef;
        // Login timeout
        private Duration connectTimeout;
        // Explicit JDBC URL; required for generic-sql and other
        private String url;
        // Fully qualified JDBC driver class name
        private String driverClass;
        // Connect retry settings
        private Retry retry;
    }

    /**
     * Retry settings of one connection. Omitted values take the broker defaults.
     */
    @Data
    public static class Retry {
        // Total connect attempts
        private Integer maxAttempts;
        // Delay before the second attempt
        private Duration initialDelay;
        // Growth factor of the delay
        private Double multiplier;
        // Upper bound of a single delay
        private Duration maxDelay;
        // Whether to randomize delays by up to 10%
        private Boolean jitter;
    }
}
