package io.github.yok.deploykit.db;

import java.util.Locale;

/**
 * Family of driver used to reach a backing data store.
 *
 * <ul>
 * <li>{@link #TABULAR_STREAM}: SQL Server and other servers speaking the tabular data stream (TDS)
 * protocol. The JDBC URL can be built from host, port and database.</li>
 * <li>{@link #GENERIC_SQL}: any other JDBC data source reachable through an explicit URL.</li>
 * <li>{@link #OTHER}: a driver DeployKit knows nothing about; both URL and driver class must be
 * configured.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum DriverKind {

    TABULAR_STREAM("com.microsoft.sqlserver.jdbc.SQLServerDriver", 1433),

    GENERIC_SQL(null, null),

    OTHER(null, null);

    private final String defaultDriverClass;
    private final Integer defaultPort;

    DriverKind(String defaultDriverClass, Integer defaultPort) {
        this.defaultDriverClass = defaultDriverClass;
        this.defaultPort = defaultPort;
    }

    /**
     * Returns the driver class used when none is configured.
     *
     * @return driver class name, or {@code null} when JDBC auto-loading applies
     */
    public String getDefaultDriverClass() {
        return defaultDriverClass;
    }

    /**
     * Returns the port used when none is configured.
     *
     * @return default port, or {@code null} when the kind has none
     */
    public Integer getDefaultPort() {
        return defaultPort;
    }

    /**
     * Infers the driver kind from a driver class name first and a JDBC URL second.
     *
     * @param driverClass configured driver class, may be {@code null}
     * @param url configured JDBC URL, may be {@code null}
     * @return inferred kind, or {@code null} when neither value is conclusive
     */
    public static DriverKind infer(String driverClass, String url) {
        DriverKind fromDriver = fromDriverClass(driverClass);
        if (fromDriver != null) {
            return fromDriver;
        }
        return fromUrl(url);
    }

    private static DriverKind fromDriverClass(String driverClass) {
        String normalized = normalizeLower(driverClass);
        if (normalized == null) {
            return null;
        }
        if ("com.microsoft.sqlserver.jdbc.sqlserverdriver".equals(normalized)
                || "net.sourceforge.jtds.jdbc.driver".equals(normalized)) {
            return TABULAR_STREAM;
        }
        return null;
    }

    private static DriverKind fromUrl(String url) {
        String normalized = normalizeLower(url);
        if (normalized == null) {
            return null;
        }
        if (normalized.startsWith("jdbc:sqlserver:")
                || normalized.startsWith("jdbc:jtds:sqlserver:")
                || normalized.startsWith("jdbc:jtds:sybase:")) {
            return TABULAR_STREAM;
        }
        if (normalized.startsWith("jdbc:")) {
            return GENERIC_SQL;
        }
        return null;
    }

    private static String normalizeLower(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
