package io.github.yok.deploykit.util;

import io.github.yok.deploykit.config.ConfigurationException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads JDBC driver classes named by connection descriptors.
 *
 * <p>
 * A blank class name does nothing so JDBC 4 auto-loading applies. Each class is loaded at most
 * once per JVM.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class JdbcDriverLoader {

    private static final Set<String> LOADED = ConcurrentHashMap.newKeySet();

    /**
     * Prevents instantiation.
     */
    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the driver class when one is named.
     *
     * @param driverClass fully qualified driver class name, or {@code null}/blank
     * @throws ConfigurationException when the class is not on the classpath
     */
    public static void ensureLoaded(String driverClass) {
        if (driverClass == null || driverClass.isBlank()) {
            return;
        }
        if (LOADED.contains(driverClass)) {
            return;
        }
        try {
            Class.forName(driverClass);
            LOADED.add(driverClass);
            log.debug("Loaded JDBC driver {}", driverClass);
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("JDBC driver class not found: " + driverClass, e);
        }
    }
}
