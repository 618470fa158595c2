package io.github.yok.deploykit.db;

import io.github.yok.deploykit.util.JdbcDriverLoader;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * {@link ConnectionFactory} backed by {@link DriverManager}.
 *
 * <p>
 * Loads the descriptor's driver class when one is known, then connects with the descriptor's
 * user, the resolved password and a {@code loginTimeout} property.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class JdbcConnectionFactory implements ConnectionFactory {

    @Override
    public Connection open(ConnectionDescriptor descriptor, String password) throws SQLException {
        JdbcDriverLoader.ensureLoaded(descriptor.effectiveDriverClass());
        return DriverManager.getConnection(descriptor.toJdbcUrl(),
                connectionProperties(descriptor, password));
    }

    /**
     * Builds the driver properties for a descriptor.
     *
     * @param descriptor connection descriptor
     * @param password resolved secret, may be {@code null}
     * @return driver properties
     */
    Properties connectionProperties(ConnectionDescriptor descriptor, String password) {
        Properties props = new Properties();
        if (descriptor.getUser() != null) {
            props.setProperty("user", descriptor.getUser());
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        props.setProperty("loginTimeout", String.valueOf(descriptor.loginTimeoutSeconds()));
        return props;
    }
}
