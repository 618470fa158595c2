package io.github.yok.deploykit.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens physical connections for the {@link ConnectionBroker}.
 *
 * <p>
 * Only the broker calls this. Implementations perform a single attempt; retrying is the broker's
 * job.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * Opens one connection.
     *
     * @param descriptor connection descriptor
     * @param password resolved secret, or {@code null} when the descriptor has no credential
     * @return open connection
     * @throws SQLException when the data store refuses or cannot be reached
     */
    Connection open(ConnectionDescriptor descriptor, String password) throws SQLException;
}
