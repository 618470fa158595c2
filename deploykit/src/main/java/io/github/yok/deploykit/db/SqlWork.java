package io.github.yok.deploykit.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of JDBC work run inside a transaction scope of a {@link ConnectionHandle}.
 *
 * @param <T> result type
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface SqlWork<T> {

    /**
     * Runs the work.
     *
     * @param connection leased connection
     * @return result
     * @throws SQLException on database error
     */
    T apply(Connection connection) throws SQLException;
}
