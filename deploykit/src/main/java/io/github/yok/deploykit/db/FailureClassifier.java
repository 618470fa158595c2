package io.github.yok.deploykit.db;

import java.sql.SQLException;
import java.sql.SQLInvalidAuthorizationSpecException;
import java.util.HashSet;
import java.util.Set;

/**
 * Tells authentication failures, which are never retried, apart from everything else.
 *
 * <p>
 * A failure counts as an authentication failure when anything in its cause or
 * {@link SQLException#getNextException() next-exception} chain is a
 * {@link SQLInvalidAuthorizationSpecException}, carries an SQLState of class {@code 28} (invalid
 * authorization specification), or is SQL Server's "login failed" error 18456.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class FailureClassifier {

    /** SQL Server "Login failed for user" error number. */
    static final int SQLSERVER_LOGIN_FAILED = 18456;

    private FailureClassifier() {}

    /**
     * Returns whether the failure is an authentication failure.
     *
     * @param failure failure raised while connecting
     * @return {@code true} for authentication failures
     */
    public static boolean isAuthenticationFailure(Throwable failure) {
        return isAuthenticationFailure(failure, new HashSet<>());
    }

    // One visited set covers both chains, so cycles through either link terminate
    private static boolean isAuthenticationFailure(Throwable failure, Set<Throwable> seen) {
        Throwable current = failure;
        while (current != null && seen.add(current)) {
            if (current instanceof SQLException) {
                SQLException sql = (SQLException) current;
                if (isAuthentication(sql)) {
                    return true;
                }
                if (isAuthenticationFailure(sql.getNextException(), seen)) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isAuthentication(SQLException sql) {
        if (sql instanceof SQLInvalidAuthorizationSpecException) {
            return true;
        }
        String state = sql.getSQLState();
        if (state != null && state.startsWith("28")) {
            return true;
        }
        return sql.getErrorCode() == SQLSERVER_LOGIN_FAILED;
    }
}
