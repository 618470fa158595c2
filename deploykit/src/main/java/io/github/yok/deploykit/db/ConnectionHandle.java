package io.github.yok.deploykit.db;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Scoped lease of one brokered connection.
 *
 * <p>
 * Obtained from {@link ConnectionBroker#acquire(String)} and meant to be used with
 * try-with-resources so the lease is returned on every exit path. {@link #connection()} hands out
 * a guarded view of the physical connection: closing the view releases the lease, and any call
 * made through it after release fails with {@link SQLException}. The physical connection itself
 * is only ever closed by the broker.
 * </p>
 *
 * <p>
 * {@link #release()} is idempotent. The view unwraps only to itself and refuses
 * {@code abort}, so the physical connection never leaves the broker.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ConnectionHandle implements AutoCloseable {

    private final ConnectionBroker broker;
    private final String name;
    private final Connection guarded;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ConnectionHandle(ConnectionBroker broker, String name, Connection physical) {
        this.broker = broker;
        this.name = name;
        this.guarded = (Connection) Proxy.newProxyInstance(Connection.class.getClassLoader(),
                new Class<?>[] {Connection.class}, new LeaseGuard(physical));
    }

    /**
     * Returns the connection name this lease belongs to.
     *
     * @return connection name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the guarded connection.
     *
     * @return connection valid until the lease is released
     * @throws IllegalStateException when the lease is already released
     */
    public Connection connection() {
        if (released.get()) {
            throw new IllegalStateException("Connection lease '" + name + "' has been released");
        }
        return guarded;
    }

    /**
     * Returns whether the lease has been released.
     *
     * @return {@code true} after {@link #release()}
     */
    public boolean isReleased() {
        return released.get();
    }

    /**
     * Returns the lease to the broker. Calling it again is a no-op.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            broker.release(this);
        }
    }

    @Override
    public void close() {
        release();
    }

    /**
     * Runs the work in a transaction: commits when it returns, rolls back when it throws.
     *
     * @param <T> result type
     * @param work unit of work
     * @return result of the work
     * @throws SQLException on database error, after the rollback
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        Connection conn = connection();
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        T result;
        try {
            result = work.apply(conn);
            conn.commit();
        } catch (SQLException | RuntimeException | Error e) {
            try {
                conn.rollback();
                log.info("[{}] Transaction rolled back: {}", name, e.getMessage());
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            try {
                conn.setAutoCommit(autoCommit);
            } catch (SQLException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
        log.info("[{}] Transaction committed", name);
        conn.setAutoCommit(autoCommit);
        return result;
    }

    /**
     * Runs the work in a transaction that is always rolled back.
     *
     * <p>
     * Useful for dry runs and for checks that must leave no trace.
     * </p>
     *
     * @param <T> result type
     * @param work unit of work
     * @return result of the work
     * @throws SQLException on database error
     */
    public <T> T rollbackAfter(SqlWork<T> work) throws SQLException {
        Connection conn = connection();
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            return work.apply(conn);
        } finally {
            conn.rollback();
            log.info("[{}] Transaction rolled back", name);
            conn.setAutoCommit(autoCommit);
        }
    }

    @Override
    public String toString() {
        return "ConnectionHandle[" + name + (released.get() ? ", released]" : "]");
    }

    /**
     * Forwards calls to the physical connection while the lease is held.
     */
    private final class LeaseGuard implements InvocationHandler {

        private final Connection physical;

        private LeaseGuard(Connection physical) {
            this.physical = physical;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            String methodName = method.getName();
            if (method.getDeclaringClass() == Object.class) {
                switch (methodName) {
                    case "equals":
                        return proxy == args[0];
                    case "hashCode":
                        return System.identityHashCode(proxy);
                    default:
                        return "Leased" + ConnectionHandle.this;
                }
            }
            if ("close".equals(methodName)) {
                release();
                return null;
            }
            if ("isClosed".equals(methodName) && released.get()) {
                return Boolean.TRUE;
            }
            if (released.get()) {
                throw new SQLException("Connection lease '" + name + "' has been released");
            }
            if ("isWrapperFor".equals(methodName)) {
                return ((Class<?>) args[0]).isInstance(proxy);
            }
            if ("unwrap".equals(methodName)) {
                Class<?> iface = (Class<?>) args[0];
                if (iface.isInstance(proxy)) {
                    return proxy;
                }
                throw new SQLException("Connection lease '" + name
                        + "' cannot be unwrapped to " + iface.getName());
            }
            if ("abort".equals(methodName)) {
                throw new SQLException("Connection lease '" + name
                        + "' cannot be aborted; only the broker closes connections");
            }
            try {
                return method.invoke(physical, args);
            } catch (InvocationTargetException e) {
                throw e.getTargetException();
            }
        }
    }
}
