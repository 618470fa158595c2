package io.github.yok.deploykit.db;

import com.google.common.base.Preconditions;
import io.github.yok.deploykit.config.ConfigurationException;
import io.github.yok.deploykit.credential.CredentialResolutionException;
import io.github.yok.deploykit.credential.CredentialResolver;
import io.github.yok.deploykit.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the lifecycle of a set of named database connections.
 *
 * <p>
 * The broker is the only component that opens or closes physical connections. It resolves
 * credentials by reference, connects with bounded exponential backoff, and lends each connection
 * to at most one holder at a time through {@link ConnectionHandle}. One broker is created per run
 * and closed when the run ends.
 * </p>
 *
 * <p>
 * <strong>Failure policy:</strong>
 * </p>
 * <ul>
 * <li>Transient failures are retried until {@link RetryPolicy#getMaxAttempts()} is reached.</li>
 * <li>Authentication failures and credential-resolution failures fail at once.</li>
 * <li>A descriptor that ended {@link ConnectionState#FAILED} stays failed until
 * {@link #reResolve(String)} is called.</li>
 * </ul>
 *
 * <p>
 * The broker is confined to the thread that drives the run and does no locking of its own.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionBroker implements AutoCloseable {

    // Keyed by lower-cased connection name, in registration order
    private final Map<String, Slot> slots = new LinkedHashMap<>();

    private final ConnectionFactory connectionFactory;
    private final CredentialResolver credentialResolver;
    private final Sleeper sleeper;

    private boolean closed;

    /**
     * Creates a broker over the given descriptors.
     *
     * @param descriptors connection descriptors
     * @param connectionFactory opens physical connections
     * @param credentialResolver resolves credential references
     * @param sleeper waits between connect attempts
     * @throws ConfigurationException on duplicate names or unsupported credential references
     */
    public ConnectionBroker(Collection<ConnectionDescriptor> descriptors,
            ConnectionFactory connectionFactory, CredentialResolver credentialResolver,
            Sleeper sleeper) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.credentialResolver = Objects.requireNonNull(credentialResolver, "credentialResolver");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        for (ConnectionDescriptor descriptor : descriptors) {
            register(descriptor);
        }
    }

    /**
     * Adds a descriptor in state {@link ConnectionState#UNCONNECTED}.
     *
     * @param descriptor connection descriptor
     * @throws ConfigurationException when the name is taken or the credential reference has an
     *         unsupported scheme
     */
    public void register(ConnectionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        checkOpen();
        String key = key(descriptor.getName());
        if (slots.containsKey(key)) {
            throw new ConfigurationException(
                    "Duplicate connection name: " + descriptor.getName());
        }
        String ref = descriptor.getCredentialRef();
        if (ref != null && !credentialResolver.supports(ref)) {
            throw new ConfigurationException("Unsupported credential reference for connection '"
                    + descriptor.getName() + "': " + MaskingLogUtil.maskCredentialRef(ref));
        }
        slots.put(key, new Slot(descriptor));
        log.info("Registered connection: {}", MaskingLogUtil.describe(descriptor));
    }

    /**
     * Returns whether a connection with this name is registered.
     *
     * @param name connection name
     * @return {@code true} when registered
     */
    public boolean contains(String name) {
        return name != null && slots.containsKey(key(name));
    }

    /**
     * Returns the registered connection names in registration order.
     *
     * @return connection names
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Slot slot : slots.values()) {
            names.add(slot.descriptor.getName());
        }
        return names;
    }

    /**
     * Returns the current state of a connection.
     *
     * @param name connection name
     * @return state
     * @throws ConfigurationException when the name is unknown
     */
    public ConnectionState state(String name) {
        return slot(name).state;
    }

    /**
     * Returns a snapshot of a connection.
     *
     * @param name connection name
     * @return status
     * @throws ConfigurationException when the name is unknown
     */
    public ConnectionStatus status(String name) {
        return slot(name).status();
    }

    /**
     * Registers the descriptor when needed, then resolves it.
     *
     * @param descriptor connection descriptor
     * @return status, always {@link ConnectionState#CONNECTED}
     * @throws ConnectionException when the connection cannot be established
     * @throws ConfigurationException when another descriptor already uses the name
     */
    public ConnectionStatus resolve(ConnectionDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        Slot existing = slots.get(key(descriptor.getName()));
        if (existing == null) {
            register(descriptor);
        } else if (existing.descriptor != descriptor) {
            throw new ConfigurationException(
                    "Duplicate connection name: " + descriptor.getName());
        }
        return resolve(descriptor.getName());
    }

    /**
     * Establishes the named connection.
     *
     * <p>
     * A connected descriptor is returned as is. An unconnected one is connected with retries. A
     * failed one is refused; use {@link #reResolve(String)} to try again.
     * </p>
     *
     * @param name connection name
     * @return status, always {@link ConnectionState#CONNECTED}
     * @throws ConnectionException when the connection cannot be established
     * @throws ConfigurationException when the name is unknown
     */
    public ConnectionStatus resolve(String name) {
        checkOpen();
        Slot slot = slot(name);
        switch (slot.state) {
            case CONNECTED:
                return slot.status();
            case FAILED:
                throw new ConnectionException(slot.descriptor.getName(), slot.attempts,
                        "Connection '" + slot.descriptor.getName()
                                + "' has failed; it must be re-resolved explicitly",
                        slot.lastError);
            case CONNECTING:
                throw new IllegalStateException(
                        "Connection '" + slot.descriptor.getName() + "' is already connecting");
            default:
                return connect(slot);
        }
    }

    /**
     * Explicitly retries a failed connection.
     *
     * <p>
     * Moves a {@link ConnectionState#FAILED} descriptor back to
     * {@link ConnectionState#UNCONNECTED} and resolves it again. Other states behave like
     * {@link #resolve(String)}.
     * </p>
     *
     * @param name connection name
     * @return status, always {@link ConnectionState#CONNECTED}
     * @throws ConnectionException when the connection still cannot be established
     */
    public ConnectionStatus reResolve(String name) {
        checkOpen();
        Slot slot = slot(name);
        if (slot.state == ConnectionState.FAILED) {
            log.info("[{}] Re-resolving failed connection", slot.descriptor.getName());
            transition(slot, ConnectionState.UNCONNECTED);
            slot.attempts = 0;
            slot.lastError = null;
        }
        return resolve(name);
    }

    /**
     * Resolves several connections, collecting failures instead of throwing them.
     *
     * @param names connection names
     * @return status per name, in the given order
     * @throws ConfigurationException when a name is unknown
     */
    public Map<String, ConnectionStatus> resolveAll(Collection<String> names) {
        Map<String, ConnectionStatus> result = new LinkedHashMap<>();
        for (String name : names) {
            Slot slot = slot(name);
            if (slot.state == ConnectionState.UNCONNECTED) {
                try {
                    resolve(name);
                } catch (ConnectionException e) {
                    log.error("[{}] {}", name, e.getMessage());
                }
            }
            result.put(slot.descriptor.getName(), slot.status());
        }
        return result;
    }

    /**
     * Leases a connected connection.
     *
     * @param name connection name
     * @return scoped handle, to be closed by the caller
     * @throws ConnectionException when the connection is not connected or turns out broken
     * @throws IllegalStateException when the connection is already leased
     * @throws ConfigurationException when the name is unknown
     */
    public ConnectionHandle acquire(String name) {
        checkOpen();
        Slot slot = slot(name);
        String label = slot.descriptor.getName();
        if (slot.state != ConnectionState.CONNECTED) {
            throw new ConnectionException(label, slot.attempts,
                    "Connection '" + label + "' is not connected (state=" + slot.state + ")",
                    slot.lastError);
        }
        if (slot.lease != null) {
            throw new IllegalStateException("Connection '" + label + "' is already acquired");
        }
        try {
            if (slot.connection.isClosed()) {
                SQLException lost = new SQLException("Physical connection is closed");
                markLost(slot, lost);
                throw new ConnectionException(label, slot.attempts,
                        "Connection '" + label + "' was lost", lost);
            }
        } catch (SQLException e) {
            markLost(slot, e);
            throw new ConnectionException(label, slot.attempts,
                    "Connection '" + label + "' was lost", e);
        }
        ConnectionHandle handle = new ConnectionHandle(this, label, slot.connection);
        slot.lease = handle;
        log.debug("[{}] Connection acquired", label);
        return handle;
    }

    /**
     * Takes a lease back. Called once per handle by {@link ConnectionHandle#release()}.
     *
     * <p>
     * Uncommitted work is rolled back and auto-commit restored. A connection that cannot be reset
     * is considered lost.
     * </p>
     *
     * @param handle released handle
     */
    void release(ConnectionHandle handle) {
        Slot slot = slots.get(key(handle.getName()));
        if (slot == null || slot.lease != handle) {
            return;
        }
        slot.lease = null;
        if (closed || slot.connection == null) {
            return;
        }
        try {
            Connection conn = slot.connection;
            if (conn.isClosed()) {
                markLost(slot, new SQLException("Physical connection is closed"));
                return;
            }
            if (!conn.getAutoCommit()) {
                conn.rollback();
                conn.setAutoCommit(true);
            }
            log.debug("[{}] Connection released", handle.getName());
        } catch (SQLException e) {
            log.warn("[{}] Failed to reset connection on release: {}", handle.getName(),
                    e.getMessage());
            markLost(slot, e);
        }
    }

    /**
     * Closes every physical connection. The broker cannot be used afterwards.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Slot slot : slots.values()) {
            String label = slot.descriptor.getName();
            if (slot.lease != null) {
                log.warn("[{}] Connection still acquired at broker shutdown", label);
                slot.lease = null;
            }
            closePhysical(slot);
        }
        log.info("Connection broker closed ({} connection(s))", slots.size());
    }

    private ConnectionStatus connect(Slot slot) {
        ConnectionDescriptor descriptor = slot.descriptor;
        String label = descriptor.getName();
        transition(slot, ConnectionState.CONNECTING);
        slot.attempts = 0;

        String password;
        try {
            password = descriptor.getCredentialRef() == null ? null
                    : credentialResolver.resolve(descriptor.getCredentialRef());
        } catch (CredentialResolutionException e) {
            fail(slot, e);
            throw new ConnectionException(label, 0,
                    "Credential resolution failed for connection '" + label + "'", e);
        }

        RetryPolicy policy = descriptor.getRetryPolicy();
        Throwable last = null;
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            if (attempt > 1) {
                Duration delay = policy.delayBeforeAttempt(attempt);
                log.info("[{}] Retrying in {} ms (attempt {}/{})", label, delay.toMillis(),
                        attempt, policy.getMaxAttempts());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    fail(slot, e);
                    throw new ConnectionException(label, slot.attempts,
                            "Interrupted while waiting to reconnect '" + label + "'", e);
                }
            }
            slot.attempts = attempt;
            try {
                Connection conn = connectionFactory.open(descriptor, password);
                Preconditions.checkState(conn != null, "ConnectionFactory returned null");
                slot.connection = conn;
                slot.lastError = null;
                transition(slot, ConnectionState.CONNECTED);
                log.info("[{}] Connected after {} attempt(s)", label, attempt);
                return slot.status();
            } catch (SQLException e) {
                last = e;
                if (FailureClassifier.isAuthenticationFailure(e)) {
                    fail(slot, e);
                    throw new ConnectionException(label, attempt,
                            "Authentication failed for connection '" + label + "'", e);
                }
                log.warn("[{}] Connect attempt {}/{} failed: {}", label, attempt,
                        policy.getMaxAttempts(), e.getMessage());
            } catch (RuntimeException e) {
                // Misconfiguration such as a missing driver class; retrying cannot help
                fail(slot, e);
                throw new ConnectionException(label, attempt,
                        "Connection '" + label + "' could not be opened: " + e.getMessage(), e);
            }
        }
        fail(slot, last);
        throw new ConnectionException(label, slot.attempts, "Could not connect '" + label
                + "' after " + slot.attempts + " attempt(s)", last);
    }

    private void fail(Slot slot, Throwable cause) {
        slot.lastError = cause;
        transition(slot, ConnectionState.FAILED);
    }

    private void markLost(Slot slot, Throwable cause) {
        log.warn("[{}] Connection lost: {}", slot.descriptor.getName(),
                cause == null ? "unknown" : cause.getMessage());
        closePhysical(slot);
        if (slot.state == ConnectionState.CONNECTED) {
            fail(slot, cause);
        }
    }

    private void closePhysical(Slot slot) {
        Connection conn = slot.connection;
        slot.connection = null;
        if (conn == null) {
            return;
        }
        try {
            conn.close();
            log.debug("[{}] Physical connection closed", slot.descriptor.getName());
        } catch (SQLException e) {
            log.warn("[{}] Failed to close connection: {}", slot.descriptor.getName(),
                    e.getMessage());
        }
    }

    private void transition(Slot slot, ConnectionState next) {
        Preconditions.checkState(slot.state.canTransitionTo(next),
                "Illegal connection state transition for '%s': %s -> %s",
                slot.descriptor.getName(), slot.state, next);
        log.debug("[{}] {} -> {}", slot.descriptor.getName(), slot.state, next);
        slot.state = next;
    }

    private Slot slot(String name) {
        Slot slot = name == null ? null : slots.get(key(name));
        if (slot == null) {
            throw new ConfigurationException("Unknown connection: " + name);
        }
        return slot;
    }

    private void checkOpen() {
        Preconditions.checkState(!closed, "Connection broker is closed");
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Mutable per-connection bookkeeping.
     */
    private static final class Slot {

        private final ConnectionDescriptor descriptor;
        private ConnectionState state = ConnectionState.UNCONNECTED;
        private Connection connection;
        private ConnectionHandle lease;
        private int attempts;
        private Throwable lastError;

        private Slot(ConnectionDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        private ConnectionStatus status() {
            return new ConnectionStatus(descriptor.getName(), descriptor.getDriverKind(), state,
                    attempts, lastError == null ? null : lastError.getMessage());
        }
    }
}
