package io.github.yok.deploykit.db;

/**
 * Lifecycle state of a brokered connection.
 *
 * <p>
 * Allowed transitions:
 * </p>
 * <ul>
 * <li>{@code UNCONNECTED → CONNECTING}</li>
 * <li>{@code CONNECTING → CONNECTED | FAILED}</li>
 * <li>{@code CONNECTED → FAILED} when a leased connection is found broken</li>
 * <li>{@code FAILED → UNCONNECTED} only through an explicit re-resolution</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public enum ConnectionState {

    UNCONNECTED, CONNECTING, CONNECTED, FAILED;

    /**
     * Returns whether the transition to {@code next} is allowed.
     *
     * @param next target state
     * @return {@code true} when allowed
     */
    public boolean canTransitionTo(ConnectionState next) {
        switch (this) {
            case UNCONNECTED:
                return next == CONNECTING;
            case CONNECTING:
                return next == CONNECTED || next == FAILED;
            case CONNECTED:
                return next == FAILED;
            case FAILED:
                return next == UNCONNECTED;
            default:
                return false;
        }
    }
}
