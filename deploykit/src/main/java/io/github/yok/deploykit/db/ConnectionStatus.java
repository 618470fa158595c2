package io.github.yok.deploykit.db;

import lombok.Data;

/**
 * Point-in-time view of a brokered connection.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class ConnectionStatus {

    // Connection name
    private final String name;
    // Driver family
    private final DriverKind driverKind;
    // Current lifecycle state
    private final ConnectionState state;
    // Connect attempts made by the latest resolution
    private final int attempts;
    // Message of the latest failure, or null
    private final String lastError;
}
