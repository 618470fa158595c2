/**
 * Connection broker package.
 *
 * <p>
 * {@link io.github.yok.deploykit.db.ConnectionBroker} is the only component that opens and closes
 * database connections. Other code leases them through
 * {@link io.github.yok.deploykit.db.ConnectionHandle}.
 * </p>
 */
package io.github.yok.deploykit.db;
