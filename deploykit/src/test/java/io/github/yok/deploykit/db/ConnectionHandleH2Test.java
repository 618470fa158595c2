package io.github.yok.deploykit.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.deploykit.credential.DelegatingCredentialResolver;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Collections;
import java.util.UUID;
import org.h2.jdbc.JdbcConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionHandleH2Test {

    private ConnectionBroker broker;

    @BeforeEach
    void setup() throws Exception {
        ConnectionDescriptor descriptor = ConnectionDescriptor.builder("h2")
                .url("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .driverClass("org.h2.Driver").retryPolicy(RetryPolicy.noRetry()).build();
        broker = new ConnectionBroker(Collections.singletonList(descriptor),
                (d, password) -> DriverManager.getConnection(d.toJdbcUrl(), "sa", ""),
                DelegatingCredentialResolver.defaults(), Sleeper.THREAD);
        broker.resolve("h2");
        try (ConnectionHandle handle = broker.acquire("h2");
                Statement st = handle.connection().createStatement()) {
            st.execute("CREATE TABLE scores (id INT PRIMARY KEY, score DECIMAL(5,2))");
        }
    }

    @AfterEach
    void tearDown() {
        broker.close();
    }

    private static int count(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM scores")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private static void insert(Connection conn, int id) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.executeUpdate("INSERT INTO scores (id, score) VALUES (" + id + ", 0.5)");
        }
    }

    @Test
    void inTransaction_正常ケース_成功時はコミットされること() throws Exception {
        try (ConnectionHandle handle = broker.acquire("h2")) {
            int inserted = handle.inTransaction(conn -> {
                insert(conn, 1);
                insert(conn, 2);
                return 2;
            });
            assertEquals(2, inserted);
            assertTrue(handle.connection().getAutoCommit());
        }
        try (ConnectionHandle handle = broker.acquire("h2")) {
            assertEquals(2, count(handle.connection()));
        }
    }

    @Test
    void inTransaction_異常ケース_失敗時はロールバックされ例外が伝播すること() throws Exception {
        try (ConnectionHandle handle = broker.acquire("h2")) {
            SQLException ex = assertThrows(SQLException.class, () -> handle.inTransaction(conn -> {
                insert(conn, 1);
                insert(conn, 1);
                return null;
            }));
            assertTrue(ex.getMessage().toUpperCase().contains("PRIMARY KEY")
                    || ex.getSQLState().startsWith("23"));
            assertEquals(0, count(handle.connection()));
        }
    }

    @Test
    void inTransaction_異常ケース_実行時例外でもロールバックされること() throws Exception {
        IllegalStateException boom = new IllegalStateException("boom");
        try (ConnectionHandle handle = broker.acquire("h2")) {
            IllegalStateException ex =
                    assertThrows(IllegalStateException.class, () -> handle.inTransaction(conn -> {
                        insert(conn, 1);
                        throw boom;
                    }));
            assertSame(boom, ex);
            assertEquals(0, count(handle.connection()));
        }
    }

    @Test
    void rollbackAfter_正常ケース_結果を返し常にロールバックされること() throws Exception {
        try (ConnectionHandle handle = broker.acquire("h2")) {
            int seen = handle.rollbackAfter(conn -> {
                insert(conn, 1);
                return count(conn);
            });
            assertEquals(1, seen);
            assertEquals(0, count(handle.connection()));
        }
    }

    @Test
    void unwrap_正常ケース_ガードされた接続自身のみが返され物理接続は取り出せないこと() throws Exception {
        ConnectionHandle handle = broker.acquire("h2");
        Connection guarded = handle.connection();

        assertSame(guarded, guarded.unwrap(Connection.class));
        assertTrue(guarded.isWrapperFor(Connection.class));
        assertFalse(guarded.isWrapperFor(JdbcConnection.class));
        assertThrows(SQLException.class, () -> guarded.unwrap(JdbcConnection.class));
        assertThrows(SQLException.class, () -> guarded.abort(Runnable::run));

        handle.release();

        assertThrows(SQLException.class, () -> guarded.unwrap(Connection.class));
        assertThrows(SQLException.class, () -> guarded.isWrapperFor(Connection.class));
        assertEquals(ConnectionState.CONNECTED, broker.state("h2"));
        try (ConnectionHandle next = broker.acquire("h2")) {
            assertEquals(0, count(next.connection()));
        }
    }

    @Test
    void release_正常ケース_未コミットの変更は返却時に破棄されること() throws Exception {
        ConnectionHandle first = broker.acquire("h2");
        Connection conn = first.connection();
        conn.setAutoCommit(false);
        insert(conn, 1);
        first.release();

        try (ConnectionHandle second = broker.acquire("h2")) {
            assertTrue(second.connection().getAutoCommit());
            assertEquals(0, count(second.connection()));
        }
        assertEquals(ConnectionState.CONNECTED, broker.state("h2"));
    }
}
