package com.livequery.runtime;

import com.livequery.test.TestBase;
import com.livequery.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the DuckDB connection pool.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("Connection Pool Tests")
public class ConnectionPoolTest extends TestBase {

    private DuckDBConnectionManager manager;

    @BeforeEach
    void setup() {
        manager = new DuckDBConnectionManager(
            DuckDBConnectionManager.Configuration.inMemory()
                .withPoolSize(3)
        );
    }

    @AfterEach
    void teardown() throws SQLException {
        if (manager != null && !manager.isClosed()) {
            manager.close();
        }
    }

    @Nested
    @DisplayName("Auto-Release Tests")
    class AutoReleaseTests {

        @Test
        @DisplayName("Connection auto-released with try-with-resources")
        void testPooledConnectionAutoRelease() throws SQLException {
            try (PooledConnection conn = manager.borrowConnection()) {
                assertThat(conn.get()).isNotNull();
                assertThat(conn.get().isClosed()).isFalse();
            }

            for (int i = 0; i < 3; i++) {
                try (PooledConnection conn = manager.borrowConnection()) {
                    assertThat(conn).isNotNull();
                }
            }
        }

        @Test
        @DisplayName("Connection not returned twice")
        void testConnectionNotReturnedTwice() throws SQLException {
            PooledConnection conn = manager.borrowConnection();

            conn.close();
            conn.close();

            assertThat(conn.isReleased()).isTrue();
        }

        @Test
        @DisplayName("Cannot use connection after release")
        void testCannotUseReleasedConnection() throws SQLException {
            PooledConnection conn = manager.borrowConnection();
            conn.close();

            assertThatThrownBy(conn::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already released");
        }

        @Test
        @DisplayName("Closed connection is replaced on release")
        void testClosedConnectionReplaced() throws SQLException {
            try (PooledConnection conn = manager.borrowConnection()) {
                conn.get().close();
            }

            for (int i = 0; i < 3; i++) {
                try (PooledConnection conn = manager.borrowConnection()) {
                    assertThat(conn.get().isClosed()).isFalse();
                }
            }
        }
    }

    @Test
    @DisplayName("Pooled connections share one database")
    void testConnectionsShareDatabase() throws SQLException {
        try (PooledConnection writer = manager.borrowConnection();
             Statement stmt = writer.get().createStatement()) {
            stmt.execute("CREATE TABLE shared (id INTEGER)");
            stmt.execute("INSERT INTO shared VALUES (1), (2)");
        }

        try (PooledConnection a = manager.borrowConnection();
             PooledConnection b = manager.borrowConnection();
             Statement stmt = b.get().createStatement();
             ResultSet rs = stmt.executeQuery("SELECT count(*) FROM shared")) {
            assertThat(a.get()).isNotSameAs(b.get());
            assertThat(rs.next()).isTrue();
            assertThat(rs.getLong(1)).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("Borrowing from a closed manager fails")
    void testClosedManager() throws SQLException {
        manager.close();

        assertThat(manager.isClosed()).isTrue();
        assertThatThrownBy(() -> manager.borrowConnection())
            .isInstanceOf(SQLException.class)
            .hasMessageContaining("closed");
    }

    @Test
    @DisplayName("Pool size is honoured")
    void testPoolSize() {
        assertThat(manager.getPoolSize()).isEqualTo(3);
        assertThat(manager.getJdbcUrl()).isEqualTo("jdbc:duckdb:");
    }
}
