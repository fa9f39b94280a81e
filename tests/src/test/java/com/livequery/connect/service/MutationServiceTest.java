package com.livequery.connect.service;

import com.livequery.event.ChangeEvent;
import com.livequery.event.ChangeEventFanout;
import com.livequery.event.DeliveryQueue;
import com.livequery.event.Operation;
import com.livequery.exception.QueryExecutionException;
import com.livequery.runtime.DuckDBConnectionManager;
import com.livequery.runtime.QueryExecutor;
import com.livequery.test.TestBase;
import com.livequery.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("MutationService Tests")
public class MutationServiceTest extends TestBase {

    private DuckDBConnectionManager manager;
    private ChangeEventFanout fanout;
    private MutationService mutations;
    private DeliveryQueue queue;

    @BeforeEach
    void setUp() {
        manager = new DuckDBConnectionManager(DuckDBConnectionManager.Configuration.inMemory().withPoolSize(2));
        QueryExecutor executor = new QueryExecutor(manager);
        executor.executeUpdate("CREATE TABLE accounts (id INTEGER PRIMARY KEY, balance INTEGER)");
        executor.executeUpdate("INSERT INTO accounts VALUES (1, 10), (2, 20)");

        fanout = new ChangeEventFanout();
        mutations = new MutationService(executor, fanout);
        queue = fanout.subscribe("accounts");
    }

    @AfterEach
    void tearDown() throws SQLException {
        manager.close();
    }

    @Test
    @DisplayName("Successful mutation publishes the given event")
    void testExplicitEvent() {
        int affected = mutations.execute("UPDATE accounts SET balance = ? WHERE id = ?", List.of(99, 1),
            "accounts", Operation.UPDATE, Map.of("id", 1));

        assertThat(affected).isEqualTo(1);
        assertThat(queue.poll()).isEqualTo(new ChangeEvent("accounts", Operation.UPDATE, Map.of("id", 1)));
    }

    @Test
    @DisplayName("Failed mutation publishes nothing")
    void testFailedMutation() {
        assertThatThrownBy(() -> mutations.execute("INSERT INTO accounts VALUES (1, 0)",
                "accounts", Operation.INSERT, Map.of("id", 1)))
            .isInstanceOf(QueryExecutionException.class);

        assertThat(queue.size()).isZero();
        assertThat(fanout.getPublishedCount()).isZero();
    }

    @Test
    @DisplayName("DML text is analysed with the registered key columns")
    void testAnalysedMutation() {
        mutations.registerKeyColumns("Accounts", List.of("id"));

        mutations.execute("DELETE FROM accounts WHERE id = 2");

        ChangeEvent event = queue.poll();
        assertThat(event.operation()).isEqualTo(Operation.DELETE);
        assertThat(event.key()).containsExactly(entry("id", 2L));
    }

    @Test
    @DisplayName("Without key columns the event carries no key")
    void testAnalysedWithoutKeyColumns() {
        mutations.execute("UPDATE accounts SET balance = 0 WHERE id = 1");

        ChangeEvent event = queue.poll();
        assertThat(event.sourceName()).isEqualTo("accounts");
        assertThat(event.hasKey()).isFalse();
    }

    @Test
    @DisplayName("Unrecognised statement runs without publishing")
    void testUnrecognisedStatement() {
        mutations.execute("CREATE TABLE audit (id INTEGER)");

        assertThat(fanout.getPublishedCount()).isZero();
        assertThat(mutations.analyze("CREATE TABLE x (id INTEGER)")).isEmpty();
    }
}
