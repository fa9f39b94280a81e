package com.livequery.connect.service;

import com.livequery.connect.server.LiveQueryServer;
import com.livequery.connect.server.ServerConfig;
import com.livequery.event.ChangeEvent;
import com.livequery.event.Operation;
import com.livequery.exception.QueryExecutionException;
import com.livequery.execution.SubscriptionOutcome;
import com.livequery.execution.SubscriptionState;
import com.livequery.test.TestBase;
import com.livequery.test.TestCategories;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end subscription scenarios against an in-memory DuckDB database.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("SubscriptionService End-to-End Tests")
public class SubscriptionServiceEndToEndTest extends TestBase {

    private static final String RICH_ACCOUNTS = "SELECT * FROM accounts WHERE balance > 100";

    private LiveQueryServer server;
    private SubscriptionService service;
    private MutationService mutations;
    private Context.CancellableContext cancellation;

    @BeforeEach
    void setUp() {
        server = new LiveQueryServer(ServerConfig.builder().poolSize(4).build());
        server.start();
        service = server.getSubscriptionService();
        mutations = server.getMutationService();
        cancellation = Context.current().withCancellation();

        server.getQueryExecutor().executeUpdate(
            "CREATE TABLE accounts (id INTEGER PRIMARY KEY, owner VARCHAR, balance INTEGER)");
        server.getQueryExecutor().executeUpdate(
            "INSERT INTO accounts VALUES (1, 'ann', 50), (2, 'bob', 150), (3, 'cy', 250)");
    }

    @AfterEach
    void tearDown() {
        cancellation.cancel(null);
        server.shutdown();
    }

    private SubscriptionHandle subscribeRichAccounts() {
        return service.subscribe(RICH_ACCOUNTS, "accounts", "alice", "main", cancellation);
    }

    private static int id(List<Object> row) {
        return ((Number) row.get(0)).intValue();
    }

    private static int balance(List<Object> row) {
        return ((Number) row.get(2)).intValue();
    }

    private List<List<Object>> take(SubscriptionHandle handle, int count) {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            assertThat(service.next(handle)).isTrue();
            rows.add(service.currentRow(handle));
        }
        return rows;
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }

    @Nested
    @DisplayName("Accounts Scenario")
    class AccountsScenario {

        @Test
        @DisplayName("Initial batch returns rows present at subscribe time")
        void testInitialBatch() {
            SubscriptionHandle handle = subscribeRichAccounts();

            assertThat(handle.columns()).containsExactly("id", "owner", "balance");
            assertThat(take(handle, 2)).extracting(SubscriptionServiceEndToEndTest::id)
                .containsExactlyInAnyOrder(2, 3);
            assertThat(handle.getState()).isEqualTo(SubscriptionState.SERVING);
        }

        @Test
        @DisplayName("Keyed update that still matches yields the refreshed row")
        void testKeyedUpdateStillMatching() {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            logStep("When: account 3 is updated and an Update {id: 3} is published");
            int affected = mutations.execute("UPDATE accounts SET balance = 300 WHERE id = 3",
                "accounts", Operation.UPDATE, Map.of("id", 3));
            assertThat(affected).isEqualTo(1);

            logStep("Then: the refresh contains only account 3 with its new balance");
            List<Object> row = take(handle, 1).get(0);
            assertThat(id(row)).isEqualTo(3);
            assertThat(balance(row)).isEqualTo(300);
            assertThat(handle.getRefreshCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Keyed update that no longer matches emits nothing and keeps waiting")
        void testKeyedUpdateNoLongerMatching() throws Exception {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            CompletableFuture<Boolean> next = CompletableFuture.supplyAsync(() -> service.next(handle));

            logStep("When: account 3 drops below the threshold");
            mutations.execute("UPDATE accounts SET balance = 10 WHERE id = 3",
                "accounts", Operation.UPDATE, Map.of("id", 3));

            logStep("Then: the refresh is empty and the subscription returns to WAITING");
            awaitCondition(() -> handle.getRefreshCount() == 1
                && handle.getState() == SubscriptionState.WAITING);
            assertThat(next).isNotDone();

            logStep("When: a new rich account is inserted");
            mutations.execute("INSERT INTO accounts VALUES (4, 'dee', 900)",
                "accounts", Operation.INSERT, Map.of("id", 4));

            assertThat(next.get(5, TimeUnit.SECONDS)).isTrue();
            assertThat(id(service.currentRow(handle))).isEqualTo(4);
        }

        @Test
        @DisplayName("Event without key re-runs the whole query")
        void testUnkeyedRefresh() {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            mutations.execute("UPDATE accounts SET balance = balance + 100",
                "accounts", Operation.UPDATE, Map.of());

            assertThat(take(handle, 3)).extracting(SubscriptionServiceEndToEndTest::id)
                .containsExactlyInAnyOrder(1, 2, 3);
        }

        @Test
        @DisplayName("Mutation derived from DML text carries the registered key")
        void testAnalyzedMutation() {
            mutations.registerKeyColumns("accounts", List.of("id"));
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            mutations.execute("UPDATE accounts SET balance = 777 WHERE id = 2");

            List<Object> row = take(handle, 1).get(0);
            assertThat(id(row)).isEqualTo(2);
            assertThat(balance(row)).isEqualTo(777);
        }

        @Test
        @DisplayName("Mutation that changes no rows publishes nothing")
        void testNoOpMutation() {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            mutations.execute("UPDATE accounts SET balance = 1 WHERE id = 99",
                "accounts", Operation.UPDATE, Map.of("id", 99));

            assertThat(server.getFanout().getPublishedCount()).isZero();
            assertThat(handle.getExecution().getSubscription().getDeliveryQueue().size()).isZero();
        }

        @Test
        @DisplayName("Partition notification from the change feed refreshes the subscription")
        void testChangeFeedPath() {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            server.getQueryExecutor().executeUpdate("UPDATE accounts SET balance = 400 WHERE id = 2");
            int partitions = server.getChangeFeed().emit(
                new ChangeEvent("accounts", Operation.UPDATE, Map.of("id", 2)),
                server.getPartitionResolver());

            assertThat(partitions).isEqualTo(1);
            List<Object> row = take(handle, 1).get(0);
            assertThat(id(row)).isEqualTo(2);
            assertThat(balance(row)).isEqualTo(400);
        }

        @Test
        @DisplayName("Subscriptions on other tables are not woken")
        void testOtherTableIgnored() {
            server.getQueryExecutor().executeUpdate("CREATE TABLE orders (id INTEGER)");
            SubscriptionHandle handle = subscribeRichAccounts();

            server.getQueryExecutor().executeUpdate("INSERT INTO orders VALUES (1)");
            server.getFanout().publish("orders", Operation.INSERT, Map.of("id", 1));

            assertThat(handle.getExecution().getSubscription().getDeliveryQueue().size()).isZero();
        }

        @Test
        @DisplayName("Keyed change to an aggregate subscription re-runs the aggregate")
        void testKeyedChangeOnAggregate() {
            SubscriptionHandle handle = service.subscribe(
                "SELECT count(*) AS n FROM accounts WHERE balance > 100", "accounts", "alice", "main", cancellation);
            assertThat(((Number) take(handle, 1).get(0).get(0)).longValue()).isEqualTo(2);

            mutations.execute("UPDATE accounts SET balance = 500 WHERE id = 1",
                "accounts", Operation.UPDATE, Map.of("id", 1));

            assertThat(((Number) take(handle, 1).get(0).get(0)).longValue()).isEqualTo(3);
            assertThat(handle.getOutcome()).isEqualTo(SubscriptionOutcome.RUNNING);
        }

        @Test
        @DisplayName("Keyed change to a projection without the key re-runs the projection")
        void testKeyedChangeOnProjectionWithoutKey() {
            SubscriptionHandle handle = service.subscribe(
                "SELECT owner, balance FROM accounts WHERE balance > 100", "accounts", "alice", "main", cancellation);
            assertThat(handle.columns()).containsExactly("owner", "balance");
            take(handle, 2);

            mutations.execute("UPDATE accounts SET balance = 300 WHERE id = 3",
                "accounts", Operation.UPDATE, Map.of("id", 3));

            assertThat(take(handle, 2)).extracting(row -> ((Number) row.get(1)).intValue())
                .containsExactlyInAnyOrder(150, 300);
            assertThat(handle.getOutcome()).isEqualTo(SubscriptionOutcome.RUNNING);
        }

        @Test
        @DisplayName("Statement ending in a line comment still refreshes by key")
        void testTrailingCommentKeyedRefresh() {
            SubscriptionHandle handle = service.subscribe(
                RICH_ACCOUNTS + " -- rich", "accounts", "alice", "main", cancellation);
            take(handle, 2);

            mutations.execute("UPDATE accounts SET balance = 300 WHERE id = 3",
                "accounts", Operation.UPDATE, Map.of("id", 3));

            List<Object> row = take(handle, 1).get(0);
            assertThat(id(row)).isEqualTo(3);
            assertThat(balance(row)).isEqualTo(300);
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("Cancellation while WAITING returns promptly and releases the queue")
        void testCancellation() throws Exception {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            CompletableFuture<Boolean> next = CompletableFuture.supplyAsync(() -> service.next(handle));
            awaitCondition(() -> handle.getState() == SubscriptionState.WAITING);

            cancellation.cancel(null);

            assertThat(next.get(5, TimeUnit.SECONDS)).isFalse();
            assertThat(handle.getOutcome()).isEqualTo(SubscriptionOutcome.CANCELLED);
            assertThat(service.getActiveCount()).isZero();
            assertThat(server.getFanout().queueCount("accounts")).isZero();
        }

        @Test
        @DisplayName("unsubscribeById ends the owner's stream")
        void testUnsubscribeById() throws Exception {
            SubscriptionHandle handle = subscribeRichAccounts();
            take(handle, 2);

            assertThat(service.unsubscribeById(handle.getId())).isTrue();
            assertThat(service.unsubscribeById(handle.getId())).isFalse();

            assertThat(CompletableFuture.supplyAsync(() -> service.next(handle)).get(5, TimeUnit.SECONDS)).isFalse();
            assertThat(handle.getOutcome()).isEqualTo(SubscriptionOutcome.UNSUBSCRIBED);
        }

        @Test
        @DisplayName("close() is idempotent")
        void testClose() {
            SubscriptionHandle handle = subscribeRichAccounts();

            service.close(handle);
            service.close(handle);

            assertThat(handle.isClosed()).isTrue();
            assertThat(service.next(handle)).isFalse();
            assertThat(service.getSubscriptionInfo(handle.getId())).isEmpty();
        }

        @Test
        @DisplayName("Failing initial query propagates and leaves nothing registered")
        void testInitialFailure() {
            assertThatThrownBy(() -> service.subscribe(
                    "SELECT missing_column FROM accounts", "accounts", "alice", "main", cancellation))
                .isInstanceOf(QueryExecutionException.class);

            assertThat(service.getActiveCount()).isZero();
            assertThat(server.getFanout().queueCount("accounts")).isZero();
        }
    }

    @Nested
    @DisplayName("Admission")
    class Admission {

        @Test
        @DisplayName("Source is derived from the query when not given")
        void testDerivedSource() {
            SubscriptionHandle handle = service.subscribe(RICH_ACCOUNTS, null, "alice", null, cancellation);

            assertThat(handle.getSourceName()).isEqualTo("accounts");
            SubscriptionInfo info = service.getSubscriptionInfo(handle.getId()).orElseThrow();
            assertThat(info.statement()).isEqualTo(RICH_ACCOUNTS);
            assertThat(info.partitions()).hasSize(1);
            assertThat(info.active()).isTrue();
            assertThat(service.listSubscriptions()).extracting(SubscriptionInfo::id).containsExactly(handle.getId());
        }

        @Test
        @DisplayName("Query without a single source is rejected")
        void testAmbiguousSource() {
            assertThatThrownBy(() -> service.subscribe(
                    "SELECT * FROM accounts a JOIN accounts b ON a.id = b.id", null, "alice", null, cancellation))
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> assertThat(((StatusRuntimeException) e).getStatus().getCode())
                    .isEqualTo(Status.Code.INVALID_ARGUMENT));
        }

        @Test
        @DisplayName("Subscription limit is enforced")
        void testSubscriptionLimit() {
            SubscriptionService limited = new SubscriptionService(
                server.getRegistry(), server.getPartitionResolver(), server.getQueryExecutor(), 1);
            SubscriptionHandle first = limited.subscribe(RICH_ACCOUNTS, "accounts", "alice", null, cancellation);

            assertThatThrownBy(() -> limited.subscribe(RICH_ACCOUNTS, "accounts", "alice", null, cancellation))
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> assertThat(((StatusRuntimeException) e).getStatus().getCode())
                    .isEqualTo(Status.Code.RESOURCE_EXHAUSTED));

            first.close();
            assertThatCode(() -> limited.subscribe(RICH_ACCOUNTS, "accounts", "alice", null, cancellation).close())
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Shutdown closes live subscriptions and rejects new ones")
        void testShutdown() {
            SubscriptionHandle handle = subscribeRichAccounts();

            service.shutdown();

            assertThat(handle.isClosed()).isTrue();
            assertThat(service.getActiveCount()).isZero();
            assertThatThrownBy(() -> subscribeRichAccounts())
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> assertThat(((StatusRuntimeException) e).getStatus().getCode())
                    .isEqualTo(Status.Code.UNAVAILABLE));
        }
    }
}
