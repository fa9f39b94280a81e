package com.livequery.connect.session;

import com.livequery.connect.server.LiveQueryServer;
import com.livequery.connect.server.ServerConfig;
import com.livequery.connect.service.SubscriptionHandle;
import com.livequery.execution.SessionContext;
import com.livequery.test.TestBase;
import com.livequery.test.TestCategories;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@DisplayName("SessionManager Tests")
public class SessionManagerTest extends TestBase {

    @Nested
    @TestCategories.Unit
    @DisplayName("Session lifecycle")
    class Lifecycle {

        private final SessionManager manager = new SessionManager();

        @Test
        @DisplayName("Same id returns the cached session")
        void testGetOrCreateReuses() {
            Session first = manager.getOrCreateSession("s-1", "alice", "main");
            Session second = manager.getOrCreateSession("s-1", "bob", "other");

            assertThat(second).isSameAs(first);
            assertThat(second.getUser()).isEqualTo("alice");
            assertThat(manager.getSessions()).hasSize(1);
        }

        @Test
        @DisplayName("Session exposes its context")
        void testSessionContext() {
            Session session = manager.getOrCreateSession("s-2", "alice", "main");

            SessionContext context = session.toSessionContext();
            assertThat(context.user()).isEqualTo("alice");
            assertThat(context.database()).isEqualTo("main");
        }

        @Test
        @DisplayName("Unknown session is NOT_FOUND")
        void testRequireMissing() {
            assertThat(manager.getSession("nope")).isNull();
            assertThatThrownBy(() -> manager.requireSession("nope"))
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> assertThat(((StatusRuntimeException) e).getStatus().getCode())
                    .isEqualTo(Status.Code.NOT_FOUND));
        }

        @Test
        @DisplayName("Closing an unknown session reports false")
        void testCloseMissing() {
            assertThat(manager.closeSession("nope")).isFalse();
        }

        @Test
        @DisplayName("Shutdown refuses new sessions")
        void testShutdown() {
            manager.getOrCreateSession("s-3", "alice", null);

            manager.shutdown();
            manager.shutdown();

            assertThat(manager.isShuttingDown()).isTrue();
            assertThat(manager.getSessions()).isEmpty();
            assertThatThrownBy(() -> manager.getOrCreateSession("s-4", "alice", null))
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> assertThat(((StatusRuntimeException) e).getStatus().getCode())
                    .isEqualTo(Status.Code.UNAVAILABLE));
        }
    }

    @Nested
    @TestCategories.Integration
    @DisplayName("Owned subscriptions")
    class OwnedSubscriptions {

        private LiveQueryServer server;

        @BeforeEach
        void setUp() {
            server = new LiveQueryServer(ServerConfig.builder().poolSize(2).build());
            server.start();
            server.getQueryExecutor().executeUpdate("CREATE TABLE items (id INTEGER)");
        }

        @AfterEach
        void tearDown() {
            server.shutdown();
        }

        private SubscriptionHandle subscribe(Session session) {
            return server.getStatementHandler()
                .execute(session, "SUBSCRIBE TO SELECT * FROM items")
                .getHandle().orElseThrow();
        }

        @Test
        @DisplayName("Closing a session closes its subscriptions")
        void testCloseSessionClosesSubscriptions() {
            SessionManager manager = server.getSessionManager();
            Session session = manager.getOrCreateSession("s-1", "alice", "main");
            SubscriptionHandle first = subscribe(session);
            SubscriptionHandle second = subscribe(session);

            SessionManager.SessionInfo info = manager.getSessionInfo();
            assertThat(info.sessionCount).isEqualTo(1);
            assertThat(info.subscriptionCount).isEqualTo(2);
            assertThat(info.shuttingDown).isFalse();

            assertThat(manager.closeSession("s-1")).isTrue();

            assertThat(first.isClosed()).isTrue();
            assertThat(second.isClosed()).isTrue();
            assertThat(server.getSubscriptionService().getActiveCount()).isZero();
            assertThat(server.getFanout().queueCount("items")).isZero();
            assertThat(manager.getSession("s-1")).isNull();
        }

        @Test
        @DisplayName("Closed handles are not reported as live")
        void testClosedHandleNotLive() {
            Session session = server.getSessionManager().getOrCreateSession("s-2", "alice", "main");
            SubscriptionHandle handle = subscribe(session);

            handle.close();

            assertThat(session.getSubscriptions()).isEmpty();
            assertThat(session.closeSubscriptions()).isZero();
        }
    }
}
