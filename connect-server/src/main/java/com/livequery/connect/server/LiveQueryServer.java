package com.livequery.connect.server;

import com.livequery.connect.feed.InMemoryChangeFeed;
import com.livequery.connect.service.MutationService;
import com.livequery.connect.service.ReactiveStatementHandler;
import com.livequery.connect.service.SubscriptionService;
import com.livequery.connect.session.SessionManager;
import com.livequery.event.ChangeEventFanout;
import com.livequery.runtime.DuckDBConnectionManager;
import com.livequery.runtime.QueryExecutor;
import com.livequery.subscription.SourcePartitionResolver;
import com.livequery.subscription.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;

/**
 * LiveQuery server bootstrap.
 *
 * Responsibilities:
 * 1. Open the DuckDB connection pool
 * 2. Create the change fanout, subscription registry and change feed
 * 3. Create the subscription, mutation and session services
 * 4. Handle graceful shutdown
 *
 * Usage:
 * <pre>
 * LiveQueryServer server = new LiveQueryServer(ServerConfig.fromSystemProperties());
 * server.start();
 * server.blockUntilShutdown();
 * </pre>
 */
public class LiveQueryServer {
    private static final Logger logger = LoggerFactory.getLogger(LiveQueryServer.class);

    private final ServerConfig config;
    private final CountDownLatch terminated = new CountDownLatch(1);

    private DuckDBConnectionManager connectionManager;
    private QueryExecutor queryExecutor;
    private ChangeEventFanout fanout;
    private SubscriptionRegistry registry;
    private SourcePartitionResolver partitionResolver;
    private InMemoryChangeFeed changeFeed;
    private SubscriptionService subscriptionService;
    private MutationService mutationService;
    private ReactiveStatementHandler statementHandler;
    private SessionManager sessionManager;

    private volatile boolean running = false;

    public LiveQueryServer() {
        this(ServerConfig.fromSystemProperties());
    }

    public LiveQueryServer(ServerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Start the server.
     *
     * @throws IllegalStateException if already started or DuckDB cannot be opened
     */
    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Server already started");
        }
        logger.info("Starting LiveQuery Server...");
        logger.info("Configuration: {}", config);

        // 1. DuckDB
        DuckDBConnectionManager.Configuration dbConfig = config.isInMemory()
            ? DuckDBConnectionManager.Configuration.inMemory()
            : DuckDBConnectionManager.Configuration.persistent(config.getDuckDbPath());
        connectionManager = new DuckDBConnectionManager(dbConfig.withPoolSize(config.getPoolSize()));
        queryExecutor = new QueryExecutor(connectionManager);

        // 2. Change propagation
        fanout = new ChangeEventFanout(config.getDeliveryQueueCapacity());
        registry = new SubscriptionRegistry(fanout);
        partitionResolver = new SourcePartitionResolver();
        changeFeed = new InMemoryChangeFeed();
        changeFeed.addListener(registry);

        // 3. Services
        subscriptionService = new SubscriptionService(
            registry, partitionResolver, queryExecutor, config.getMaxSubscriptions());
        mutationService = new MutationService(queryExecutor, fanout);
        statementHandler = new ReactiveStatementHandler(subscriptionService);
        sessionManager = new SessionManager();

        running = true;
        logger.info("LiveQuery Server started");
    }

    /**
     * Registers a JVM shutdown hook that stops the server.
     */
    public void installShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown hook triggered");
            try {
                LiveQueryServer.this.shutdown();
            } catch (Exception e) {
                logger.error("Error during shutdown", e);
            }
        }));
    }

    /**
     * Stop the server gracefully: close every session and subscription, then the database.
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        logger.info("Stopping LiveQuery Server...");
        running = false;

        // 1. Stop accepting work and end live streams
        sessionManager.shutdown();
        subscriptionService.shutdown();
        changeFeed.close();
        fanout.closeAll();

        // 2. Close DuckDB
        try {
            connectionManager.close();
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection pool", e);
        }

        terminated.countDown();
        logger.info("LiveQuery Server stopped: published={}, delivered={}, dropped={}",
            fanout.getPublishedCount(), fanout.getDeliveredCount(), fanout.getDroppedCount());
    }

    /**
     * Wait for the server to be shut down.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void blockUntilShutdown() throws InterruptedException {
        terminated.await();
    }

    public boolean isRunning() {
        return running;
    }

    public ServerConfig getConfig() {
        return config;
    }

    public QueryExecutor getQueryExecutor() {
        return requireStarted(queryExecutor);
    }

    public ChangeEventFanout getFanout() {
        return requireStarted(fanout);
    }

    public SubscriptionRegistry getRegistry() {
        return requireStarted(registry);
    }

    public SourcePartitionResolver getPartitionResolver() {
        return requireStarted(partitionResolver);
    }

    public InMemoryChangeFeed getChangeFeed() {
        return requireStarted(changeFeed);
    }

    public SubscriptionService getSubscriptionService() {
        return requireStarted(subscriptionService);
    }

    public MutationService getMutationService() {
        return requireStarted(mutationService);
    }

    public ReactiveStatementHandler getStatementHandler() {
        return requireStarted(statementHandler);
    }

    public SessionManager getSessionManager() {
        return requireStarted(sessionManager);
    }

    private static <T> T requireStarted(T component) {
        if (component == null) {
            throw new IllegalStateException("Server not started");
        }
        return component;
    }

    /**
     * Main entry point.
     */
    public static void main(String[] args) throws InterruptedException {
        LiveQueryServer server = new LiveQueryServer(ServerConfig.fromSystemProperties());
        server.start();
        server.installShutdownHook();
        server.blockUntilShutdown();
    }
}
