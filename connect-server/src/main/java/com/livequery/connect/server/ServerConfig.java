package com.livequery.connect.server;

import com.livequery.event.ChangeEventFanout;

/**
 * Immutable server configuration.
 *
 * <p>{@link #fromSystemProperties()} reads:
 * <ul>
 *   <li>{@code livequery.deliveryQueueCapacity} - per-subscription event queue size (default 1024)</li>
 *   <li>{@code livequery.maxSubscriptions} - live subscription limit, 0 for unlimited (default 0)</li>
 *   <li>{@code livequery.duckdbPath} - database file, in-memory when unset</li>
 *   <li>{@code livequery.poolSize} - DuckDB connection pool size, 0 for auto (default 0)</li>
 * </ul>
 * Values that do not parse or are out of range fall back to the default.
 */
public final class ServerConfig {

    /** System property for delivery queue capacity */
    public static final String PROP_DELIVERY_QUEUE_CAPACITY = "livequery.deliveryQueueCapacity";

    /** System property for the subscription limit */
    public static final String PROP_MAX_SUBSCRIPTIONS = "livequery.maxSubscriptions";

    /** System property for the DuckDB database path */
    public static final String PROP_DUCKDB_PATH = "livequery.duckdbPath";

    /** System property for the connection pool size */
    public static final String PROP_POOL_SIZE = "livequery.poolSize";

    public static final int DEFAULT_DELIVERY_QUEUE_CAPACITY = ChangeEventFanout.DEFAULT_QUEUE_CAPACITY;
    public static final int DEFAULT_MAX_SUBSCRIPTIONS = 0;
    public static final int DEFAULT_POOL_SIZE = 0;

    private final int deliveryQueueCapacity;
    private final int maxSubscriptions;
    private final String duckDbPath;
    private final int poolSize;

    private ServerConfig(Builder builder) {
        this.deliveryQueueCapacity = builder.deliveryQueueCapacity;
        this.maxSubscriptions = builder.maxSubscriptions;
        this.duckDbPath = builder.duckDbPath;
        this.poolSize = builder.poolSize;
    }

    public static ServerConfig defaults() {
        return builder().build();
    }

    public static ServerConfig fromSystemProperties() {
        String path = System.getProperty(PROP_DUCKDB_PATH);
        return builder()
            .deliveryQueueCapacity(getConfiguredInt(PROP_DELIVERY_QUEUE_CAPACITY, DEFAULT_DELIVERY_QUEUE_CAPACITY, 1))
            .maxSubscriptions(getConfiguredInt(PROP_MAX_SUBSCRIPTIONS, DEFAULT_MAX_SUBSCRIPTIONS, 0))
            .poolSize(getConfiguredInt(PROP_POOL_SIZE, DEFAULT_POOL_SIZE, 0))
            .duckDbPath(path != null && !path.isBlank() ? path.trim() : null)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Configuration Helpers ==========

    private static int getConfiguredInt(String property, int defaultValue, int minimum) {
        String value = System.getProperty(property);
        if (value != null) {
            try {
                int parsed = Integer.parseInt(value.trim());
                if (parsed >= minimum) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                // Ignore, use default
            }
        }
        return defaultValue;
    }

    public int getDeliveryQueueCapacity() {
        return deliveryQueueCapacity;
    }

    public int getMaxSubscriptions() {
        return maxSubscriptions;
    }

    /**
     * @return database file path, null for an in-memory database
     */
    public String getDuckDbPath() {
        return duckDbPath;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public boolean isInMemory() {
        return duckDbPath == null;
    }

    @Override
    public String toString() {
        return String.format("ServerConfig[queueCapacity=%d, maxSubscriptions=%d, duckDbPath=%s, poolSize=%d]",
            deliveryQueueCapacity, maxSubscriptions, duckDbPath != null ? duckDbPath : "in-memory", poolSize);
    }

    public static final class Builder {
        private int deliveryQueueCapacity = DEFAULT_DELIVERY_QUEUE_CAPACITY;
        private int maxSubscriptions = DEFAULT_MAX_SUBSCRIPTIONS;
        private String duckDbPath;
        private int poolSize = DEFAULT_POOL_SIZE;

        private Builder() {}

        public Builder deliveryQueueCapacity(int capacity) {
            if (capacity <= 0) {
                throw new IllegalArgumentException("deliveryQueueCapacity must be positive");
            }
            this.deliveryQueueCapacity = capacity;
            return this;
        }

        public Builder maxSubscriptions(int max) {
            if (max < 0) {
                throw new IllegalArgumentException("maxSubscriptions must be non-negative");
            }
            this.maxSubscriptions = max;
            return this;
        }

        public Builder duckDbPath(String path) {
            this.duckDbPath = path;
            return this;
        }

        public Builder poolSize(int size) {
            if (size < 0) {
                throw new IllegalArgumentException("poolSize must be non-negative");
            }
            this.poolSize = size;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
