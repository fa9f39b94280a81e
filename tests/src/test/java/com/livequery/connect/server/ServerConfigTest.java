package com.livequery.connect.server;

import com.livequery.test.TestBase;
import com.livequery.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ServerConfig Tests")
public class ServerConfigTest extends TestBase {

    @AfterEach
    void clearProperties() {
        System.clearProperty(ServerConfig.PROP_DELIVERY_QUEUE_CAPACITY);
        System.clearProperty(ServerConfig.PROP_MAX_SUBSCRIPTIONS);
        System.clearProperty(ServerConfig.PROP_DUCKDB_PATH);
        System.clearProperty(ServerConfig.PROP_POOL_SIZE);
    }

    @Test
    @DisplayName("Defaults are in-memory and unbounded")
    void testDefaults() {
        ServerConfig config = ServerConfig.defaults();

        assertThat(config.getDeliveryQueueCapacity()).isEqualTo(ServerConfig.DEFAULT_DELIVERY_QUEUE_CAPACITY);
        assertThat(config.getMaxSubscriptions()).isZero();
        assertThat(config.getPoolSize()).isZero();
        assertThat(config.isInMemory()).isTrue();
    }

    @Test
    @DisplayName("System properties override defaults")
    void testSystemProperties() {
        System.setProperty(ServerConfig.PROP_DELIVERY_QUEUE_CAPACITY, "16");
        System.setProperty(ServerConfig.PROP_MAX_SUBSCRIPTIONS, "5");
        System.setProperty(ServerConfig.PROP_DUCKDB_PATH, "/tmp/livequery.duckdb");
        System.setProperty(ServerConfig.PROP_POOL_SIZE, "3");

        ServerConfig config = ServerConfig.fromSystemProperties();

        assertThat(config.getDeliveryQueueCapacity()).isEqualTo(16);
        assertThat(config.getMaxSubscriptions()).isEqualTo(5);
        assertThat(config.getDuckDbPath()).isEqualTo("/tmp/livequery.duckdb");
        assertThat(config.getPoolSize()).isEqualTo(3);
        assertThat(config.isInMemory()).isFalse();
    }

    @Test
    @DisplayName("Invalid property values fall back to defaults")
    void testInvalidProperties() {
        System.setProperty(ServerConfig.PROP_DELIVERY_QUEUE_CAPACITY, "lots");
        System.setProperty(ServerConfig.PROP_MAX_SUBSCRIPTIONS, "-2");

        ServerConfig config = ServerConfig.fromSystemProperties();

        assertThat(config.getDeliveryQueueCapacity()).isEqualTo(ServerConfig.DEFAULT_DELIVERY_QUEUE_CAPACITY);
        assertThat(config.getMaxSubscriptions()).isEqualTo(ServerConfig.DEFAULT_MAX_SUBSCRIPTIONS);
    }

    @Test
    @DisplayName("Builder rejects out of range values")
    void testBuilderValidation() {
        assertThatThrownBy(() -> ServerConfig.builder().deliveryQueueCapacity(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.builder().maxSubscriptions(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.builder().poolSize(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
