package com.livequery.connect.feed;

import com.livequery.event.ChangeEvent;
import com.livequery.subscription.PartitionChangeListener;
import com.livequery.subscription.PartitionId;
import com.livequery.subscription.PartitionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process change feed. Notifications are delivered synchronously on the
 * emitting thread; a failing listener is logged and does not stop delivery
 * to the others.
 */
public class InMemoryChangeFeed implements ChangeFeed {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryChangeFeed.class);

    private final Map<String, PartitionChangeListener> listeners = new ConcurrentHashMap<>();
    private final AtomicLong listenerCounter = new AtomicLong(1);
    private final AtomicLong emittedCount = new AtomicLong();
    private volatile boolean open = true;

    @Override
    public void emit(PartitionId partitionId, ChangeEvent event) {
        Objects.requireNonNull(partitionId, "partitionId must not be null");
        Objects.requireNonNull(event, "event must not be null");
        if (!open) {
            throw new IllegalStateException("Change feed is closed");
        }

        emittedCount.incrementAndGet();
        logger.debug("Emitting change: partition={}, source={}, operation={}",
            partitionId, event.sourceName(), event.operation());

        for (Map.Entry<String, PartitionChangeListener> entry : listeners.entrySet()) {
            try {
                entry.getValue().onPartitionChange(partitionId, event);
            } catch (RuntimeException e) {
                logger.error("Listener {} failed for partition {}", entry.getKey(), partitionId, e);
            }
        }
    }

    /**
     * Reports a change to every partition the event's source spans.
     *
     * @return number of partitions notified
     */
    public int emit(ChangeEvent event, PartitionResolver resolver) {
        int partitions = 0;
        for (PartitionId partitionId : resolver.partitionsFor(event.sourceName())) {
            emit(partitionId, event);
            partitions++;
        }
        return partitions;
    }

    @Override
    public String addListener(PartitionChangeListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        String token = "listener-" + listenerCounter.getAndIncrement();
        listeners.put(token, listener);
        logger.info("Change feed listener registered: {} (total {})", token, listeners.size());
        return token;
    }

    @Override
    public boolean removeListener(String token) {
        boolean removed = listeners.remove(token) != null;
        if (removed) {
            logger.info("Change feed listener removed: {}", token);
        }
        return removed;
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public long getEmittedCount() {
        return emittedCount.get();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
        listeners.clear();
        logger.info("Change feed closed");
    }
}
