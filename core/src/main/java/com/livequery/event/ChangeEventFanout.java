package com.livequery.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory publish/subscribe hub routing change events to subscriber queues.
 *
 * <p>Design principles:
 * <ul>
 *   <li>Events are routed by source name (case-insensitive)</li>
 *   <li>Publishers never block: a full queue loses that event, other queues still get it</li>
 *   <li>Publishing takes the read lock, so publishers run concurrently with each other</li>
 *   <li>Registering and releasing queues takes the write lock</li>
 * </ul>
 *
 * <p>Dropping on overflow is the backpressure contract, not a failure: a slow
 * subscriber misses intermediate notifications and catches up on the next
 * event it does receive. Drops are counted and logged.
 *
 * <p>One instance is created at server start and injected into its collaborators.
 *
 * @see DeliveryQueue
 */
public class ChangeEventFanout {
    private static final Logger logger = LoggerFactory.getLogger(ChangeEventFanout.class);

    /** Default per-subscription queue capacity */
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Guarded by {@link #lock} */
    private final Map<String, List<DeliveryQueue>> queuesBySource = new HashMap<>();

    private final int queueCapacity;
    private final AtomicLong queueIds = new AtomicLong();
    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    public ChangeEventFanout() {
        this(DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * @param queueCapacity capacity of every queue handed out by {@link #subscribe(String)}
     */
    public ChangeEventFanout(int queueCapacity) {
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
        this.queueCapacity = queueCapacity;
    }

    /**
     * Registers a new delivery queue for a source.
     *
     * @param sourceName source to listen to
     * @return a queue owned exclusively by the caller
     */
    public DeliveryQueue subscribe(String sourceName) {
        String source = normalize(sourceName);
        DeliveryQueue queue = new DeliveryQueue(queueIds.incrementAndGet(), source, queueCapacity);

        lock.writeLock().lock();
        try {
            List<DeliveryQueue> queues = queuesBySource.computeIfAbsent(source, s -> new ArrayList<>());
            queues.add(queue);
            logger.debug("Queue registered: source={}, queue={}, listeners={}",
                source, queue.getQueueId(), queues.size());
        } finally {
            lock.writeLock().unlock();
        }
        return queue;
    }

    /**
     * Removes and closes a queue. Calling this again for the same queue does nothing.
     *
     * @param sourceName source the queue was registered for
     * @param queue the queue to release
     */
    public void unsubscribe(String sourceName, DeliveryQueue queue) {
        if (queue == null) {
            return;
        }
        String source = normalize(sourceName);
        boolean removed = false;

        lock.writeLock().lock();
        try {
            List<DeliveryQueue> queues = queuesBySource.get(source);
            if (queues != null && queues.remove(queue)) {
                removed = true;
                if (queues.isEmpty()) {
                    queuesBySource.remove(source);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        queue.close();
        if (removed) {
            logger.debug("Queue released: source={}, queue={}", source, queue.getQueueId());
        }
    }

    /**
     * Builds a change event and publishes it.
     *
     * @return number of queues that accepted the event
     */
    public int publish(String sourceName, Operation operation, Map<String, Object> key) {
        return publish(new ChangeEvent(sourceName, operation, key));
    }

    /**
     * Offers an event to every queue registered for its source.
     *
     * @param event the event to publish
     * @return number of queues that accepted the event
     */
    public int publish(ChangeEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        String source = normalize(event.sourceName());
        publishedCount.incrementAndGet();

        lock.readLock().lock();
        try {
            List<DeliveryQueue> queues = queuesBySource.get(source);
            if (queues == null || queues.isEmpty()) {
                return 0;
            }

            logger.debug("Publishing: source={}, operation={}, key={}, listeners={}",
                source, event.operation(), event.key(), queues.size());

            int accepted = 0;
            for (DeliveryQueue queue : queues) {
                if (deliver(queue, event)) {
                    accepted++;
                }
            }
            return accepted;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Offers one event to one queue under the drop-on-overflow policy.
     *
     * @return true if the queue accepted the event
     */
    public boolean deliver(DeliveryQueue queue, ChangeEvent event) {
        if (queue.offer(event)) {
            deliveredCount.incrementAndGet();
            return true;
        }
        if (!queue.isClosed()) {
            droppedCount.incrementAndGet();
            logger.warn("Queue full, event dropped: source={}, queue={}, operation={}, key={}",
                queue.getSourceName(), queue.getQueueId(), event.operation(), event.key());
        }
        return false;
    }

    /**
     * @return number of live queues registered for the source
     */
    public int queueCount(String sourceName) {
        lock.readLock().lock();
        try {
            List<DeliveryQueue> queues = queuesBySource.get(normalize(sourceName));
            return queues == null ? 0 : queues.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return sources that currently have at least one queue
     */
    public List<String> getSources() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(queuesBySource.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes every registered queue. Used at shutdown.
     */
    public void closeAll() {
        List<DeliveryQueue> all = new ArrayList<>();
        lock.writeLock().lock();
        try {
            queuesBySource.values().forEach(all::addAll);
            queuesBySource.clear();
        } finally {
            lock.writeLock().unlock();
        }
        all.forEach(DeliveryQueue::close);
        logger.info("ChangeEventFanout closed {} queues", all.size());
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public long getPublishedCount() {
        return publishedCount.get();
    }

    public long getDeliveredCount() {
        return deliveredCount.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    static String normalize(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName cannot be null or blank");
        }
        return sourceName.trim().toLowerCase(Locale.ROOT);
    }
}
