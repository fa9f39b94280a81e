package com.livequery.event;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Bounded FIFO of change events owned by exactly one subscription.
 *
 * <p>Producers never block: {@link #offer(ChangeEvent)} refuses the event
 * when the queue is full or closed. The single consumer blocks in
 * {@link #take(BooleanSupplier)} until an event arrives, the queue is closed,
 * or its cancellation check turns true. Whoever flips the cancellation
 * state must call {@link #wakeup()} so the consumer re-checks it.
 *
 * <p>Queues are created and closed by {@link ChangeEventFanout}.
 */
public final class DeliveryQueue {

    private final long queueId;
    private final String sourceName;
    private final int capacity;
    private final ArrayDeque<ChangeEvent> events;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private boolean closed = false;

    DeliveryQueue(long queueId, String sourceName, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queueId = queueId;
        this.sourceName = sourceName;
        this.capacity = capacity;
        this.events = new ArrayDeque<>(Math.min(capacity, 64));
    }

    /**
     * Appends an event without blocking.
     *
     * @param event the event to enqueue
     * @return true if enqueued, false if the queue is full or closed
     */
    public boolean offer(ChangeEvent event) {
        lock.lock();
        try {
            if (closed || events.size() >= capacity) {
                return false;
            }
            events.addLast(event);
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the head event without blocking.
     *
     * @return the head event, or null if none is queued or the queue is closed
     */
    public ChangeEvent poll() {
        lock.lock();
        try {
            return closed ? null : events.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the next event.
     *
     * @param cancelled checked under the queue lock before every wait
     * @return the next event, or null if the queue was closed or cancellation was observed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public ChangeEvent take(BooleanSupplier cancelled) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed || cancelled.getAsBoolean()) {
                    return null;
                }
                ChangeEvent next = events.pollFirst();
                if (next != null) {
                    return next;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes a consumer blocked in {@code take} so it re-evaluates its cancellation check.
     */
    public void wakeup() {
        lock.lock();
        try {
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the queue, discarding pending events and waking the consumer.
     *
     * @return true if this call closed the queue, false if it was already closed
     */
    boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            events.clear();
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return events.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long getQueueId() {
        return queueId;
    }

    public String getSourceName() {
        return sourceName;
    }

    @Override
    public String toString() {
        return String.format("DeliveryQueue[id=%d, source=%s, size=%d/%d, closed=%s]",
            queueId, sourceName, size(), capacity, isClosed());
    }
}
