package com.livequery.connect.session;

import com.livequery.connect.service.SubscriptionHandle;
import com.livequery.execution.SessionContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents a single client session.
 *
 * Each session maintains:
 * - Unique session ID
 * - The user and database its statements run under
 * - Creation timestamp
 * - The subscriptions it opened, closed together with the session
 */
public class Session {
    private final String sessionId;
    private final String user;
    private final String database;
    private final long createdAt;
    private final Map<UUID, SubscriptionHandle> subscriptions;

    /**
     * Create a new session.
     *
     * @param sessionId Unique session identifier (typically UUID from client)
     * @param user Session user
     * @param database Current database (may be null)
     */
    public Session(String sessionId, String user, String database) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.user = Objects.requireNonNull(user, "user must not be null");
        this.database = database;
        this.createdAt = System.currentTimeMillis();
        this.subscriptions = new ConcurrentHashMap<>();
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getUser() {
        return user;
    }

    public String getDatabase() {
        return database;
    }

    /**
     * Get session creation timestamp.
     *
     * @return Timestamp in milliseconds since epoch
     */
    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * @return identity statements of this session run under
     */
    public SessionContext toSessionContext() {
        return new SessionContext(user, database);
    }

    /**
     * Record a subscription opened by this session. Handles that already
     * ended are dropped at the same time.
     *
     * @param handle the subscription handle
     */
    public void registerSubscription(SubscriptionHandle handle) {
        subscriptions.values().removeIf(SubscriptionHandle::isClosed);
        subscriptions.put(handle.getId(), handle);
    }

    /**
     * @param id subscription id
     * @return true if the session owned the subscription
     */
    public boolean unregisterSubscription(UUID id) {
        return subscriptions.remove(id) != null;
    }

    /**
     * @return the live subscriptions this session owns
     */
    public List<SubscriptionHandle> getSubscriptions() {
        List<SubscriptionHandle> live = new ArrayList<>();
        for (SubscriptionHandle handle : subscriptions.values()) {
            if (!handle.isClosed()) {
                live.add(handle);
            }
        }
        return live;
    }

    /**
     * Close every subscription this session owns.
     *
     * @return number of subscriptions that were still open
     */
    public int closeSubscriptions() {
        int closed = 0;
        for (SubscriptionHandle handle : subscriptions.values()) {
            if (!handle.isClosed()) {
                closed++;
            }
            handle.close();
        }
        subscriptions.clear();
        return closed;
    }

    @Override
    public String toString() {
        return String.format("Session[id=%s, user=%s, created=%d, subscriptions=%d]",
            sessionId, user, createdAt, subscriptions.size());
    }
}
