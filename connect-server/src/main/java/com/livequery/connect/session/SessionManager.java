package com.livequery.connect.session;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manages session lifecycle for the LiveQuery server.
 *
 * <p>Sessions are cached by ID so every request carrying the same session ID
 * sees the same subscriptions. Closing a session tears down every
 * subscription it opened.
 *
 * @see Session
 */
public class SessionManager {
    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    /** Cache of sessions by session ID */
    private final ConcurrentHashMap<String, Session> sessionCache = new ConcurrentHashMap<>();

    /** Flag to track shutdown state */
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Get or create the session with the given ID.
     *
     * <p>An existing session is returned as is; {@code user} and
     * {@code database} only apply when the session is created.
     *
     * @param sessionId Client session ID
     * @param user Session user
     * @param database Current database (may be null)
     * @return Cached or newly created session
     * @throws StatusRuntimeException UNAVAILABLE if the manager is shutting down
     */
    public Session getOrCreateSession(String sessionId, String user, String database) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (shuttingDown.get()) {
            throw new StatusRuntimeException(
                Status.UNAVAILABLE.withDescription("Server is shutting down"));
        }

        return sessionCache.computeIfAbsent(sessionId, id -> {
            logger.debug("Creating new session: id={}, user={}", id, user);
            return new Session(id, user, database);
        });
    }

    /**
     * Get session by ID.
     *
     * @param sessionId Session ID to lookup
     * @return Session if exists, null otherwise
     */
    public Session getSession(String sessionId) {
        return sessionCache.get(sessionId);
    }

    /**
     * Get session by ID, failing if it does not exist.
     *
     * @param sessionId Session ID to lookup
     * @return the session
     * @throws StatusRuntimeException NOT_FOUND if no such session
     */
    public Session requireSession(String sessionId) {
        Session session = sessionCache.get(sessionId);
        if (session == null) {
            throw new StatusRuntimeException(
                Status.NOT_FOUND.withDescription("Session not found: " + sessionId));
        }
        return session;
    }

    /**
     * Close a session and every subscription it owns.
     *
     * @param sessionId Session ID
     * @return true if the session existed
     */
    public boolean closeSession(String sessionId) {
        Session session = sessionCache.remove(sessionId);
        if (session == null) {
            return false;
        }
        int closed = session.closeSubscriptions();
        logger.info("Session closed: id={}, subscriptionsClosed={}", sessionId, closed);
        return true;
    }

    public List<Session> getSessions() {
        return new ArrayList<>(sessionCache.values());
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    /**
     * Get current session info for monitoring.
     *
     * @return Snapshot of current state
     */
    public SessionInfo getSessionInfo() {
        int subscriptions = 0;
        for (Session session : sessionCache.values()) {
            subscriptions += session.getSubscriptions().size();
        }
        return new SessionInfo(sessionCache.size(), subscriptions, shuttingDown.get());
    }

    /**
     * Shutdown the session manager, closing all sessions.
     */
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down SessionManager");

        for (String sessionId : new ArrayList<>(sessionCache.keySet())) {
            closeSession(sessionId);
        }

        logger.info("SessionManager shutdown complete");
    }

    // ========== Session Info ==========

    /**
     * Immutable snapshot of session state for monitoring.
     */
    public static class SessionInfo {
        public final int sessionCount;
        public final int subscriptionCount;
        public final boolean shuttingDown;

        public SessionInfo(int sessionCount, int subscriptionCount, boolean shuttingDown) {
            this.sessionCount = sessionCount;
            this.subscriptionCount = subscriptionCount;
            this.shuttingDown = shuttingDown;
        }

        @Override
        public String toString() {
            return String.format("SessionInfo[sessions=%d, subscriptions=%d%s]",
                sessionCount, subscriptionCount, shuttingDown ? ", SHUTTING_DOWN" : "");
        }
    }
}
