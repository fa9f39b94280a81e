package com.livequery.connect.service;

import com.livequery.connect.session.Session;
import com.livequery.sql.SQLQuoting;
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises {@code SUBSCRIBE TO <query>} and {@code UNSUBSCRIBE <id>} and
 * routes them to the {@link SubscriptionService}.
 *
 * <p>Only the statement prefix is inspected; the subscribed query itself is
 * passed through untouched to the database. Any other statement is not
 * reactive and is left to the regular execution path.
 */
public class ReactiveStatementHandler {
    private static final Logger logger = LoggerFactory.getLogger(ReactiveStatementHandler.class);

    private static final Pattern SUBSCRIBE = Pattern.compile("(?is)^\\s*SUBSCRIBE\\b(.*)$");
    private static final Pattern SUBSCRIBE_TO = Pattern.compile("(?is)^\\s*TO\\b(.*)$");
    private static final Pattern UNSUBSCRIBE = Pattern.compile("(?is)^\\s*UNSUBSCRIBE\\b(.*)$");

    private final SubscriptionService subscriptionService;

    public ReactiveStatementHandler(SubscriptionService subscriptionService) {
        this.subscriptionService = Objects.requireNonNull(subscriptionService, "subscriptionService must not be null");
    }

    /**
     * @return true if the statement starts with SUBSCRIBE or UNSUBSCRIBE
     */
    public static boolean isReactiveStatement(String sql) {
        return sql != null && (SUBSCRIBE.matcher(sql).matches() || UNSUBSCRIBE.matcher(sql).matches());
    }

    /**
     * Parses a reactive statement.
     *
     * @param sql statement text
     * @return the statement, or empty if it is not a reactive statement
     * @throws StatusRuntimeException INVALID_ARGUMENT if it is reactive but malformed
     */
    public static Optional<ReactiveStatement> parse(String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        String text = SQLQuoting.stripTrailingTerminator(sql);

        Matcher subscribe = SUBSCRIBE.matcher(text);
        if (subscribe.matches()) {
            Matcher to = SUBSCRIBE_TO.matcher(subscribe.group(1));
            if (!to.matches() || to.group(1).isBlank()) {
                throw invalid("Expected SUBSCRIBE TO <query>: " + sql);
            }
            return Optional.of(new SubscribeStatement(to.group(1).trim()));
        }

        Matcher unsubscribe = UNSUBSCRIBE.matcher(text);
        if (unsubscribe.matches()) {
            return Optional.of(new UnsubscribeStatement(parseId(unsubscribe.group(1).trim(), sql)));
        }

        return Optional.empty();
    }

    private static UUID parseId(String argument, String sql) {
        if (argument.isEmpty()) {
            throw invalid("Expected UNSUBSCRIBE <subscription id>: " + sql);
        }
        try {
            String id = argument.startsWith("'") ? SQLQuoting.unquoteLiteral(argument) : argument;
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new StatusRuntimeException(
                Status.INVALID_ARGUMENT.withDescription("Invalid subscription id: " + argument).withCause(e));
        }
    }

    private static StatusRuntimeException invalid(String message) {
        return new StatusRuntimeException(Status.INVALID_ARGUMENT.withDescription(message));
    }

    /**
     * Parses and executes a reactive statement on behalf of a session.
     *
     * @param session the issuing session
     * @param sql statement text
     * @return the statement result
     * @throws StatusRuntimeException INVALID_ARGUMENT if the statement is not reactive or malformed
     */
    public StatementResult execute(Session session, String sql) {
        ReactiveStatement statement = parse(sql)
            .orElseThrow(() -> invalid("Not a SUBSCRIBE or UNSUBSCRIBE statement: " + sql));
        return execute(session, statement);
    }

    /**
     * Executes a parsed reactive statement on behalf of a session.
     */
    public StatementResult execute(Session session, ReactiveStatement statement) {
        Objects.requireNonNull(session, "session must not be null");
        logger.debug("Executing {} for session={}", statement.statementTag(), session.getSessionId());

        if (statement instanceof SubscribeStatement subscribe) {
            SubscriptionHandle handle = subscriptionService.subscribe(
                subscribe.query(), null, session.getUser(), session.getDatabase(), Context.current());
            session.registerSubscription(handle);
            return StatementResult.rows(subscribe.statementTag(), handle);
        }

        if (statement instanceof UnsubscribeStatement unsubscribe) {
            UUID id = unsubscribe.subscriptionId();
            boolean removed = subscriptionService.unsubscribeById(id);
            session.unregisterSubscription(id);
            return StatementResult.ack(unsubscribe.statementTag(), removed ? 1 : 0);
        }

        throw invalid("Unsupported reactive statement: " + statement.format());
    }
}
