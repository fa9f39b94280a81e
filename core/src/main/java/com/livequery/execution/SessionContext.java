package com.livequery.execution;

import java.util.Objects;

/**
 * Identity a subscription executes under: the session user and the current database.
 *
 * @param user session user name
 * @param database current database, may be null for the default one
 */
public record SessionContext(String user, String database) {

    public SessionContext {
        Objects.requireNonNull(user, "user must not be null");
    }
}
