package com.livequery.connect.service;

import java.util.Objects;

/**
 * {@code SUBSCRIBE TO <query>}: keep evaluating a query and stream its results.
 */
public record SubscribeStatement(String query) implements ReactiveStatement {

    public static final String TAG = "SUBSCRIBE";

    public SubscribeStatement {
        Objects.requireNonNull(query, "query must not be null");
        if (query.isBlank()) {
            throw new IllegalArgumentException("SUBSCRIBE TO requires a query");
        }
    }

    @Override
    public String statementTag() {
        return TAG;
    }

    @Override
    public boolean returnsRows() {
        return true;
    }

    @Override
    public String format() {
        return "SUBSCRIBE TO " + query;
    }

    @Override
    public String toString() {
        return format();
    }
}
