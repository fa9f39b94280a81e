package com.livequery.connect.service;

import java.util.Objects;
import java.util.UUID;

/**
 * {@code UNSUBSCRIBE <id>}: remove a subscription by id.
 */
public record UnsubscribeStatement(UUID subscriptionId) implements ReactiveStatement {

    public static final String TAG = "UNSUBSCRIBE";

    public UnsubscribeStatement {
        Objects.requireNonNull(subscriptionId, "subscriptionId must not be null");
    }

    @Override
    public String statementTag() {
        return TAG;
    }

    @Override
    public boolean returnsRows() {
        return false;
    }

    @Override
    public String format() {
        return "UNSUBSCRIBE '" + subscriptionId + "'";
    }

    @Override
    public String toString() {
        return format();
    }
}
