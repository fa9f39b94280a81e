package com.livequery.connect.service;

import java.util.Optional;

/**
 * Outcome of a reactive statement: a row stream for SUBSCRIBE, an
 * acknowledgement with an affected count for UNSUBSCRIBE.
 */
public record StatementResult(String statementTag, SubscriptionHandle handle, int rowsAffected) {

    public static StatementResult rows(String tag, SubscriptionHandle handle) {
        return new StatementResult(tag, handle, 0);
    }

    public static StatementResult ack(String tag, int rowsAffected) {
        return new StatementResult(tag, null, rowsAffected);
    }

    public Optional<SubscriptionHandle> getHandle() {
        return Optional.ofNullable(handle);
    }
}
