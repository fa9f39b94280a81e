package com.livequery.execution;

/**
 * Why a subscription's stream ended, or RUNNING while it has not.
 */
public enum SubscriptionOutcome {
    /** Still delivering results */
    RUNNING,
    /** The caller's cancellation signal fired; a normal termination */
    CANCELLED,
    /** Removed through the registry, e.g. by an UNSUBSCRIBE statement */
    UNSUBSCRIBED,
    /** Closed by its owner */
    CLOSED,
    /** The initial or a refresh query failed */
    FAILED
}
