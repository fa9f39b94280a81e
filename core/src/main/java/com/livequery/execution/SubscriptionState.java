package com.livequery.execution;

/**
 * States of a subscription's execution.
 *
 * <pre>
 *   INIT --&gt; SERVING --&gt; WAITING --&gt; REFRESHING --&gt; SERVING | WAITING
 *   INIT --&gt; WAITING (empty initial result)
 *   any  --&gt; CLOSED
 * </pre>
 */
public enum SubscriptionState {
    INIT,
    SERVING,
    WAITING,
    REFRESHING,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSED;
    }
}
