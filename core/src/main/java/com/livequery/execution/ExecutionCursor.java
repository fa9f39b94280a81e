package com.livequery.execution;

import java.util.List;

/**
 * Position within the current result batch of one subscription.
 *
 * <p>Replaced wholesale on every refresh and only touched by the thread
 * driving the subscription, so it is not synchronized.
 */
final class ExecutionCursor {

    private final ResultBatch batch;
    private int position = -1;

    ExecutionCursor(ResultBatch batch) {
        this.batch = batch;
    }

    /**
     * Moves to the next row.
     *
     * @return false when the batch is exhausted
     */
    boolean advance() {
        if (position + 1 >= batch.size()) {
            position = batch.size();
            return false;
        }
        position++;
        return true;
    }

    boolean hasCurrent() {
        return position >= 0 && position < batch.size();
    }

    List<Object> current() {
        if (!hasCurrent()) {
            throw new IllegalStateException("Cursor is not positioned on a row");
        }
        return batch.getRows().get(position);
    }

    ResultBatch getBatch() {
        return batch;
    }
}
