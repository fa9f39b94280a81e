package com.livequery.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A fully materialized query result: column names and rows of column values.
 */
public final class ResultBatch {

    private final List<String> columns;
    private final List<List<Object>> rows;

    public ResultBatch(List<String> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static ResultBatch empty(List<String> columns) {
        return new ResultBatch(columns, Collections.emptyList());
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("ResultBatch[columns=%s, rows=%d]", columns, rows.size());
    }
}
