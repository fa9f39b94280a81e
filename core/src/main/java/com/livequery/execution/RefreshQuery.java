package com.livequery.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statement text plus the values bound to its placeholders.
 *
 * @param sql statement with {@code ?} placeholders
 * @param parameters values in placeholder order
 * @param keyed true if the query is scoped to one changed row
 */
public record RefreshQuery(String sql, List<Object> parameters, boolean keyed) {

    public RefreshQuery {
        parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }
}
