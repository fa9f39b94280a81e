package com.livequery.sql;

import com.livequery.event.ChangeEvent;
import com.livequery.event.Operation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort derivation of a {@link ChangeEvent} from a literal DML statement.
 *
 * <p>Recognised shapes:
 * <ul>
 *   <li>{@code INSERT INTO t (c1, c2) VALUES (v1, v2)} - key read from the single row</li>
 *   <li>{@code UPDATE t SET ... WHERE k = v [AND ...]}</li>
 *   <li>{@code DELETE FROM t WHERE k = v [AND ...]}</li>
 * </ul>
 *
 * <p>When a key column cannot be read (multi-row insert, range predicate,
 * bound parameter) the event carries no key and subscribers refresh fully.
 * Statements that are not one of the three shapes yield empty.
 */
public final class MutationAnalyzer {

    private static final String NAME = "(?:\"?[A-Za-z_][A-Za-z0-9_]*\"?\\.)*\"?[A-Za-z_][A-Za-z0-9_]*\"?";

    private static final Pattern INSERT = Pattern.compile(
        "(?is)^\\s*INSERT\\s+INTO\\s+(" + NAME + ")\\s*(?:\\(([^)]*)\\))?\\s*VALUES\\s*(.*)$");

    private static final Pattern UPDATE = Pattern.compile(
        "(?is)^\\s*UPDATE\\s+(" + NAME + ")\\s+SET\\s+.*?(?:\\bWHERE\\b(.*))?$");

    private static final Pattern DELETE = Pattern.compile(
        "(?is)^\\s*DELETE\\s+FROM\\s+(" + NAME + ")\\s*(?:\\bWHERE\\b(.*))?$");

    private static final String LITERAL = "(-?\\d+(?:\\.\\d+)?|'(?:[^']|'')*')";

    private MutationAnalyzer() {}

    /**
     * @param dml the statement text
     * @param keyColumns key columns of the target table, in key order
     * @return the event describing the mutation, or empty if the statement is not a recognised DML shape
     */
    public static Optional<ChangeEvent> analyze(String dml, List<String> keyColumns) {
        if (dml == null || dml.isBlank()) {
            return Optional.empty();
        }
        String sql = SQLQuoting.stripTrailingTerminator(dml);

        Matcher insert = INSERT.matcher(sql);
        if (insert.matches()) {
            String source = SourceNameExtractor.normalizeName(insert.group(1));
            return Optional.of(new ChangeEvent(source, Operation.INSERT,
                insertKey(insert.group(2), insert.group(3), keyColumns)));
        }

        Matcher update = UPDATE.matcher(sql);
        if (update.matches()) {
            String source = SourceNameExtractor.normalizeName(update.group(1));
            return Optional.of(new ChangeEvent(source, Operation.UPDATE,
                predicateKey(update.group(2), keyColumns)));
        }

        Matcher delete = DELETE.matcher(sql);
        if (delete.matches()) {
            String source = SourceNameExtractor.normalizeName(delete.group(1));
            return Optional.of(new ChangeEvent(source, Operation.DELETE,
                predicateKey(delete.group(2), keyColumns)));
        }

        return Optional.empty();
    }

    private static Map<String, Object> predicateKey(String whereClause, List<String> keyColumns) {
        Map<String, Object> key = new LinkedHashMap<>();
        if (whereClause == null || keyColumns == null || keyColumns.isEmpty()) {
            return key;
        }
        // a disjunction can touch more than one row
        if (whereClause.toLowerCase(Locale.ROOT).contains(" or ")) {
            return key;
        }
        for (String column : keyColumns) {
            Pattern equality = Pattern.compile(
                "(?i)(?:^|[^A-Za-z0-9_\"])\"?" + Pattern.quote(column) + "\"?\\s*=\\s*" + LITERAL);
            Matcher m = equality.matcher(whereClause);
            if (!m.find()) {
                return new LinkedHashMap<>();
            }
            key.put(column, parseLiteral(m.group(1)));
        }
        return key;
    }

    private static Map<String, Object> insertKey(String columnList, String valuesClause, List<String> keyColumns) {
        Map<String, Object> key = new LinkedHashMap<>();
        if (columnList == null || keyColumns == null || keyColumns.isEmpty()) {
            return key;
        }

        List<String> rows = splitTopLevel(valuesClause.trim());
        if (rows.size() != 1) {
            return key;
        }
        String row = rows.get(0).trim();
        if (!row.startsWith("(") || !row.endsWith(")")) {
            return key;
        }

        List<String> columns = new ArrayList<>();
        for (String column : columnList.split(",")) {
            columns.add(column.trim().replace("\"", "").toLowerCase(Locale.ROOT));
        }
        List<String> values = splitTopLevel(row.substring(1, row.length() - 1));
        if (values.size() != columns.size()) {
            return key;
        }

        for (String keyColumn : keyColumns) {
            int index = columns.indexOf(keyColumn.toLowerCase(Locale.ROOT));
            if (index < 0) {
                return new LinkedHashMap<>();
            }
            String value = values.get(index).trim();
            if (!value.matches(LITERAL)) {
                return new LinkedHashMap<>();
            }
            key.put(keyColumn, parseLiteral(value));
        }
        return key;
    }

    /**
     * Converts a numeric or single-quoted literal into a Java value suitable for binding.
     */
    static Object parseLiteral(String literal) {
        if (literal.startsWith("'")) {
            return SQLQuoting.unquoteLiteral(literal);
        }
        if (literal.contains(".")) {
            return new BigDecimal(literal);
        }
        try {
            return Long.parseLong(literal);
        } catch (NumberFormatException e) {
            return new BigDecimal(literal);
        }
    }

    /**
     * Splits on commas that are outside quotes and parentheses.
     */
    static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        boolean inQuote = false;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
            } else if (!inQuote && c == '(') {
                depth++;
            } else if (!inQuote && c == ')') {
                depth--;
            } else if (!inQuote && depth == 0 && c == ',') {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        String tail = text.substring(start);
        if (!tail.isBlank()) {
            parts.add(tail);
        }
        return parts;
    }
}
