package com.livequery.sql;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort syntactic lookup of the table a query reads from.
 *
 * <p>This is a fallback for callers that cannot ask the planner. It resolves
 * a source only when the text names exactly one table; joins, comma lists
 * and several distinct tables yield empty rather than a guess. Names are
 * returned lower-cased with any schema prefix and quotes removed.
 *
 * <p>Examples:
 * <pre>
 *   extractSourceName("SELECT * FROM Test")             // Optional["test"]
 *   extractSourceName("SELECT * FROM main.accounts")    // Optional["accounts"]
 *   extractSourceName("SELECT * FROM a JOIN b ON ...")  // Optional.empty()
 *   extractSourceName("SELECT * FROM")                  // Optional.empty()
 * </pre>
 */
public final class SourceNameExtractor {

    private static final String NAME = "\"?[A-Za-z_][A-Za-z0-9_]*\"?";

    private static final Pattern FROM_SOURCE = Pattern.compile(
        "(?i)\\bFROM\\s+((?:" + NAME + "\\.)*" + NAME + ")");

    private static final Pattern FROM_LIST = Pattern.compile(
        "(?i)\\bFROM\\s+(?:" + NAME + "\\.)*" + NAME + "(?:\\s+(?:AS\\s+)?[A-Za-z_][A-Za-z0-9_]*)?\\s*,");

    private static final Pattern JOIN = Pattern.compile("(?i)\\bJOIN\\b");

    private static final Pattern CTE_NAME = Pattern.compile(
        "(?i)(?:\\bWITH\\s+(?:RECURSIVE\\s+)?|,\\s*)([A-Za-z_][A-Za-z0-9_]*)\\s+AS\\s*\\(");

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    private SourceNameExtractor() {}

    /**
     * @param query the query text
     * @return the single table the query reads from, or empty if unknown or ambiguous
     */
    public static Optional<String> extractSourceName(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }

        String text = STRING_LITERAL.matcher(query).replaceAll("''");
        if (JOIN.matcher(text).find() || FROM_LIST.matcher(text).find()) {
            return Optional.empty();
        }

        Set<String> cteNames = new HashSet<>();
        Matcher cte = CTE_NAME.matcher(text);
        while (cte.find()) {
            cteNames.add(cte.group(1).toLowerCase(Locale.ROOT));
        }

        Set<String> sources = new LinkedHashSet<>();
        Matcher from = FROM_SOURCE.matcher(text);
        while (from.find()) {
            String name = normalizeName(from.group(1));
            if (!cteNames.contains(name)) {
                sources.add(name);
            }
        }

        return sources.size() == 1 ? Optional.of(sources.iterator().next()) : Optional.empty();
    }

    /**
     * Same as {@link #extractSourceName(String)} but returns an empty string when unknown.
     */
    public static String extractSourceNameOrEmpty(String query) {
        return extractSourceName(query).orElse("");
    }

    /**
     * Strips quotes and schema qualifiers and lower-cases a table reference.
     */
    static String normalizeName(String qualified) {
        String name = qualified;
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            name = name.substring(dot + 1);
        }
        return name.replace("\"", "").toLowerCase(Locale.ROOT);
    }
}
