package com.enterprise.wholesale.shared.querybridge.port;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL text with {@code :name} placeholders plus the values bound to them.
 *
 * <p>Templates used by batch writers carry an empty parameter map; their
 * values are supplied per item.
 */
public final class SqlResult {

    private static final Pattern NAMED_PARAM = Pattern.compile("(?<!:):(\\w+)");

    private final String sql;
    private final Map<String, Object> parameters;

    public SqlResult(String sql, Map<String, Object> parameters) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("sql must not be blank");
        }
        this.sql = sql;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static SqlResult of(String sql) {
        return new SqlResult(sql, Map.of());
    }

    public static SqlResult of(String sql, Map<String, Object> parameters) {
        return new SqlResult(sql, parameters);
    }

    public String sql() { return sql; }

    public Map<String, Object> namedParameters() { return parameters; }

    /**
     * Rewrites every {@code :name} to {@code ?} in order of appearance.
     * A name used twice is bound twice.
     */
    public PositionalQuery toPositional() {
        verify();
        Matcher m = NAMED_PARAM.matcher(sql);
        StringBuilder positional = new StringBuilder();
        List<Object> values = new ArrayList<>();
        while (m.find()) {
            values.add(parameters.get(m.group(1)));
            m.appendReplacement(positional, "?");
        }
        m.appendTail(positional);
        return new PositionalQuery(positional.toString(), values.toArray());
    }

    /** Returns the SQL with all parameter values inlined, for logging only. */
    public String toDebugString() {
        Matcher m = NAMED_PARAM.matcher(sql);
        StringBuilder inlined = new StringBuilder();
        while (m.find()) {
            Object value = parameters.get(m.group(1));
            String literal = value instanceof String || value instanceof java.time.temporal.Temporal
                    ? "'" + value + "'"
                    : String.valueOf(value);
            m.appendReplacement(inlined, Matcher.quoteReplacement(literal));
        }
        m.appendTail(inlined);
        return inlined.toString();
    }

    /** Verifies every {@code :param} in the SQL has a bound value. */
    public void verify() {
        Matcher m = NAMED_PARAM.matcher(sql);
        while (m.find()) {
            String name = m.group(1);
            if (!parameters.containsKey(name)) {
                throw new IllegalStateException(
                        "SQL references :" + name + " but no parameter was bound");
            }
        }
    }

    @Override
    public String toString() {
        return sql;
    }

    public record PositionalQuery(String sql, Object[] values) {}
}
