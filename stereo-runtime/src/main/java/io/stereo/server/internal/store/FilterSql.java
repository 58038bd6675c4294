/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.stereo.server.model.FilterCondition;
import io.stereo.server.model.SortModelItem;
import io.stereo.server.model.TrackFilter;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Translates grid filter and sort models into SQL fragments with bound parameters.
 *
 * <p>Column names come from clients, so every one is checked against the track columns before it
 * reaches the SQL text. Values are always bound.</p>
 */
final class FilterSql {

    private static final char LIKE_ESCAPE = '\\';

    /**
     * A boolean SQL expression and the values of its placeholders, in order.
     */
    record Clause(String sql, List<Object> params) {

        static final Clause EMPTY = new Clause("", List.of());

        String where() {
            return sql.isEmpty() ? "" : " WHERE " + sql;
        }
    }

    private FilterSql() {
    }

    static Clause where(TrackFilter filter) {
        if (filter.isEmpty()) {
            return Clause.EMPTY;
        }
        List<String> parts = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        for (Map.Entry<String, FilterCondition> entry : filter.conditions().entrySet()) {
            String column = TrackRows.quote(TrackRows.requireColumn(entry.getKey()));
            parts.add(condition(column, entry.getValue(), params));
        }
        return new Clause(String.join(" AND ", parts), Collections.unmodifiableList(params));
    }

    /**
     * ORDER BY clause for the sort model. Ties, and an empty model, fall back to storage order so
     * paging and row positions agree.
     */
    static String orderBy(List<SortModelItem> sort) {
        String keys = sort.stream()
                .map(item -> TrackRows.quote(TrackRows.requireColumn(item.colId())) + (item.isDescending() ? " DESC" : " ASC"))
                .collect(Collectors.joining(", "));
        return " ORDER BY " + (keys.isEmpty() ? "rowid" : keys + ", rowid");
    }

    private static String condition(String column, FilterCondition condition, List<Object> params) {
        if (condition instanceof FilterCondition.Combined combined) {
            String joiner = combined.isDisjunction() ? " OR " : " AND ";
            if (combined.conditions().isEmpty()) {
                return "1";
            }
            return combined.conditions().stream()
                    .map(item -> simple(column, item, params))
                    .collect(Collectors.joining(joiner, "(", ")"));
        }
        return simple(column, (FilterCondition.Simple) condition, params);
    }

    private static String simple(String column, FilterCondition.Simple item, List<Object> params) {
        boolean date = "date".equals(item.filterType());
        Object operand = date ? datePart(item.dateFrom()) : item.filter();
        Object upper = date ? datePart(item.dateTo()) : item.filterTo();
        switch (item.type()) {
            case "contains":
                params.add("%" + escapeLike(operand) + "%");
                return column + " LIKE ? ESCAPE '\\'";
            case "notContains":
                params.add("%" + escapeLike(operand) + "%");
                return "(" + column + " IS NULL OR " + column + " NOT LIKE ? ESCAPE '\\')";
            case "startsWith":
                params.add(escapeLike(operand) + "%");
                return column + " LIKE ? ESCAPE '\\'";
            case "endsWith":
                params.add("%" + escapeLike(operand));
                return column + " LIKE ? ESCAPE '\\'";
            case "equals":
                params.add(operand);
                return column + " = ?";
            case "notEqual":
                params.add(operand);
                return "(" + column + " IS NULL OR " + column + " <> ?)";
            case "lessThan":
                params.add(operand);
                return column + " < ?";
            case "lessThanOrEqual":
                params.add(operand);
                return column + " <= ?";
            case "greaterThan":
                params.add(operand);
                return column + " > ?";
            case "greaterThanOrEqual":
                params.add(operand);
                return column + " >= ?";
            case "inRange":
                params.add(operand);
                params.add(upper);
                return column + " BETWEEN ? AND ?";
            case "blank":
                return "(" + column + " IS NULL OR " + column + " = '')";
            case "notBlank":
                return "(" + column + " IS NOT NULL AND " + column + " <> '')";
            default:
                throw new IllegalArgumentException("Unsupported filter type '" + item.type() + "'");
        }
    }

    // the grid sends dates as "yyyy-MM-dd HH:mm:ss"
    @Nullable
    private static String datePart(@Nullable String dateTime) {
        if (dateTime == null) {
            return null;
        }
        return dateTime.length() > 10 ? dateTime.substring(0, 10) : dateTime;
    }

    private static String escapeLike(@Nullable Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Text filter without a value");
        }
        String text = value.toString();
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
