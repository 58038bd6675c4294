/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One sort key of a grid query: a column and a direction ({@code asc} or {@code desc}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SortModelItem(String colId, String sort, @Nullable String type) {

    public SortModelItem {
        Objects.requireNonNull(colId, "colId");
        Objects.requireNonNull(sort, "sort");
    }

    public static SortModelItem ascending(String colId) {
        return new SortModelItem(colId, "asc", null);
    }

    public static SortModelItem descending(String colId) {
        return new SortModelItem(colId, "desc", null);
    }

    public boolean isDescending() {
        return "desc".equalsIgnoreCase(sort);
    }
}
