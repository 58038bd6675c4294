/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

/**
 * Half-open window {@code [start, end)} of rows in a sorted, filtered result.
 */
public record RowRange(int start, int end) {

    public RowRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("invalid row range [" + start + ", " + end + ")");
        }
    }

    public int limit() {
        return end - start;
    }
}
