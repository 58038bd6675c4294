/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Column conditions of a grid query, all of which must hold. Empty matches every track.
 */
public record TrackFilter(Map<String, FilterCondition> conditions) {

    private static final TrackFilter NONE = new TrackFilter(Map.of());

    public TrackFilter {
        conditions = conditions.isEmpty() ? Map.of() : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(conditions));
    }

    public static TrackFilter none() {
        return NONE;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TrackFilter of(@Nullable Map<String, FilterCondition> conditions) {
        return conditions == null || conditions.isEmpty() ? NONE : new TrackFilter(conditions);
    }

    @JsonValue
    @Override
    public Map<String, FilterCondition> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }
}
