/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a search query is matched against.
 */
public enum SearchKind {
    FUZZY("fuzzy"),
    BY_ARTIST("by-artist"),
    BY_LABEL("by-label");

    private final String tag;

    SearchKind(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static SearchKind fromTag(String tag) {
        return Arrays.stream(values())
                .filter(kind -> kind.tag.equals(tag))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown search kind: " + tag));
    }
}
