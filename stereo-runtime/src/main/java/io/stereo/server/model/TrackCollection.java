/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

/**
 * A collection file and its cached track count. Replaced wholesale, never mutated.
 */
public record TrackCollection(@JsonSerialize(using = ToStringSerializer.class) Path path, int size) {

    public TrackCollection {
        Objects.requireNonNull(path, "path");
    }

    public TrackCollection withSize(int newSize) {
        return new TrackCollection(path, newSize);
    }
}
