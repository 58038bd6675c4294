/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.model;

/**
 * What an insert does when a track with the same external id is already stored.
 */
public enum OnConflict {
    /** Keep the stored track, drop the incoming one. */
    IGNORE,
    /** Replace the stored track with the incoming one. */
    REPLACE;

    public static OnConflict overwriting(boolean overwriteExisting) {
        return overwriteExisting ? REPLACE : IGNORE;
    }
}
