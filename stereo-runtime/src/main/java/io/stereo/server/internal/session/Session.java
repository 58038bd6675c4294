/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import io.stereo.server.model.TrackCollection;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * State shared by the activities of one connection.
 *
 * <p>The active collection is replaced wholesale, never mutated. The dispatcher switches it; the
 * debouncer refreshes its size with {@link #compareAndSetCollection} so that it never overwrites a
 * switch that happened while it was counting.</p>
 */
public class Session {

    private final String id;
    private final AtomicReference<TrackCollection> collection = new AtomicReference<>();

    public Session(String id) {
        this.id = Objects.requireNonNull(id);
    }

    public String id() {
        return id;
    }

    @Nullable
    public TrackCollection collection() {
        return collection.get();
    }

    public void replaceCollection(@Nullable TrackCollection newCollection) {
        collection.set(newCollection);
    }

    public boolean compareAndSetCollection(@Nullable TrackCollection expected, @Nullable TrackCollection updated) {
        return collection.compareAndSet(expected, updated);
    }

    @Override
    public String toString() {
        return "Session{id='" + id + "', collection=" + collection.get() + '}';
    }
}
