/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Lifecycle of a session.
 *
 * <pre>
 *   Created
 *      │ start()
 *      ▼
 *   Running ───────────────┐
 *      │ peer closed        │ activity fault / server shutdown
 *      ▼                    ▼
 *   Closed(null)        Closed(cause)
 * </pre>
 *
 * A session may also go straight from Created to Closed if it is shut down before it starts.
 */
public sealed interface SessionState permits
        SessionState.Created,
        SessionState.Running,
        SessionState.Closed {

    /**
     * Queues allocated and registered, activities not yet started.
     */
    record Created() implements SessionState {
        public static final Created INSTANCE = new Created();

        public Running toRunning() {
            return Running.INSTANCE;
        }
    }

    /**
     * All activities are scheduled.
     */
    record Running() implements SessionState {
        public static final Running INSTANCE = new Running();
    }

    /**
     * Terminal state.
     *
     * @param cause the fault that ended the session, {@code null} for an orderly close
     */
    record Closed(@Nullable Throwable cause) implements SessionState {

        public boolean isFault() {
            return cause != null;
        }
    }
}
