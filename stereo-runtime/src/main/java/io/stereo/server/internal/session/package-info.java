/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

/**
 * Per connection session engine.
 *
 * <pre>
 *   Netty event loop                       session executor
 *   ────────────────                       ────────────────
 *   text frame ──► InboundFrameBuffer ──► receive ──► inbound queue ──► dispatch ──┐
 *        ▲            (auto-read off                                  │           │
 *        │             above watermark)                   StateChangeDebouncer   SearchTaskSupervisor
 *        │                                                            │           │
 *   SessionTransport ◄── OutboundBatcher ◄──────── outbound queue ◄────┴───────────┘
 * </pre>
 *
 * <p>{@link io.stereo.server.internal.session.SessionSupervisor} runs the activities of one
 * session and tears them down together; {@link io.stereo.server.internal.session.SessionManager}
 * opens sessions and owns the routing tables.</p>
 */
@ReturnValuesAreNonnullByDefault
@DefaultAnnotationForParameters(NonNull.class)
@DefaultAnnotation(NonNull.class)
package io.stereo.server.internal.session;

import edu.umd.cs.findbugs.annotations.DefaultAnnotation;
import edu.umd.cs.findbugs.annotations.DefaultAnnotationForParameters;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.ReturnValuesAreNonnullByDefault;
