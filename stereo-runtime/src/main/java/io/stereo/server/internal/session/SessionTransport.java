/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.io.IOException;

/**
 * The connection a session talks to its client over.
 *
 * <p>Inbound frames are pushed into the session's {@link InboundFrameBuffer} by the transport itself;
 * this interface covers the session's side: writing frames, throttling reads and closing.</p>
 */
public interface SessionTransport {

    /** WebSocket close status for an unexpected server error. */
    int INTERNAL_ERROR = 1011;

    /** WebSocket close status for a server going away. */
    int GOING_AWAY = 1001;

    /**
     * Describes the peer, for logging.
     */
    String remoteAddress();

    /**
     * Writes one text frame and blocks until it has been written.
     *
     * @throws IOException if the frame could not be written
     */
    void send(String text) throws IOException, InterruptedException;

    /**
     * Stops reading from the peer until {@link #resumeReading()}.
     */
    void pauseReading();

    void resumeReading();

    /**
     * Closes the connection with a WebSocket close status. Does not block.
     */
    void close(int statusCode, String reason);
}
