/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Hands frames from the transport's I/O thread to the session's receive loop.
 *
 * <p>The I/O thread must never block, so the buffer itself is unbounded. Instead, once
 * {@code highWatermark} frames are waiting the transport stops reading from the socket, and it
 * resumes when the receive loop has drained the buffer down to {@code lowWatermark}. No frame is
 * ever dropped.</p>
 */
public class InboundFrameBuffer {

    private static final Logger LOGGER = LoggerFactory.getLogger(InboundFrameBuffer.class);

    private sealed interface InboundFrame permits Text, PeerClosed {
    }

    private record Text(String text) implements InboundFrame {
    }

    private record PeerClosed() implements InboundFrame {
        private static final PeerClosed INSTANCE = new PeerClosed();
    }

    private final LinkedBlockingQueue<InboundFrame> frames = new LinkedBlockingQueue<>();
    private final SessionTransport transport;
    private final int highWatermark;
    private final int lowWatermark;
    private volatile boolean peerGone;

    // guarded by this
    private boolean readsPaused;

    public InboundFrameBuffer(SessionTransport transport, int highWatermark, int lowWatermark) {
        if (lowWatermark < 0 || highWatermark <= lowWatermark) {
            throw new IllegalArgumentException("watermarks must satisfy 0 <= low < high");
        }
        this.transport = transport;
        this.highWatermark = highWatermark;
        this.lowWatermark = lowWatermark;
    }

    /**
     * Appends a text frame. Called from the transport's I/O thread; never blocks.
     */
    public void append(String text) {
        frames.add(new Text(text));
        synchronized (this) {
            if (!readsPaused && frames.size() >= highWatermark) {
                readsPaused = true;
                LOGGER.debug("{} frames waiting, pausing reads from {}", frames.size(), transport.remoteAddress());
                transport.pauseReading();
            }
        }
    }

    /**
     * Marks the end of the stream: the peer has gone away.
     */
    public void peerClosed() {
        peerGone = true;
        frames.add(PeerClosed.INSTANCE);
    }

    /**
     * Whether {@link #peerClosed()} has been called, even if frames before the marker are still waiting.
     */
    public boolean isPeerClosed() {
        return peerGone;
    }

    /**
     * Takes the next frame, waiting if there is none.
     *
     * @return the frame text, or {@code null} once the peer has closed
     */
    @Nullable
    public String take() throws InterruptedException {
        InboundFrame frame = frames.take();
        synchronized (this) {
            if (readsPaused && frames.size() <= lowWatermark) {
                readsPaused = false;
                LOGGER.debug("Resuming reads from {}", transport.remoteAddress());
                transport.resumeReading();
            }
        }
        if (frame instanceof Text text) {
            return text.text();
        }
        // keep the marker for any later caller
        frames.add(frame);
        return null;
    }

    public void clear() {
        frames.clear();
    }

    @VisibleForTesting
    synchronized boolean isReadingPaused() {
        return readsPaused;
    }

    @VisibleForTesting
    int size() {
        return frames.size();
    }
}
