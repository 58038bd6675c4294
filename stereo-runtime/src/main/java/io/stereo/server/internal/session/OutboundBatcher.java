/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;

import io.stereo.server.internal.codec.MessageCodec;
import io.stereo.server.internal.util.Metrics;
import io.stereo.server.message.Event;

/**
 * Drains a session's outbound queue to its transport in batches.
 *
 * <p>A batch is written as soon as it holds {@code maxBatchSize} events, or {@code maxDelay} after its
 * first event arrived, whichever comes first. Writes block until the transport has written the
 * frame, so a slow client fills the queue and producers then block on it. Events are written in
 * queue order.</p>
 */
public class OutboundBatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutboundBatcher.class);

    private static final int LOGGED_TEXT_LENGTH = 500;

    private final String sessionId;
    private final BlockingQueue<Event> queue;
    private final SessionTransport transport;
    private final MessageCodec codec;
    private final int maxBatchSize;
    private final long maxDelayNanos;

    private final Counter eventsFlushedCounter;
    private final Timer flushTimer;

    public OutboundBatcher(String sessionId,
                           BlockingQueue<Event> queue,
                           SessionTransport transport,
                           MessageCodec codec,
                           int maxBatchSize,
                           Duration maxDelay) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        this.sessionId = sessionId;
        this.queue = queue;
        this.transport = transport;
        this.codec = codec;
        this.maxBatchSize = maxBatchSize;
        this.maxDelayNanos = maxDelay.toNanos();
        this.eventsFlushedCounter = Metrics.eventsFlushedCounter().withTags();
        this.flushTimer = Metrics.flushTimer().withTags();
    }

    /**
     * Runs until interrupted or until a write fails.
     *
     * @throws IOException if a batch could not be written; the session cannot continue
     */
    public void run() throws InterruptedException, IOException {
        List<Event> batch = new ArrayList<>(maxBatchSize);
        long deadline = 0;
        while (true) {
            Event event;
            if (batch.isEmpty()) {
                event = queue.take();
                deadline = System.nanoTime() + maxDelayNanos;
            }
            else {
                long remaining = deadline - System.nanoTime();
                event = remaining > 0 ? queue.poll(remaining, TimeUnit.NANOSECONDS) : null;
            }

            if (event != null) {
                batch.add(event);
                if (batch.size() < maxBatchSize) {
                    continue;
                }
            }
            // full, or the oldest event has waited maxDelay
            flush(batch);
        }
    }

    private void flush(List<Event> batch) throws InterruptedException, IOException {
        String text = codec.encodeBatch(batch);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{}: sending {} events: {}", sessionId, batch.size(),
                    text.length() > LOGGED_TEXT_LENGTH ? text.substring(0, LOGGED_TEXT_LENGTH) + "..." : text);
        }
        Timer.Sample sample = Timer.start();
        transport.send(text);
        sample.stop(flushTimer);
        eventsFlushedCounter.increment(batch.size());
        batch.clear();
    }
}
