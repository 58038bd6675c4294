/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.util.concurrent.DefaultThreadFactory;

import io.stereo.server.message.Command;
import io.stereo.server.message.Event;

/**
 * Opens sessions and keeps track of the live ones.
 *
 * <p>Owns the two process wide routing tables and the daemon executor every session activity
 * runs on.</p>
 */
public class SessionManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    private static final long DRAIN_POLL_MILLIS = 10;

    private final SessionServices services;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final SessionRoutingTable<BlockingQueue<Command>> inboundTable = new SessionRoutingTable<>("inbound");
    private final SessionRoutingTable<BlockingQueue<Event>> outboundTable = new SessionRoutingTable<>("outbound");
    private final Set<SessionSupervisor> live = ConcurrentHashMap.newKeySet();

    public SessionManager(SessionServices services) {
        this(services, Executors.newCachedThreadPool(new DefaultThreadFactory("stereo-session", true)), true);
    }

    SessionManager(SessionServices services, ExecutorService executor, boolean ownsExecutor) {
        this.services = services;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Creates and starts a session speaking over {@code transport}. The default collection is
     * opened by the session's own activities, never on the caller's thread.
     */
    public SessionSupervisor open(SessionTransport transport) {
        SessionSupervisor supervisor = new SessionSupervisor(UUID.randomUUID().toString(),
                transport,
                services,
                executor,
                inboundTable,
                outboundTable,
                live::remove);
        live.add(supervisor);
        supervisor.start();
        return supervisor;
    }

    /**
     * Puts {@code event} on the outbound queue of every registered session.
     */
    public void broadcast(Event event) throws InterruptedException {
        for (BlockingQueue<Event> queue : outboundTable.targets()) {
            queue.put(event);
        }
        LOGGER.debug("broadcast {} to {} sessions", event, outboundTable.size());
    }

    /**
     * Waits until every outbound queue has been taken by its batcher, and then one batch delay
     * more so the last batch is written.
     *
     * @return true if the queues drained within {@code timeout}
     */
    public boolean awaitOutboundDrained(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (outboundTable.targets().stream().anyMatch(queue -> !queue.isEmpty())) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(DRAIN_POLL_MILLIS);
        }
        TimeUnit.NANOSECONDS.sleep(services.settings().batchDelay().toNanos());
        return true;
    }

    /**
     * Tears down every live session and, if this manager created it, stops the executor.
     */
    @Override
    public void close() {
        List<SessionSupervisor> sessions = List.copyOf(live);
        LOGGER.info("closing {} sessions", sessions.size());
        for (SessionSupervisor session : sessions) {
            session.close();
        }
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    public SessionRoutingTable<BlockingQueue<Command>> inboundTable() {
        return inboundTable;
    }

    public SessionRoutingTable<BlockingQueue<Event>> outboundTable() {
        return outboundTable;
    }

    public int liveSessions() {
        return live.size();
    }
}
