/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.config.SessionSettings;
import io.stereo.server.internal.codec.DecodeException;
import io.stereo.server.internal.dispatch.CommandDispatcher;
import io.stereo.server.internal.util.Metrics;
import io.stereo.server.message.Command;
import io.stereo.server.message.Event;
import io.stereo.server.model.TrackCollection;
import io.stereo.server.model.TrackFilter;
import io.stereo.server.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Owns one client session: its queues, its activities and their teardown.
 *
 * <p>Five activities run as siblings on the shared executor. When the receive loop sees the peer
 * go away the session is torn down quietly. When any activity fails, its siblings are cancelled
 * and the socket is closed with {@link SessionTransport#INTERNAL_ERROR}. Either way teardown
 * happens exactly once.</p>
 */
public class SessionSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionSupervisor.class);

    static final String INITIAL_DATA = "initial-data";
    static final String RECEIVE = "receive";
    static final String DISPATCH = "dispatch";
    static final String DEBOUNCE = "debounce";
    static final String BATCH = "batch";

    @FunctionalInterface
    private interface Activity {
        void run() throws Exception;
    }

    private final Session session;
    private final SessionTransport transport;
    private final SessionServices services;
    private final ExecutorService executor;
    private final SessionRoutingTable<BlockingQueue<Command>> inboundTable;
    private final SessionRoutingTable<BlockingQueue<Event>> outboundTable;
    private final Consumer<SessionSupervisor> onClosed;

    private final BlockingQueue<Command> inbound;
    private final BlockingQueue<Event> outbound;
    private final InboundFrameBuffer frameBuffer;
    private final OutboundBatcher batcher;
    private final StateChangeDebouncer debouncer;
    private final SearchTaskSupervisor search;
    private final CommandDispatcher dispatcher;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.Created.INSTANCE);
    private final List<Future<?>> activities = new CopyOnWriteArrayList<>();
    private final CompletableFuture<SessionState.Closed> closeFuture = new CompletableFuture<>();

    /**
     * Builds the session. Nothing touches the catalog store until {@link #start()}.
     */
    public SessionSupervisor(String sessionId,
                             SessionTransport transport,
                             SessionServices services,
                             ExecutorService executor,
                             SessionRoutingTable<BlockingQueue<Command>> inboundTable,
                             SessionRoutingTable<BlockingQueue<Event>> outboundTable,
                             Consumer<SessionSupervisor> onClosed) {
        this.session = new Session(sessionId);
        this.transport = transport;
        this.services = services;
        this.executor = executor;
        this.inboundTable = inboundTable;
        this.outboundTable = outboundTable;
        this.onClosed = onClosed;

        SessionSettings settings = services.settings();
        this.inbound = new ArrayBlockingQueue<>(settings.queueCapacity());
        this.outbound = new ArrayBlockingQueue<>(settings.queueCapacity());
        this.frameBuffer = new InboundFrameBuffer(transport, settings.inboundHighWatermark(), settings.inboundLowWatermark());

        this.batcher = new OutboundBatcher(sessionId, outbound, transport, services.codec(), settings.batchSize(), settings.batchDelay());
        this.debouncer = new StateChangeDebouncer(session, services.store(), outbound, settings.debounceQuietPeriod());
        this.search = new SearchTaskSupervisor(sessionId, executor, services.discovery(), outbound);
        this.dispatcher = new CommandDispatcher(session,
                services.store(),
                services.discovery(),
                services.pathCompletion(),
                search,
                debouncer,
                services.importSources(),
                services.codec(),
                outbound,
                services.clock());
    }

    public String sessionId() {
        return session.id();
    }

    /**
     * Where the transport delivers the text frames it reads.
     */
    public InboundFrameBuffer frameBuffer() {
        return frameBuffer;
    }

    public BlockingQueue<Event> outbound() {
        return outbound;
    }

    public SessionState state() {
        return state.get();
    }

    /**
     * Completes with the closed state once teardown has finished.
     */
    public CompletableFuture<SessionState.Closed> closeFuture() {
        return closeFuture;
    }

    // ==================== Lifecycle ====================

    /**
     * Registers the session and starts its activities.
     *
     * @throws IllegalStateException if the session was already started or closed
     */
    public void start() {
        SessionState current = state.get();
        if (!(current instanceof SessionState.Created created) || !state.compareAndSet(current, created.toRunning())) {
            throw new IllegalStateException("Session " + session.id() + " cannot be started in state " + current);
        }
        inboundTable.register(session.id(), inbound);
        outboundTable.register(session.id(), outbound);
        LOGGER.info("{}: opened session from {}", session.id(), transport.remoteAddress());
        Metrics.sessionsOpenedCounter().withTags().increment();

        launch(INITIAL_DATA, this::sendInitialData);
        launch(RECEIVE, this::receive);
        launch(DISPATCH, () -> dispatcher.run(inbound));
        launch(DEBOUNCE, debouncer::run);
        launch(BATCH, batcher::run);

        if (state.get() instanceof SessionState.Closed) {
            // an activity failed while the others were being launched
            cancelActivities();
        }
    }

    /**
     * Tears the session down without reporting a fault. Used on server shutdown.
     */
    public void close() {
        if (teardown(null)) {
            transport.close(SessionTransport.GOING_AWAY, "server shutting down");
        }
    }

    private void launch(String name, Activity activity) {
        try {
            activities.add(executor.submit(() -> runActivity(name, activity)));
        }
        catch (RejectedExecutionException e) {
            onActivityFailed(name, e);
        }
    }

    private void runActivity(String name, Activity activity) {
        LOGGER.debug("{}: {} started", session.id(), name);
        try {
            activity.run();
            LOGGER.debug("{}: {} finished", session.id(), name);
            if (RECEIVE.equals(name)) {
                onPeerClosed();
            }
        }
        catch (InterruptedException e) {
            if (!(state.get() instanceof SessionState.Closed)) {
                LOGGER.debug("{}: {} interrupted from outside the session", session.id(), name);
                teardown(null);
            }
            Thread.currentThread().interrupt();
        }
        catch (Throwable t) {
            onActivityFailed(name, t);
        }
    }

    private void onPeerClosed() {
        LOGGER.debug("{}: peer closed the connection", session.id());
        teardown(null);
    }

    @VisibleForTesting
    void onActivityFailed(String name, Throwable cause) {
        if (state.get() instanceof SessionState.Closed) {
            LOGGER.debug("{}: {} failed after teardown: {}", session.id(), name, cause.toString());
            return;
        }
        if (cause instanceof IOException && frameBuffer.isPeerClosed()) {
            LOGGER.debug("{}: {} failed after the peer closed: {}", session.id(), name, cause.toString());
            teardown(null);
            return;
        }
        LOGGER.error("{}: {} failed, closing session", session.id(), name, cause);
        teardown(cause);
    }

    // ==================== Activities ====================

    private void sendInitialData() throws InterruptedException {
        outbound.put(new Event.BackendInfo(services.version()));
        services.store().init(services.defaultCollection());
        int size = services.store().count(services.defaultCollection(), TrackFilter.none());
        outbound.put(new Event.DefaultCollection(new TrackCollection(services.defaultCollection(), size)));
    }

    private void receive() throws InterruptedException {
        String text;
        while ((text = frameBuffer.take()) != null) {
            LOGGER.debug("{}: received {}", session.id(), text);
            Command command;
            try {
                command = services.codec().decode(text);
            }
            catch (DecodeException e) {
                LOGGER.warn("{}: dropping frame that could not be decoded: {}", session.id(), e.getMessage());
                Metrics.decodeErrorCounter().withTags().increment();
                continue;
            }
            inbound.put(command);
        }
    }

    // ==================== Teardown ====================

    /**
     * Moves to {@link SessionState.Closed} and releases everything the session holds.
     *
     * @return true if this call did the teardown, false if the session was already closed
     */
    private boolean teardown(@Nullable Throwable cause) {
        SessionState.Closed closed = new SessionState.Closed(cause);
        SessionState current = state.get();
        while (!(current instanceof SessionState.Closed)) {
            if (state.compareAndSet(current, closed)) {
                release(closed);
                return true;
            }
            current = state.get();
        }
        return false;
    }

    private void release(SessionState.Closed closed) {
        cancelActivities();
        search.shutdown();
        inboundTable.deregister(session.id());
        outboundTable.deregister(session.id());
        inbound.clear();
        outbound.clear();
        frameBuffer.clear();
        if (closed.isFault()) {
            transport.close(SessionTransport.INTERNAL_ERROR, "internal error");
            Metrics.sessionFaultCounter().withTags().increment();
        }
        Metrics.sessionsClosedCounter().withTags().increment();
        LOGGER.info("{}: closed session", session.id());
        onClosed.accept(this);
        closeFuture.complete(closed);
    }

    private void cancelActivities() {
        for (Future<?> activity : activities) {
            activity.cancel(true);
        }
    }

    @Override
    public String toString() {
        return "SessionSupervisor{" +
                "session=" + session +
                ", state=" + state.get() +
                '}';
    }
}
