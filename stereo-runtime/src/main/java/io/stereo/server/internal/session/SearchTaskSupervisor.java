/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.util.Iterator;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.message.Event;
import io.stereo.server.model.SearchKind;
import io.stereo.server.model.Track;
import io.stereo.server.service.DiscoveryProvider;
import io.stereo.server.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Runs at most one discovery search per session.
 *
 * <p>A search streams {@code search-result} events for up to {@code limit} tracks and then exactly one
 * {@code search-complete}, whether it ran to the end, failed or was cancelled. Starting a search
 * supersedes the running one: the old job is cancelled and has terminated, completion included,
 * before the new one is launched.</p>
 *
 * <p>{@link #start} and {@link #cancelAll} are called by the session's dispatcher only.
 * {@link #shutdown} may be called from any thread.</p>
 */
public class SearchTaskSupervisor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SearchTaskSupervisor.class);

    private final String sessionId;
    private final ExecutorService executor;
    private final DiscoveryProvider provider;
    private final BlockingQueue<Event> outbound;

    private final AtomicReference<SearchJob> current = new AtomicReference<>();
    private volatile boolean shutdown;

    public SearchTaskSupervisor(String sessionId, ExecutorService executor, DiscoveryProvider provider, BlockingQueue<Event> outbound) {
        this.sessionId = sessionId;
        this.executor = executor;
        this.provider = provider;
        this.outbound = outbound;
    }

    /**
     * Cancels the running search, waits for it to finish and launches a new one. An empty query
     * only cancels, and completes the new query id straight away.
     */
    public void start(String query, SearchKind kind, int limit, int queryId) throws InterruptedException {
        cancelAll();
        if (shutdown) {
            return;
        }
        if (query.isBlank()) {
            outbound.put(new Event.SearchComplete(queryId));
            return;
        }
        SearchJob job = new SearchJob(query, kind, limit, queryId);
        current.set(job);
        job.launch();
        if (shutdown) {
            // lost a race with shutdown()
            job.cancel();
        }
    }

    /**
     * Cancels the running search, if any, and waits until it has emitted its completion.
     */
    public void cancelAll() throws InterruptedException {
        SearchJob job = current.getAndSet(null);
        if (job != null) {
            job.cancel();
            job.awaitTermination();
        }
    }

    /**
     * Cancels the running search without waiting. No search can be started afterwards.
     */
    public void shutdown() {
        shutdown = true;
        SearchJob job = current.getAndSet(null);
        if (job != null) {
            job.cancel();
        }
    }

    @VisibleForTesting
    boolean isSearching() {
        SearchJob job = current.get();
        return job != null && job.terminated.getCount() > 0;
    }

    private final class SearchJob {

        private final String query;
        private final SearchKind kind;
        private final int limit;
        private final int queryId;

        // whoever flips this runs the job: the worker, or a canceller that got there first
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CountDownLatch terminated = new CountDownLatch(1);
        private volatile boolean cancelled;
        private volatile @Nullable Future<?> future;

        private SearchJob(String query, SearchKind kind, int limit, int queryId) {
            this.query = query;
            this.kind = kind;
            this.limit = limit;
            this.queryId = queryId;
        }

        private void launch() {
            future = executor.submit(this::run);
        }

        private void cancel() {
            cancelled = true;
            if (claimed.compareAndSet(false, true)) {
                // never started: complete on its behalf
                Future<?> f = future;
                if (f != null) {
                    f.cancel(false);
                }
                LOGGER.debug("{}: search {} cancelled before it started", sessionId, queryId);
                finish(null);
            }
            else {
                Future<?> f = future;
                if (f != null) {
                    f.cancel(true);
                }
            }
        }

        private void awaitTermination() throws InterruptedException {
            terminated.await();
        }

        private void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            LOGGER.debug("{}: search {} started ({} '{}', limit {})", sessionId, queryId, kind.tag(), query, limit);
            Throwable failure = null;
            int produced = 0;
            try (Stream<Track> results = provider.search(kind, query)) {
                Iterator<Track> tracks = results.iterator();
                while (produced < limit && tracks.hasNext()) {
                    Track track = tracks.next();
                    if (Thread.currentThread().isInterrupted()) {
                        throw new InterruptedException();
                    }
                    outbound.put(new Event.SearchResult(queryId, track));
                    produced++;
                }
                LOGGER.debug("{}: search {} produced {} results", sessionId, queryId, produced);
            }
            catch (InterruptedException e) {
                LOGGER.debug("{}: search {} cancelled after {} results", sessionId, queryId, produced);
            }
            catch (RuntimeException | Error e) {
                if (cancelled) {
                    LOGGER.debug("{}: search {} failed while cancelled: {}", sessionId, queryId, e.toString());
                }
                else {
                    LOGGER.warn("{}: search {} failed after {} results", sessionId, queryId, produced, e);
                    failure = e;
                }
            }
            finally {
                finish(failure);
            }
        }

        /**
         * Emits the failure notification, if any, and the completion. Runs exactly once per job.
         */
        private void finish(@Nullable Throwable failure) {
            boolean interrupted = Thread.interrupted();
            try {
                if (failure != null) {
                    emit(Event.Notification.error("search failed: " + failure.getMessage()));
                }
                emit(new Event.SearchComplete(queryId));
            }
            catch (InterruptedException e) {
                interrupted = true;
                LOGGER.debug("{}: completion of search {} abandoned", sessionId, queryId);
            }
            finally {
                terminated.countDown();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        private void emit(Event event) throws InterruptedException {
            if (shutdown) {
                // nobody drains the queue any more
                outbound.offer(event);
            }
            else {
                outbound.put(event);
            }
        }
    }
}
