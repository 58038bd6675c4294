/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.message.Event;
import io.stereo.server.model.TrackCollection;
import io.stereo.server.model.TrackFilter;
import io.stereo.server.service.CatalogStore;
import io.stereo.server.service.CatalogStoreException;
import io.stereo.server.tag.VisibleForTesting;

/**
 * Turns bursts of collection changes into a single refreshed {@code collection-info} event.
 *
 * <p>After the first {@link #signal()} the loop waits a quiet period; every signal raised during
 * that period is absorbed into the same refresh. The refresh re-counts the active collection and
 * sends it to the client. Without an active collection nothing is sent.</p>
 */
public class StateChangeDebouncer {

    private static final Logger LOGGER = LoggerFactory.getLogger(StateChangeDebouncer.class);

    private final Session session;
    private final CatalogStore store;
    private final BlockingQueue<Event> outbound;
    private final long quietPeriodNanos;

    // set while a refresh is pending; at most one permit is ever available
    private final AtomicBoolean pending = new AtomicBoolean();
    private final Semaphore signalled = new Semaphore(0);

    public StateChangeDebouncer(Session session, CatalogStore store, BlockingQueue<Event> outbound, Duration quietPeriod) {
        this.session = session;
        this.store = store;
        this.outbound = outbound;
        this.quietPeriodNanos = quietPeriod.toNanos();
    }

    /**
     * Requests a refresh. Cheap, idempotent and callable from any thread.
     */
    public void signal() {
        if (pending.compareAndSet(false, true)) {
            signalled.release();
        }
    }

    /**
     * Runs until interrupted.
     */
    public void run() throws InterruptedException {
        while (true) {
            awaitAndRefresh();
        }
    }

    @VisibleForTesting
    void awaitAndRefresh() throws InterruptedException {
        signalled.acquire();
        TimeUnit.NANOSECONDS.sleep(quietPeriodNanos);
        pending.set(false);
        refresh();
    }

    private void refresh() throws InterruptedException {
        TrackCollection current = session.collection();
        if (current == null) {
            return;
        }
        TrackCollection refreshed;
        try {
            refreshed = current.withSize(store.count(current.path(), TrackFilter.none()));
        }
        catch (CatalogStoreException e) {
            LOGGER.warn("{}: cannot refresh collection {}: {}", session.id(), current.path(), e.getMessage());
            outbound.put(Event.Notification.warn("could not refresh collection " + current.path() + ": " + e.getMessage()));
            return;
        }
        if (session.compareAndSetCollection(current, refreshed)) {
            LOGGER.debug("{}: collection {} has {} tracks", session.id(), refreshed.path(), refreshed.size());
            outbound.put(Event.CollectionInfo.of(null, refreshed));
        }
        else {
            // switched while counting; the switch raised its own signal
            LOGGER.debug("{}: collection changed during refresh", session.id());
        }
    }
}
