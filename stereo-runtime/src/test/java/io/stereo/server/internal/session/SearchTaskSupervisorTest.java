/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.stereo.server.message.Event;
import io.stereo.server.model.SearchKind;
import io.stereo.server.model.Severity;
import io.stereo.server.model.Track;
import io.stereo.server.service.DiscoveryProvider;

import static org.assertj.core.api.Assertions.assertThat;

class SearchTaskSupervisorTest {

    private final BlockingQueue<Event> outbound = new LinkedBlockingQueue<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final FakeDiscovery discovery = new FakeDiscovery();
    private final SearchTaskSupervisor search = new SearchTaskSupervisor("s1", executor, discovery, outbound);

    @AfterEach
    void tearDown() {
        search.shutdown();
        executor.shutdownNow();
    }

    @Test
    void shouldStopAtLimit() throws Exception {
        // Given
        discovery.results = 10;

        // When
        search.start("jungle", SearchKind.FUZZY, 3, 1);

        // Then
        List<Event> events = eventsUntilComplete(1);
        assertThat(events).hasSize(4);
        assertThat(events.subList(0, 3)).allMatch(event -> event instanceof Event.SearchResult result && result.queryId() == 1);
        assertThat(events.get(3)).isEqualTo(new Event.SearchComplete(1));
    }

    @Test
    void shouldCompleteSupersededSearchBeforeNextStarts() throws Exception {
        // Given
        discovery.endless = true;
        search.start("endless", SearchKind.FUZZY, 100_000, 1);
        TimeUnit.MILLISECONDS.sleep(50);

        // When
        discovery.endless = false;
        discovery.results = 2;
        search.start("short", SearchKind.BY_ARTIST, 10, 2);

        // Then
        List<Event> events = eventsUntilComplete(2);
        int firstCompletion = events.indexOf(new Event.SearchComplete(1));
        assertThat(firstCompletion).isNotNegative();
        assertThat(events.stream().filter(new Event.SearchComplete(1)::equals)).hasSize(1);
        assertThat(events.subList(firstCompletion + 1, events.size()))
                .allMatch(event -> !(event instanceof Event.SearchResult result) || result.queryId() == 2);
        assertThat(events.stream().filter(event -> event instanceof Event.SearchResult result && result.queryId() == 2))
                .hasSize(2);
        assertThat(discovery.lastKind).isEqualTo(SearchKind.BY_ARTIST);
    }

    @Test
    void shouldCompleteCancelledSearchExactlyOnce() throws Exception {
        // Given
        discovery.endless = true;
        search.start("endless", SearchKind.FUZZY, 100_000, 5);

        // When
        search.cancelAll();

        // Then
        assertThat(search.isSearching()).isFalse();
        List<Event> events = new ArrayList<>();
        outbound.drainTo(events);
        assertThat(events.stream().filter(event -> event instanceof Event.SearchComplete)).containsExactly(new Event.SearchComplete(5));
        assertThat(events.get(events.size() - 1)).isEqualTo(new Event.SearchComplete(5));
        assertThat(outbound.poll(100, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void shouldReportProviderFailureThenComplete() throws Exception {
        // Given
        discovery.results = 2;
        discovery.failAfterResults = true;

        // When
        search.start("flaky", SearchKind.BY_LABEL, 10, 3);

        // Then
        List<Event> events = eventsUntilComplete(3);
        assertThat(events).hasSize(4);
        assertThat(events.get(2)).isInstanceOfSatisfying(Event.Notification.class,
                notification -> assertThat(notification.kind()).isEqualTo(Severity.ERROR));
        assertThat(events.get(3)).isEqualTo(new Event.SearchComplete(3));
    }

    @Test
    void shouldReportProviderErrorThenComplete() throws Exception {
        // Given
        discovery.results = 1;
        discovery.failAfterResults = true;
        discovery.error = new StackOverflowError("recursive page");

        // When
        search.start("deep", SearchKind.FUZZY, 10, 6);

        // Then
        List<Event> events = eventsUntilComplete(6);
        assertThat(events).hasSize(3);
        assertThat(events.get(1)).isInstanceOfSatisfying(Event.Notification.class,
                notification -> assertThat(notification.kind()).isEqualTo(Severity.ERROR));
        assertThat(events.get(2)).isEqualTo(new Event.SearchComplete(6));
    }

    @Test
    void shouldCompleteBlankQueryWithoutSearching() throws Exception {
        // When
        search.start("   ", SearchKind.FUZZY, 10, 9);

        // Then
        assertThat(outbound).containsExactly(new Event.SearchComplete(9));
        assertThat(discovery.calls).hasValue(0);
    }

    @Test
    void shouldIgnoreStartAfterShutdown() throws Exception {
        // Given
        search.shutdown();

        // When
        search.start("anything", SearchKind.FUZZY, 10, 4);

        // Then
        assertThat(outbound).isEmpty();
        assertThat(discovery.calls).hasValue(0);
    }

    @Test
    void shouldDoNothingWhenCancellingWithoutSearch() throws Exception {
        // When
        search.cancelAll();

        // Then
        assertThat(outbound).isEmpty();
    }

    private List<Event> eventsUntilComplete(int queryId) throws InterruptedException {
        List<Event> events = new ArrayList<>();
        Event complete = new Event.SearchComplete(queryId);
        while (true) {
            Event event = outbound.poll(5, TimeUnit.SECONDS);
            assertThat(event).describedAs("events so far: %s", events).isNotNull();
            events.add(event);
            if (complete.equals(event)) {
                return events;
            }
        }
    }

    private static final class FakeDiscovery implements DiscoveryProvider {

        final AtomicInteger calls = new AtomicInteger();
        volatile int results;
        volatile boolean endless;
        volatile boolean failAfterResults;
        volatile Error error;
        volatile SearchKind lastKind;

        @Override
        public Stream<Track> searchFuzzy(String query) {
            return search(SearchKind.FUZZY);
        }

        @Override
        public Stream<Track> searchByArtist(String name) {
            return search(SearchKind.BY_ARTIST);
        }

        @Override
        public Stream<Track> searchByLabel(String name) {
            return search(SearchKind.BY_LABEL);
        }

        private Stream<Track> search(SearchKind kind) {
            calls.incrementAndGet();
            lastKind = kind;
            if (endless) {
                AtomicInteger counter = new AtomicInteger();
                return Stream.generate(() -> {
                    try {
                        TimeUnit.MILLISECONDS.sleep(5);
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return track(counter.incrementAndGet());
                });
            }
            List<Track> tracks = IntStream.range(0, results).mapToObj(SearchTaskSupervisorTest::track).toList();
            if (!failAfterResults) {
                return tracks.stream();
            }
            Iterator<Track> failing = new Iterator<>() {
                private final Iterator<Track> delegate = tracks.iterator();

                @Override
                public boolean hasNext() {
                    if (!delegate.hasNext()) {
                        if (error != null) {
                            throw error;
                        }
                        throw new IllegalStateException("catalog unavailable");
                    }
                    return true;
                }

                @Override
                public Track next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return delegate.next();
                }
            };
            return StreamSupport.stream(((Iterable<Track>) () -> failing).spliterator(), false);
        }
    }

    private static Track track(int i) {
        return Track.of("id-" + i, "Track " + i, List.of("Artist"));
    }
}
