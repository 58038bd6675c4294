/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.stereo.server.message.Event;
import io.stereo.server.model.Severity;
import io.stereo.server.model.TrackCollection;
import io.stereo.server.model.TrackFilter;
import io.stereo.server.service.CatalogStore;
import io.stereo.server.service.CatalogStoreException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.type;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StateChangeDebouncerTest {

    private static final Path COLLECTION = Path.of("/music/stereo.db");

    @Mock
    private CatalogStore store;

    private final Session session = new Session("s1");
    private final BlockingQueue<Event> outbound = new ArrayBlockingQueue<>(100);
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void shouldCollapseBurstOfSignalsIntoOneRefresh() throws Exception {
        // Given
        session.replaceCollection(new TrackCollection(COLLECTION, 1));
        when(store.count(COLLECTION, TrackFilter.none())).thenReturn(5);
        StateChangeDebouncer debouncer = new StateChangeDebouncer(session, store, outbound, Duration.ofMillis(200));

        // When
        for (int i = 0; i < 10; i++) {
            debouncer.signal();
        }
        debouncer.awaitAndRefresh();

        // Then
        assertThat(outbound).singleElement()
                .isEqualTo(Event.CollectionInfo.of(null, new TrackCollection(COLLECTION, 5)));
        assertThat(session.collection()).isEqualTo(new TrackCollection(COLLECTION, 5));
        verify(store, times(1)).count(COLLECTION, TrackFilter.none());
    }

    @Test
    void shouldAbsorbSignalsRaisedDuringQuietPeriod() throws Exception {
        // Given
        session.replaceCollection(new TrackCollection(COLLECTION, 0));
        when(store.count(COLLECTION, TrackFilter.none())).thenReturn(3);
        StateChangeDebouncer debouncer = new StateChangeDebouncer(session, store, outbound, Duration.ofMillis(300));
        executor.submit(() -> {
            debouncer.run();
            return null;
        });

        // When
        debouncer.signal();
        TimeUnit.MILLISECONDS.sleep(100);
        debouncer.signal();
        debouncer.signal();

        // Then
        assertThat(outbound.poll(5, TimeUnit.SECONDS)).isInstanceOf(Event.CollectionInfo.class);
        assertThat(outbound.poll(600, TimeUnit.MILLISECONDS)).isNull();
        verify(store, times(1)).count(any(), any());
    }

    @Test
    void shouldRefreshAgainForSignalAfterRefresh() throws Exception {
        // Given
        session.replaceCollection(new TrackCollection(COLLECTION, 0));
        when(store.count(COLLECTION, TrackFilter.none())).thenReturn(1, 2);
        StateChangeDebouncer debouncer = new StateChangeDebouncer(session, store, outbound, Duration.ZERO);
        debouncer.signal();
        debouncer.awaitAndRefresh();

        // When
        debouncer.signal();
        debouncer.awaitAndRefresh();

        // Then
        assertThat(outbound).extracting(event -> ((Event.CollectionInfo) event).collection().size())
                .containsExactly(1, 2);
    }

    @Test
    void shouldSendNothingWithoutActiveCollection() throws Exception {
        // Given
        StateChangeDebouncer debouncer = new StateChangeDebouncer(session, store, outbound, Duration.ZERO);

        // When
        debouncer.signal();
        debouncer.awaitAndRefresh();

        // Then
        assertThat(outbound).isEmpty();
        verifyNoInteractions(store);
    }

    @Test
    void shouldWarnWhenCollectionCannotBeCounted() throws Exception {
        // Given
        session.replaceCollection(new TrackCollection(COLLECTION, 4));
        when(store.count(COLLECTION, TrackFilter.none())).thenThrow(new CatalogStoreException("disk I/O error"));
        StateChangeDebouncer debouncer = new StateChangeDebouncer(session, store, outbound, Duration.ZERO);

        // When
        debouncer.signal();
        debouncer.awaitAndRefresh();

        // Then
        assertThat(outbound).singleElement()
                .asInstanceOf(type(Event.Notification.class))
                .extracting(Event.Notification::kind)
                .isEqualTo(Severity.WARN);
        assertThat(session.collection()).isEqualTo(new TrackCollection(COLLECTION, 4));
    }
}
