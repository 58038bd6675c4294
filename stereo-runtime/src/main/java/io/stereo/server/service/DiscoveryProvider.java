/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.service;

import java.util.stream.Stream;

import io.stereo.server.model.SearchKind;
import io.stereo.server.model.Track;

/**
 * Source of candidate tracks from external catalogs.
 *
 * <p>Each method returns a lazy, finite stream that can be consumed once. Consumers must close
 * the stream. Network failures may surface as runtime exceptions while the stream is consumed,
 * after some tracks have already been produced.</p>
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}.</p>
 */
public interface DiscoveryProvider {

    Stream<Track> searchFuzzy(String query);

    Stream<Track> searchByArtist(String name);

    Stream<Track> searchByLabel(String name);

    default Stream<Track> search(SearchKind kind, String query) {
        return switch (kind) {
            case FUZZY -> searchFuzzy(query);
            case BY_ARTIST -> searchByArtist(query);
            case BY_LABEL -> searchByLabel(query);
        };
    }
}
