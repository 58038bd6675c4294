/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.discovery;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.model.Track;
import io.stereo.server.service.DiscoveryProvider;

/**
 * Locates the {@link DiscoveryProvider} to use.
 */
public final class DiscoveryProviders {

    private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryProviders.class);

    private DiscoveryProviders() {
    }

    /**
     * Returns the first provider registered with {@link ServiceLoader}, or a provider that never
     * finds anything when none is installed.
     */
    public static DiscoveryProvider load() {
        return load(ServiceLoader.load(DiscoveryProvider.class).stream().map(ServiceLoader.Provider::get).toList());
    }

    static DiscoveryProvider load(List<DiscoveryProvider> found) {
        if (found.isEmpty()) {
            LOGGER.warn("No discovery provider installed, searches will return no results");
            return empty();
        }
        DiscoveryProvider provider = found.get(0);
        if (found.size() > 1) {
            LOGGER.warn("{} discovery providers installed, using {}", found.size(), provider.getClass().getName());
        }
        else {
            LOGGER.info("Using discovery provider {}", provider.getClass().getName());
        }
        return provider;
    }

    public static DiscoveryProvider empty() {
        return EmptyDiscoveryProvider.INSTANCE;
    }

    private enum EmptyDiscoveryProvider implements DiscoveryProvider {
        INSTANCE;

        @Override
        public Stream<Track> searchFuzzy(String query) {
            return Stream.empty();
        }

        @Override
        public Stream<Track> searchByArtist(String name) {
            return Stream.empty();
        }

        @Override
        public Stream<Track> searchByLabel(String name) {
            return Stream.empty();
        }
    }
}
