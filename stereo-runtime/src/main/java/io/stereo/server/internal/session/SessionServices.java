/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

import io.stereo.server.config.SessionSettings;
import io.stereo.server.internal.codec.MessageCodec;
import io.stereo.server.internal.dispatch.ImportSourceResolver;
import io.stereo.server.service.CatalogStore;
import io.stereo.server.service.DiscoveryProvider;
import io.stereo.server.service.PathCompletion;

/**
 * Collaborators shared by every session of one server.
 *
 * @param store catalog store for all collections
 * @param discovery source of search results
 * @param pathCompletion completes collection paths typed by the user
 * @param importSources resolves the sources of {@code import-from}
 * @param codec wire codec
 * @param defaultCollection the collection every session is offered on connect
 * @param version server version reported in {@code backend-info}
 * @param settings per session queue, batching and debounce settings
 * @param clock clock used to stamp plays
 */
public record SessionServices(CatalogStore store,
                              DiscoveryProvider discovery,
                              PathCompletion pathCompletion,
                              ImportSourceResolver importSources,
                              MessageCodec codec,
                              Path defaultCollection,
                              String version,
                              SessionSettings settings,
                              Clock clock) {

    public SessionServices {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(discovery, "discovery");
        Objects.requireNonNull(pathCompletion, "pathCompletion");
        Objects.requireNonNull(importSources, "importSources");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(defaultCollection, "defaultCollection");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(clock, "clock");
    }
}
