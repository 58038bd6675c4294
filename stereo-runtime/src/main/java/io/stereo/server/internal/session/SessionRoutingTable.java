/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.session;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process wide map from session id to one of the session's queues.
 *
 * <p>Only the owning session adds or removes its entry, once each, so the map needs no locking
 * beyond its own.</p>
 *
 * @param <T> the kind of queue routed to
 */
public class SessionRoutingTable<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRoutingTable.class);

    private final String name;
    private final ConcurrentMap<String, T> entries = new ConcurrentHashMap<>();

    public SessionRoutingTable(String name) {
        this.name = name;
    }

    /**
     * @throws IllegalStateException if the session is already registered
     */
    public void register(String sessionId, T target) {
        if (entries.putIfAbsent(sessionId, target) != null) {
            throw new IllegalStateException("Session " + sessionId + " already registered in " + name + " table");
        }
        LOGGER.trace("{}: registered in {} table", sessionId, name);
    }

    /**
     * @return whether an entry was removed
     */
    public boolean deregister(String sessionId) {
        boolean removed = entries.remove(sessionId) != null;
        LOGGER.trace("{}: deregistered from {} table: {}", sessionId, name, removed);
        return removed;
    }

    public Optional<T> lookup(String sessionId) {
        return Optional.ofNullable(entries.get(sessionId));
    }

    public boolean contains(String sessionId) {
        return entries.containsKey(sessionId);
    }

    public Set<String> sessionIds() {
        return Set.copyOf(entries.keySet());
    }

    public Collection<T> targets() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }
}
