/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.pgdispatch.core.registry;

import dev.mars.pgdispatch.api.tagger.ConnectTagger;
import dev.mars.pgdispatch.api.tagger.ConnectionLostTagger;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory state of one dispatcher: connection entries by id, the active LISTEN per
 * connection, and the next id to allocate.
 *
 * <p>One registry exists per running dispatcher and is owned by its context. Nothing in
 * here is synchronized; every caller runs on the dispatcher context.</p>
 *
 * @param <M> The application message type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class ConnectionRegistry<M> {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<Integer, ConnectionState<M>> connections = new TreeMap<>();
    private final Map<Integer, ListenerState<M>> activeListeners = new TreeMap<>();
    private int nextConnectionId = 1;

    /**
     * Allocates a fresh id and registers a connection entry with no handles.
     *
     * @return The new entry
     */
    public ConnectionState<M> register(ErrorTagger<M> errorTagger, ConnectTagger<M> connectTagger,
                                       ConnectionLostTagger<M> connectionLostTagger) {
        int connectionId = nextConnectionId++;
        ConnectionState<M> state = new ConnectionState<>(connectionId, errorTagger, connectTagger, connectionLostTagger);
        connections.put(connectionId, state);
        logger.debug("Registered connection {}", connectionId);
        return state;
    }

    public Optional<ConnectionState<M>> find(int connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public boolean contains(int connectionId) {
        return connections.containsKey(connectionId);
    }

    /**
     * Removes a connection and its active LISTEN entry.
     *
     * @return The removed entry, or empty if the id was not registered
     */
    public Optional<ConnectionState<M>> remove(int connectionId) {
        ConnectionState<M> removed = connections.remove(connectionId);
        if (removed != null) {
            activeListeners.remove(connectionId);
            logger.debug("Removed connection {}", connectionId);
        }
        return Optional.ofNullable(removed);
    }

    public Collection<ConnectionState<M>> connections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public int size() {
        return connections.size();
    }

    public Map<Integer, ListenerState<M>> activeListeners() {
        return Collections.unmodifiableMap(activeListeners);
    }

    /**
     * Replaces the whole active LISTEN set, as computed by one reconciliation cycle.
     */
    public void replaceActiveListeners(Map<Integer, ListenerState<M>> listeners) {
        activeListeners.clear();
        activeListeners.putAll(listeners);
    }

    /**
     * Drops the active LISTEN of a connection if it is still on {@code channel}.
     */
    public void dropActiveListener(int connectionId, String channel) {
        ListenerState<M> current = activeListeners.get(connectionId);
        if (current != null && current.channel().equals(channel)) {
            activeListeners.remove(connectionId);
            logger.debug("Dropped active listener on channel '{}' for connection {}", channel, connectionId);
        }
    }

    /**
     * Clears all state. The id counter keeps counting so ids stay unique for the dispatcher's lifetime.
     */
    public void clear() {
        connections.clear();
        activeListeners.clear();
    }

    /**
     * Diagnostic view of the registry used in logs and invariant failure reports.
     */
    public JsonObject snapshot() {
        JsonArray connectionArray = new JsonArray();
        connections.values().forEach(state -> connectionArray.add(state.toJson()));
        JsonObject listeners = new JsonObject();
        activeListeners.forEach((id, listener) -> listeners.put(String.valueOf(id), listener.channel()));
        return new JsonObject()
            .put("nextConnectionId", nextConnectionId)
            .put("connections", connectionArray)
            .put("activeListeners", listeners);
    }
}
