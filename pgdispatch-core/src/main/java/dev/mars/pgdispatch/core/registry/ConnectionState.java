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

import dev.mars.pgdispatch.api.driver.ClientHandle;
import dev.mars.pgdispatch.api.driver.CursorHandle;
import dev.mars.pgdispatch.api.driver.ListenChannelHandle;
import dev.mars.pgdispatch.api.tagger.ConnectTagger;
import dev.mars.pgdispatch.api.tagger.ConnectionLostTagger;
import dev.mars.pgdispatch.api.tagger.DisconnectTagger;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.api.tagger.ExecuteTagger;
import dev.mars.pgdispatch.api.tagger.ListenTagger;
import dev.mars.pgdispatch.api.tagger.NotificationTagger;
import dev.mars.pgdispatch.api.tagger.QueryTagger;
import io.vertx.core.json.JsonObject;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * Registry entry for one logical database connection.
 *
 * <p>Holds the native handles the driver returned for this connection and the taggers
 * recorded by the last command of each kind, which tell the completion router how to
 * turn the next completion into an application message. Instances are only touched on
 * the dispatcher context and are not thread-safe.</p>
 *
 * @param <M> The application message type
 */
public class ConnectionState<M> {

    private final int connectionId;
    private final ConnectTagger<M> connectTagger;
    private final ConnectionLostTagger<M> connectionLostTagger;

    private ErrorTagger<M> errorTagger;
    private DisconnectTagger<M> disconnectTagger;
    private QueryTagger<M> queryTagger;
    private ExecuteTagger<M> executeTagger;
    private NotificationTagger<M> notificationTagger;
    private ListenTagger<M> listenTagger;

    private ClientHandle client;
    private CursorHandle cursor;
    private ListenChannelHandle listenChannel;
    private String sql;
    private Integer batchSize;
    private final Deque<ListenerState<M>> pendingUnlistens = new ArrayDeque<>();

    public ConnectionState(int connectionId, ErrorTagger<M> errorTagger, ConnectTagger<M> connectTagger,
                           ConnectionLostTagger<M> connectionLostTagger) {
        this.connectionId = connectionId;
        this.errorTagger = Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        this.connectTagger = Objects.requireNonNull(connectTagger, "connectTagger cannot be null");
        this.connectionLostTagger = Objects.requireNonNull(connectionLostTagger, "connectionLostTagger cannot be null");
    }

    public int getConnectionId() {
        return connectionId;
    }

    public ConnectTagger<M> getConnectTagger() {
        return connectTagger;
    }

    public ConnectionLostTagger<M> getConnectionLostTagger() {
        return connectionLostTagger;
    }

    public ErrorTagger<M> getErrorTagger() {
        return errorTagger;
    }

    public void setErrorTagger(ErrorTagger<M> errorTagger) {
        this.errorTagger = Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
    }

    public DisconnectTagger<M> getDisconnectTagger() {
        return disconnectTagger;
    }

    public void setDisconnectTagger(DisconnectTagger<M> disconnectTagger) {
        this.disconnectTagger = disconnectTagger;
    }

    public QueryTagger<M> getQueryTagger() {
        return queryTagger;
    }

    public void setQueryTagger(QueryTagger<M> queryTagger) {
        this.queryTagger = queryTagger;
    }

    public ExecuteTagger<M> getExecuteTagger() {
        return executeTagger;
    }

    public void setExecuteTagger(ExecuteTagger<M> executeTagger) {
        this.executeTagger = executeTagger;
    }

    public NotificationTagger<M> getNotificationTagger() {
        return notificationTagger;
    }

    public void setNotificationTagger(NotificationTagger<M> notificationTagger) {
        this.notificationTagger = notificationTagger;
    }

    public ListenTagger<M> getListenTagger() {
        return listenTagger;
    }

    public void setListenTagger(ListenTagger<M> listenTagger) {
        this.listenTagger = listenTagger;
    }

    public ClientHandle getClient() {
        return client;
    }

    public void setClient(ClientHandle client) {
        this.client = client;
    }

    public boolean isConnected() {
        return client != null;
    }

    public CursorHandle getCursor() {
        return cursor;
    }

    public void setCursor(CursorHandle cursor) {
        this.cursor = cursor;
    }

    public ListenChannelHandle getListenChannel() {
        return listenChannel;
    }

    public void setListenChannel(ListenChannelHandle listenChannel) {
        this.listenChannel = listenChannel;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public Integer getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(Integer batchSize) {
        this.batchSize = batchSize;
    }

    /**
     * Records an UNLISTEN in flight, so its completion reaches the taggers of the listener being removed.
     */
    public void addPendingUnlisten(ListenerState<M> listener) {
        pendingUnlistens.addLast(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Removes the oldest in-flight UNLISTEN on {@code channel}.
     *
     * @return The removed listener, or null if none is pending on that channel
     */
    public ListenerState<M> takePendingUnlisten(String channel) {
        Iterator<ListenerState<M>> it = pendingUnlistens.iterator();
        while (it.hasNext()) {
            ListenerState<M> listener = it.next();
            if (listener.channel().equals(channel)) {
                it.remove();
                return listener;
            }
        }
        return null;
    }

    public int pendingUnlistenCount() {
        return pendingUnlistens.size();
    }

    /**
     * Describes which handles and taggers are present, without exposing the handles themselves.
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("connectionId", connectionId)
            .put("connected", client != null)
            .put("cursor", cursor != null)
            .put("listenChannel", listenChannel != null)
            .put("sql", sql)
            .put("batchSize", batchSize)
            .put("disconnectTagger", disconnectTagger != null)
            .put("queryTagger", queryTagger != null)
            .put("executeTagger", executeTagger != null)
            .put("listenTagger", listenTagger != null)
            .put("notificationTagger", notificationTagger != null)
            .put("pendingUnlistens", pendingUnlistens.size());
    }

    @Override
    public String toString() {
        return "ConnectionState" + toJson().encode();
    }
}
