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
package dev.mars.pgdispatch.core.support;

import dev.mars.pgdispatch.api.error.DispatchError;
import dev.mars.pgdispatch.api.subscription.ListenEventType;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Application message type used by dispatcher tests.
 */
public record Msg(String kind, int connectionId, Object value) {

    public static Msg error(DispatchError error) {
        return new Msg("error", error.connectionId(), error);
    }

    public static Msg connected(int connectionId) {
        return new Msg("connected", connectionId, null);
    }

    public static Msg lost(int connectionId, String reason) {
        return new Msg("lost", connectionId, reason);
    }

    public static Msg disconnected(int connectionId) {
        return new Msg("disconnected", connectionId, null);
    }

    public static Msg rows(int connectionId, List<JsonObject> rows) {
        return new Msg("rows", connectionId, rows);
    }

    public static Msg executed(int connectionId, int affectedRows) {
        return new Msg("executed", connectionId, affectedRows);
    }

    public static Msg listenEvent(int connectionId, String channel, ListenEventType type) {
        return new Msg(type.tag(), connectionId, channel);
    }

    public static Msg notification(int connectionId, String channel, String payload) {
        return new Msg("notification", connectionId, channel + ":" + payload);
    }

    public DispatchError asError() {
        return (DispatchError) value;
    }

    @SuppressWarnings("unchecked")
    public List<JsonObject> asRows() {
        return (List<JsonObject>) value;
    }
}
