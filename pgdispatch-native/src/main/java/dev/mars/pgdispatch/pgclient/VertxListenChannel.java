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
package dev.mars.pgdispatch.pgclient;

import dev.mars.pgdispatch.api.driver.ListenChannelHandle;
import dev.mars.pgdispatch.api.driver.Notification;
import io.vertx.core.Handler;
import io.vertx.pgclient.PgNotification;

/**
 * Per-connection notification demultiplexer. The connection's notification handler is
 * installed once at connect time and forwards to whichever consumer the last LISTEN registered.
 */
final class VertxListenChannel implements ListenChannelHandle {

    private final VertxClientHandle client;
    private volatile Handler<Notification> consumer;

    VertxListenChannel(VertxClientHandle client) {
        this.client = client;
    }

    VertxClientHandle client() {
        return client;
    }

    void setConsumer(Handler<Notification> consumer) {
        this.consumer = consumer;
    }

    void dispatch(PgNotification notification) {
        Handler<Notification> current = consumer;
        if (current != null) {
            String payload = notification.getPayload() != null ? notification.getPayload() : "";
            current.handle(new Notification(notification.getChannel(), payload, notification.getProcessId()));
        }
    }
}
