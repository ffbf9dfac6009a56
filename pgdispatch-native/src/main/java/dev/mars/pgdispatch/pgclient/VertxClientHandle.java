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

import dev.mars.pgdispatch.api.driver.ClientHandle;
import io.vertx.core.Handler;
import io.vertx.pgclient.PgConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A dedicated (non-pooled) PostgreSQL connection owned by {@link VertxPgDriver}.
 *
 * <p>The connection-lost callback fires at most once, and never for a close requested
 * through {@link VertxPgDriver#disconnect}.</p>
 */
final class VertxClientHandle implements ClientHandle {
    private static final Logger logger = LoggerFactory.getLogger(VertxClientHandle.class);

    private final VertxPgDriver driver;
    private final PgConnection connection;
    private final String target;
    private final VertxListenChannel listenChannel;
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private volatile VertxCursorHandle activeCursor;
    private volatile Throwable lastError;

    VertxClientHandle(VertxPgDriver driver, PgConnection connection, String target,
                      Handler<Throwable> onConnectionLost) {
        this.driver = driver;
        this.connection = connection;
        this.target = target;
        this.listenChannel = new VertxListenChannel(this);

        connection.notificationHandler(listenChannel::dispatch);
        connection.exceptionHandler(err -> {
            lastError = err;
            if (closing.get()) {
                logger.debug("Connection error during close of {}: {}", target, err.getMessage());
            } else {
                logger.warn("Connection error on {}: {}", target, err.getMessage());
            }
        });
        connection.closeHandler(v -> {
            if (closing.compareAndSet(false, true)) {
                logger.error("Connection to {} closed unexpectedly", target);
                Throwable cause = lastError != null ? lastError
                    : new IllegalStateException("Connection to " + target + " closed");
                onConnectionLost.handle(cause);
            } else {
                logger.debug("Connection to {} closed", target);
            }
        });
    }

    VertxPgDriver driver() {
        return driver;
    }

    PgConnection connection() {
        return connection;
    }

    VertxListenChannel listenChannel() {
        return listenChannel;
    }

    String target() {
        return target;
    }

    /**
     * Marks the connection as closing on request, so its close is not reported as a loss.
     */
    void markClosing() {
        closing.set(true);
    }

    VertxCursorHandle activeCursor() {
        return activeCursor;
    }

    void setActiveCursor(VertxCursorHandle cursor) {
        this.activeCursor = cursor;
    }

    void clearActiveCursor(VertxCursorHandle cursor) {
        if (activeCursor == cursor) {
            activeCursor = null;
        }
    }
}
