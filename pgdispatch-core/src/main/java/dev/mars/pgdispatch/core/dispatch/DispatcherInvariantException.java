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
package dev.mars.pgdispatch.core.dispatch;

import io.vertx.core.json.JsonObject;

/**
 * Raised when a completion or continuation finds registry state that the dispatcher
 * itself should have set up and did not. This is a defect in the dispatcher's
 * bookkeeping, never a condition reported to the application as an error.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class DispatcherInvariantException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int connectionId;
    private final transient JsonObject registrySnapshot;

    public DispatcherInvariantException(String message, int connectionId, JsonObject registrySnapshot) {
        super(message + " (connectionId=" + connectionId + ", registry=" + registrySnapshot.encode() + ")");
        this.connectionId = connectionId;
        this.registrySnapshot = registrySnapshot;
    }

    public int getConnectionId() {
        return connectionId;
    }

    public JsonObject getRegistrySnapshot() {
        return registrySnapshot;
    }
}
