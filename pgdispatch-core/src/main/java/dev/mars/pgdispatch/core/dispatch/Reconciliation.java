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

import dev.mars.pgdispatch.core.registry.ListenerState;

import java.util.Map;

/**
 * Outcome of one reconciliation cycle, keyed by connection id.
 *
 * @param removed   Active entries no longer declared; UNLISTEN was issued for those still connected
 * @param added     Declared entries not previously active, including ones rejected by validation
 * @param unchanged Entries declared and already active; no native call was issued
 */
public record Reconciliation<M>(
    Map<Integer, ListenerState<M>> removed,
    Map<Integer, ListenerState<M>> added,
    Map<Integer, ListenerState<M>> unchanged
) {

    public Reconciliation {
        removed = Map.copyOf(removed);
        added = Map.copyOf(added);
        unchanged = Map.copyOf(unchanged);
    }

    public boolean isNoOp() {
        return removed.isEmpty() && added.isEmpty();
    }
}
