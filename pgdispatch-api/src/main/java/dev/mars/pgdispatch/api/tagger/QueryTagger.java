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
package dev.mars.pgdispatch.api.tagger;

import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Produces the application message for one batch of query rows.
 * An empty batch from a continuation means the result set is exhausted.
 *
 * @param <M> The application message type
 */
@FunctionalInterface
public interface QueryTagger<M> {

    M onRows(int connectionId, List<JsonObject> rows);
}
