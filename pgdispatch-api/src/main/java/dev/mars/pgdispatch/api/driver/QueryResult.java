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
package dev.mars.pgdispatch.api.driver;

import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Objects;

/**
 * First batch of a query together with the cursor used to fetch the rest.
 */
public record QueryResult(CursorHandle cursor, List<JsonObject> rows) {

    public QueryResult {
        Objects.requireNonNull(cursor, "cursor cannot be null");
        rows = List.copyOf(Objects.requireNonNull(rows, "rows cannot be null"));
    }
}
