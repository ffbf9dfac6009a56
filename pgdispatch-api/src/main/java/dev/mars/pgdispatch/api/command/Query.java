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
package dev.mars.pgdispatch.api.command;

import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.api.tagger.QueryTagger;

import java.util.Objects;

/**
 * Runs a query and returns the first {@code batchSize} rows. Further rows are
 * requested with {@link MoreQueryResults}.
 */
public record Query<M>(
    ErrorTagger<M> errorTagger,
    QueryTagger<M> queryTagger,
    int connectionId,
    String sql,
    int batchSize
) implements Command<M> {

    public Query {
        Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        Objects.requireNonNull(queryTagger, "queryTagger cannot be null");
        Objects.requireNonNull(sql, "sql cannot be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got: " + batchSize);
        }
    }

    @Override
    public String name() {
        return "query";
    }
}
