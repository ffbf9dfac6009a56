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
 * Fetches the next batch of the query last started on the connection, using the
 * batch size of that query. Only valid after a {@link Query} on the same connection.
 */
public record MoreQueryResults<M>(
    ErrorTagger<M> errorTagger,
    QueryTagger<M> queryTagger,
    int connectionId
) implements Command<M> {

    public MoreQueryResults {
        Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        Objects.requireNonNull(queryTagger, "queryTagger cannot be null");
    }

    @Override
    public String name() {
        return "moreQueryResults";
    }
}
