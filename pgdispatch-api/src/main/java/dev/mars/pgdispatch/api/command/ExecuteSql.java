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
import dev.mars.pgdispatch.api.tagger.ExecuteTagger;

import java.util.Objects;

/**
 * Executes a statement and reports the affected row count.
 */
public record ExecuteSql<M>(
    ErrorTagger<M> errorTagger,
    ExecuteTagger<M> executeTagger,
    int connectionId,
    String sql
) implements Command<M> {

    public ExecuteSql {
        Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        Objects.requireNonNull(executeTagger, "executeTagger cannot be null");
        Objects.requireNonNull(sql, "sql cannot be null");
    }

    @Override
    public String name() {
        return "executeSql";
    }
}
