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

import dev.mars.pgdispatch.api.tagger.DisconnectTagger;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;

import java.util.Objects;

/**
 * Closes a connection. With {@code discard} false the driver may release the
 * connection gracefully; with {@code discard} true it is dropped immediately.
 */
public record Disconnect<M>(
    ErrorTagger<M> errorTagger,
    DisconnectTagger<M> disconnectTagger,
    int connectionId,
    boolean discard
) implements Command<M> {

    public Disconnect {
        Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        Objects.requireNonNull(disconnectTagger, "disconnectTagger cannot be null");
    }

    @Override
    public String name() {
        return "disconnect";
    }
}
