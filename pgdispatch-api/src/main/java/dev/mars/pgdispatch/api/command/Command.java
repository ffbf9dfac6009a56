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

/**
 * A fire-and-forget database operation submitted to the dispatcher.
 *
 * <p>Every command carries the error tagger that receives validation failures
 * (unknown connection id, connection not yet established) and native failures
 * of the operation it triggers.</p>
 *
 * @param <M> The application message type
 */
public interface Command<M> {

    ErrorTagger<M> errorTagger();

    /**
     * Short name used in logs and metrics tags.
     */
    String name();
}
