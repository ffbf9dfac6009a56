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
package dev.mars.pgdispatch.api.subscription;

import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.api.tagger.ListenTagger;
import dev.mars.pgdispatch.api.tagger.NotificationTagger;

import java.util.Objects;

/**
 * Declares that a connection should be listening on a channel.
 *
 * <p>Declarations describe desired state. Each dispatch cycle receives the full set
 * of declarations and the dispatcher issues LISTEN for new ones and UNLISTEN for
 * withdrawn ones. A connection listens on at most one channel; declaring another
 * channel for the same connection replaces the previous one.</p>
 */
public record Listen<M>(
    ErrorTagger<M> errorTagger,
    ListenTagger<M> listenTagger,
    NotificationTagger<M> notificationTagger,
    int connectionId,
    String channel
) {

    public Listen {
        Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        Objects.requireNonNull(listenTagger, "listenTagger cannot be null");
        Objects.requireNonNull(notificationTagger, "notificationTagger cannot be null");
        Objects.requireNonNull(channel, "channel cannot be null");
        if (channel.isBlank()) {
            throw new IllegalArgumentException("Channel name cannot be blank");
        }
    }
}
