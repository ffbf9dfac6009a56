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

/**
 * Factory methods for subscription declarations.
 */
public final class Subscriptions {

    private Subscriptions() {
        // Utility class - no instantiation
    }

    public static <M> Listen<M> listen(ErrorTagger<M> errorTagger, ListenTagger<M> listenTagger,
                                       NotificationTagger<M> notificationTagger,
                                       int connectionId, String channel) {
        return new Listen<>(errorTagger, listenTagger, notificationTagger, connectionId, channel);
    }
}
