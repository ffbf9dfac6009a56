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
package dev.mars.pgdispatch.core.registry;

import dev.mars.pgdispatch.api.subscription.Listen;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.api.tagger.ListenTagger;
import dev.mars.pgdispatch.api.tagger.NotificationTagger;

/**
 * Active LISTEN of one connection as last issued by the reconciler.
 */
public record ListenerState<M>(
    String channel,
    ErrorTagger<M> errorTagger,
    ListenTagger<M> listenTagger,
    NotificationTagger<M> notificationTagger
) {

    public static <M> ListenerState<M> from(Listen<M> listen) {
        return new ListenerState<>(listen.channel(), listen.errorTagger(), listen.listenTagger(),
            listen.notificationTagger());
    }
}
