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

import dev.mars.pgdispatch.api.tagger.ConnectTagger;
import dev.mars.pgdispatch.api.tagger.ConnectionLostTagger;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;

import java.util.Objects;

/**
 * Opens a new connection. The dispatcher allocates the connection id.
 */
public record Connect<M>(
    ErrorTagger<M> errorTagger,
    ConnectTagger<M> connectTagger,
    ConnectionLostTagger<M> connectionLostTagger,
    String host,
    int port,
    String database,
    String user,
    String password
) implements Command<M> {

    public Connect {
        Objects.requireNonNull(errorTagger, "errorTagger cannot be null");
        Objects.requireNonNull(connectTagger, "connectTagger cannot be null");
        Objects.requireNonNull(connectionLostTagger, "connectionLostTagger cannot be null");
        Objects.requireNonNull(host, "host cannot be null");
        Objects.requireNonNull(database, "database cannot be null");
        Objects.requireNonNull(user, "user cannot be null");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535, got: " + port);
        }
    }

    @Override
    public String name() {
        return "connect";
    }

    @Override
    public String toString() {
        // password omitted
        return "Connect{host=" + host + ", port=" + port + ", database=" + database + ", user=" + user + '}';
    }
}
