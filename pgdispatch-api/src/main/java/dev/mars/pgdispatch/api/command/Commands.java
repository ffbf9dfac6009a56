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
import dev.mars.pgdispatch.api.tagger.DisconnectTagger;
import dev.mars.pgdispatch.api.tagger.ErrorTagger;
import dev.mars.pgdispatch.api.tagger.ExecuteTagger;
import dev.mars.pgdispatch.api.tagger.QueryTagger;

/**
 * Factory methods for dispatcher commands.
 *
 * <pre>{@code
 * List<Command<Msg>> batch = List.of(
 *     Commands.connect(Msg::error, Msg::connected, Msg::lost, "localhost", 5432, "db", "user", "secret"),
 *     Commands.query(Msg::error, Msg::rows, 1, "SELECT * FROM orders", 100));
 * dispatcher.dispatch(batch, List.of());
 * }</pre>
 */
public final class Commands {

    private Commands() {
        // Utility class - no instantiation
    }

    public static <M> Connect<M> connect(ErrorTagger<M> errorTagger, ConnectTagger<M> connectTagger,
                                         ConnectionLostTagger<M> connectionLostTagger,
                                         String host, int port, String database, String user, String password) {
        return new Connect<>(errorTagger, connectTagger, connectionLostTagger, host, port, database, user, password);
    }

    public static <M> Disconnect<M> disconnect(ErrorTagger<M> errorTagger, DisconnectTagger<M> disconnectTagger,
                                               int connectionId, boolean discard) {
        return new Disconnect<>(errorTagger, disconnectTagger, connectionId, discard);
    }

    public static <M> Query<M> query(ErrorTagger<M> errorTagger, QueryTagger<M> queryTagger,
                                     int connectionId, String sql, int batchSize) {
        return new Query<>(errorTagger, queryTagger, connectionId, sql, batchSize);
    }

    public static <M> MoreQueryResults<M> moreQueryResults(ErrorTagger<M> errorTagger, QueryTagger<M> queryTagger,
                                                           int connectionId) {
        return new MoreQueryResults<>(errorTagger, queryTagger, connectionId);
    }

    public static <M> ExecuteSql<M> executeSql(ErrorTagger<M> errorTagger, ExecuteTagger<M> executeTagger,
                                               int connectionId, String sql) {
        return new ExecuteSql<>(errorTagger, executeTagger, connectionId, sql);
    }
}
