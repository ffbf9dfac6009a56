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
package dev.mars.pgdispatch.pgclient;

import dev.mars.pgdispatch.api.driver.CursorHandle;
import io.vertx.sqlclient.Cursor;
import io.vertx.sqlclient.PreparedStatement;
import io.vertx.sqlclient.Transaction;

/**
 * Open query cursor together with the statement and transaction that own it.
 */
final class VertxCursorHandle implements CursorHandle {

    private final VertxClientHandle client;
    private final Cursor cursor;
    private final PreparedStatement statement;
    private final Transaction transaction;
    private volatile boolean finished;

    VertxCursorHandle(VertxClientHandle client, Cursor cursor, PreparedStatement statement, Transaction transaction) {
        this.client = client;
        this.cursor = cursor;
        this.statement = statement;
        this.transaction = transaction;
    }

    VertxClientHandle client() {
        return client;
    }

    Cursor cursor() {
        return cursor;
    }

    PreparedStatement statement() {
        return statement;
    }

    Transaction transaction() {
        return transaction;
    }

    boolean isFinished() {
        return finished;
    }

    /**
     * @return true for the caller that finished the cursor
     */
    boolean markFinished() {
        if (finished) {
            return false;
        }
        finished = true;
        return true;
    }
}
