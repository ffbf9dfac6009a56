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

import dev.mars.pgdispatch.api.driver.QueryResult;
import dev.mars.pgdispatch.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.Cursor;
import io.vertx.sqlclient.PreparedStatement;
import io.vertx.sqlclient.Query;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowIterator;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Statements issued while a query cursor is still open must not run inside the cursor's transaction.
 */
@Tag(TestCategories.CORE)
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class VertxPgDriverCursorTest {

    private static final String SELECT = "SELECT id FROM ledger ORDER BY id";
    private static final String INSERT = "INSERT INTO ledger VALUES (100)";

    @Mock
    private Vertx vertx;
    @Mock
    private PgConnection connection;
    @Mock
    private Transaction transaction;
    @Mock
    private PreparedStatement statement;
    @Mock
    private Cursor cursor;
    @Mock
    private RowSet<Row> batch;
    @Mock
    private RowIterator<Row> batchIterator;
    @Mock
    private Query<RowSet<Row>> simpleQuery;
    @Mock
    private RowSet<Row> simpleResult;

    private VertxPgDriver driver;
    private VertxClientHandle client;

    @BeforeEach
    void setUp() {
        when(connection.begin()).thenReturn(Future.succeededFuture(transaction));
        when(connection.prepare(SELECT)).thenReturn(Future.succeededFuture(statement));
        when(statement.cursor()).thenReturn(cursor);
        when(cursor.read(2)).thenReturn(Future.succeededFuture(batch));
        when(cursor.hasMore()).thenReturn(true);
        when(cursor.close()).thenReturn(Future.succeededFuture());
        when(statement.close()).thenReturn(Future.succeededFuture());
        when(transaction.commit()).thenReturn(Future.succeededFuture());
        when(batch.iterator()).thenReturn(batchIterator);
        when(connection.query(anyString())).thenReturn(simpleQuery);
        when(simpleQuery.execute()).thenReturn(Future.succeededFuture(simpleResult));
        when(simpleResult.rowCount()).thenReturn(1);

        driver = new VertxPgDriver(vertx);
        client = new VertxClientHandle(driver, connection, "test@localhost:5432/db", err -> { });
    }

    private static <T> T result(Future<T> future) {
        assertTrue(future.succeeded(), () -> "Future failed: " + future.cause());
        return future.result();
    }

    @Test
    void executeCommitsOpenCursorBeforeRunning() {
        QueryResult first = result(driver.query(client, SELECT, 2, null));

        assertEquals(1, result(driver.executeSql(client, INSERT)));

        InOrder order = inOrder(cursor, transaction, connection);
        order.verify(cursor).close();
        order.verify(transaction).commit();
        order.verify(connection).query(INSERT);
        verify(transaction, never()).rollback();
        assertTrue(result(driver.moreQueryResults(client, first.cursor(), 2)).isEmpty());
        verify(cursor, times(1)).read(2);
    }

    @Test
    void listenAndUnlistenCommitOpenCursorFirst() {
        result(driver.query(client, SELECT, 2, null));

        assertSame(client.listenChannel(), result(driver.listen(client, "LISTEN \"orders\"", n -> { })));
        result(driver.query(client, SELECT, 2, null));
        result(driver.unlisten(client, "UNLISTEN \"orders\"", client.listenChannel()));

        InOrder order = inOrder(transaction, connection);
        order.verify(transaction).commit();
        order.verify(connection).query("LISTEN \"orders\"");
        order.verify(transaction).commit();
        order.verify(connection).query("UNLISTEN \"orders\"");
    }

    @Test
    void executeWithoutOpenCursorRunsDirectly() {
        assertEquals(1, result(driver.executeSql(client, INSERT)));

        verify(connection).query(INSERT);
        verifyNoInteractions(transaction);
    }
}
