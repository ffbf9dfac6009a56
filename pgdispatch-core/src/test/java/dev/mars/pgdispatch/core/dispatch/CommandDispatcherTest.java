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
package dev.mars.pgdispatch.core.dispatch;

import dev.mars.pgdispatch.api.command.Command;
import dev.mars.pgdispatch.api.command.Commands;
import dev.mars.pgdispatch.api.driver.ClientHandle;
import dev.mars.pgdispatch.api.driver.ConnectResult;
import dev.mars.pgdispatch.api.driver.CursorHandle;
import dev.mars.pgdispatch.api.driver.ListenChannelHandle;
import dev.mars.pgdispatch.api.driver.NativeDriver;
import dev.mars.pgdispatch.api.driver.QueryResult;
import dev.mars.pgdispatch.api.error.DispatchError;
import dev.mars.pgdispatch.api.error.DispatchErrorCodes;
import dev.mars.pgdispatch.core.completion.Completion;
import dev.mars.pgdispatch.core.metrics.MicrometerDispatcherMetrics;
import dev.mars.pgdispatch.core.registry.ConnectionRegistry;
import dev.mars.pgdispatch.core.registry.ConnectionState;
import dev.mars.pgdispatch.core.support.Msg;
import dev.mars.pgdispatch.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@Tag(TestCategories.CORE)
@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    private static final ClientHandle CLIENT = new ClientHandle() { };
    private static final ListenChannelHandle LISTEN_CHANNEL = new ListenChannelHandle() { };
    private static final CursorHandle CURSOR = new CursorHandle() { };

    @Mock
    private NativeDriver driver;

    @Captor
    private ArgumentCaptor<Handler<Throwable>> connectionLostCaptor;

    private ConnectionRegistry<Msg> registry;
    private List<Completion> completions;
    private List<Msg> messages;
    private SimpleMeterRegistry meterRegistry;
    private CommandDispatcher<Msg> dispatcher;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry<>();
        completions = new ArrayList<>();
        messages = new ArrayList<>();
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new CommandDispatcher<>(registry, driver, completions::add, messages::add,
            new MicrometerDispatcherMetrics(meterRegistry), 15000L);
    }

    private ConnectionState<Msg> connectedState() {
        ConnectionState<Msg> state = registry.register(Msg::error, Msg::connected, Msg::lost);
        state.setClient(CLIENT);
        state.setListenChannel(LISTEN_CHANNEL);
        return state;
    }

    @Test
    void unknownConnectionIdIsReportedToTheCommandsOwnErrorTagger() {
        List<Command<Msg>> commands = List.of(
            Commands.disconnect(Msg::error, Msg::disconnected, 7, true),
            Commands.query(Msg::error, Msg::rows, 7, "SELECT 1", 10),
            Commands.moreQueryResults(Msg::error, Msg::rows, 7),
            Commands.executeSql(Msg::error, Msg::executed, 7, "DELETE FROM t"));
        JsonObject before = registry.snapshot();

        commands.forEach(dispatcher::dispatch);

        assertEquals(4, messages.size());
        for (Msg message : messages) {
            assertEquals("error", message.kind());
            assertEquals(7, message.connectionId());
            assertEquals(DispatchError.INVALID_CONNECTION_ID_MESSAGE, message.asError().message());
            assertEquals("Invalid connectionId", message.asError().message());
            assertEquals(DispatchErrorCodes.INVALID_CONNECTION_ID, message.asError().code());
        }
        verifyNoInteractions(driver);
        assertTrue(completions.isEmpty());
        assertEquals(before, registry.snapshot());
        assertEquals(4.0, meterRegistry.get("pgdispatch.invalid.connection.ids.total").counter().count());
    }

    @Test
    void connectRegistersEntryAndPostsSuccess() {
        when(driver.connect(anyLong(), anyString(), anyInt(), anyString(), anyString(), anyString(), any()))
            .thenReturn(Future.succeededFuture(new ConnectResult(CLIENT, LISTEN_CHANNEL)));

        dispatcher.dispatch(Commands.connect(Msg::error, Msg::connected, Msg::lost, "db.local", 5432, "db", "u", "p"));

        verify(driver).connect(eq(15000L), eq("db.local"), eq(5432), eq("db"), eq("u"), eq("p"), any());
        ConnectionState<Msg> state = registry.find(1).orElseThrow();
        assertFalse(state.isConnected());
        assertEquals(List.of(new Completion.ConnectSucceeded(1, CLIENT, LISTEN_CHANNEL)), completions);
        assertTrue(messages.isEmpty());
    }

    @Test
    void connectFailurePostsFailureCompletion() {
        when(driver.connect(anyLong(), anyString(), anyInt(), anyString(), anyString(), anyString(), any()))
            .thenReturn(Future.failedFuture("Connection refused"));

        dispatcher.dispatch(Commands.connect(Msg::error, Msg::connected, Msg::lost, "db.local", 5432, "db", "u", "p"));

        assertEquals(List.of(new Completion.ConnectFailed(1, "Connection refused")), completions);
    }

    @Test
    void connectionLostCallbackPostsLostCompletion() {
        when(driver.connect(anyLong(), anyString(), anyInt(), anyString(), anyString(), anyString(),
            connectionLostCaptor.capture()))
            .thenReturn(Future.succeededFuture(new ConnectResult(CLIENT, LISTEN_CHANNEL)));
        dispatcher.dispatch(Commands.connect(Msg::error, Msg::connected, Msg::lost, "db.local", 5432, "db", "u", "p"));
        completions.clear();

        connectionLostCaptor.getValue().handle(new IllegalStateException("Connection reset"));

        assertEquals(List.of(new Completion.ConnectionLost(1, "Connection reset")), completions);
    }

    @Test
    void commandBeforeConnectCompletesIsRejectedAsNotConnected() {
        ConnectionState<Msg> pending = registry.register(Msg::error, Msg::connected, Msg::lost);

        dispatcher.dispatch(Commands.query(Msg::error, Msg::rows, pending.getConnectionId(), "SELECT 1", 10));

        assertEquals(1, messages.size());
        assertEquals(DispatchErrorCodes.NOT_CONNECTED, messages.get(0).asError().code());
        verifyNoInteractions(driver);
    }

    @Test
    void queryRecordsContinuationStateAndPostsRows() {
        ConnectionState<Msg> state = connectedState();
        List<JsonObject> rows = List.of(new JsonObject().put("id", 1), new JsonObject().put("id", 2));
        when(driver.query(CLIENT, "SELECT * FROM t", 2, LISTEN_CHANNEL))
            .thenReturn(Future.succeededFuture(new QueryResult(CURSOR, rows)));

        dispatcher.dispatch(Commands.query(Msg::error, Msg::rows, state.getConnectionId(), "SELECT * FROM t", 2));

        assertEquals("SELECT * FROM t", state.getSql());
        assertEquals(2, state.getBatchSize());
        assertNotNull(state.getQueryTagger());
        assertEquals(List.of(new Completion.QuerySucceeded(1, CURSOR, rows)), completions);
    }

    @Test
    void moreQueryResultsWithoutPriorQueryIsAnInvariantViolation() {
        ConnectionState<Msg> state = connectedState();

        DispatcherInvariantException ex = assertThrows(DispatcherInvariantException.class,
            () -> dispatcher.dispatch(Commands.moreQueryResults(Msg::error, Msg::rows, state.getConnectionId())));

        assertEquals(1, ex.getConnectionId());
        assertEquals(1, ex.getRegistrySnapshot().getJsonArray("connections").size());
        assertTrue(messages.isEmpty());
        verifyNoInteractions(driver);
    }

    @Test
    void moreQueryResultsReusesRecordedBatchSizeAndCursor() {
        ConnectionState<Msg> state = connectedState();
        state.setSql("SELECT * FROM t");
        state.setBatchSize(2);
        state.setCursor(CURSOR);
        List<JsonObject> rows = List.of(new JsonObject().put("id", 3));
        when(driver.moreQueryResults(CLIENT, CURSOR, 2)).thenReturn(Future.succeededFuture(rows));

        dispatcher.dispatch(Commands.moreQueryResults(Msg::error, Msg::rows, state.getConnectionId()));

        verify(driver).moreQueryResults(CLIENT, CURSOR, 2);
        verifyNoMoreInteractions(driver);
        assertEquals(List.of(new Completion.MoreRowsReceived(1, rows)), completions);
    }

    @Test
    void executeFailureCarriesTheStatement() {
        ConnectionState<Msg> state = connectedState();
        when(driver.executeSql(CLIENT, "DELET FROM t")).thenReturn(Future.failedFuture("syntax error"));

        dispatcher.dispatch(Commands.executeSql(Msg::error, Msg::executed, state.getConnectionId(), "DELET FROM t"));

        assertEquals(List.of(new Completion.SqlFailed(1, "DELET FROM t", "syntax error")), completions);
        assertNotNull(state.getExecuteTagger());
    }

    @Test
    void disconnectRecordsTaggerAndUsesConnectionHandles() {
        ConnectionState<Msg> state = connectedState();
        when(driver.disconnect(CLIENT, false, LISTEN_CHANNEL)).thenReturn(Future.succeededFuture());

        dispatcher.dispatch(Commands.disconnect(Msg::error, Msg::disconnected, state.getConnectionId(), false));

        assertNotNull(state.getDisconnectTagger());
        assertEquals(List.of(new Completion.DisconnectSucceeded(1)), completions);
        assertTrue(registry.contains(1));
    }

    @Test
    void commandsCountedByName() {
        ConnectionState<Msg> state = connectedState();
        when(driver.executeSql(CLIENT, "SELECT 1")).thenReturn(Future.succeededFuture(1));

        dispatcher.dispatch(Commands.executeSql(Msg::error, Msg::executed, state.getConnectionId(), "SELECT 1"));
        dispatcher.dispatch(Commands.executeSql(Msg::error, Msg::executed, state.getConnectionId(), "SELECT 1"));

        assertEquals(2.0, meterRegistry.get("pgdispatch.commands.total").tag("command", "executeSql").counter().count());
    }
}
