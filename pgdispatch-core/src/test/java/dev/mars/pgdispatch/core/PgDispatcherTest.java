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
package dev.mars.pgdispatch.core;

import dev.mars.pgdispatch.api.command.Command;
import dev.mars.pgdispatch.api.command.Commands;
import dev.mars.pgdispatch.api.subscription.Listen;
import dev.mars.pgdispatch.api.subscription.Subscriptions;
import dev.mars.pgdispatch.core.config.DispatcherConfig;
import dev.mars.pgdispatch.core.dispatch.DispatcherInvariantException;
import dev.mars.pgdispatch.core.metrics.NoOpDispatcherMetrics;
import dev.mars.pgdispatch.core.support.FakeNativeDriver;
import dev.mars.pgdispatch.core.support.Msg;
import dev.mars.pgdispatch.test.categories.TestCategories;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end dispatcher behaviour on a real Vert.x context with the in-memory driver.
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class PgDispatcherTest {

    private static final String SQL = "SELECT * FROM t";
    private static final List<JsonObject> TABLE = IntStream.rangeClosed(1, 5)
        .mapToObj(i -> new JsonObject().put("id", i).put("name", "row-" + i))
        .collect(Collectors.toList());

    private FakeNativeDriver driver;
    private List<Msg> messages;
    private PgDispatcher<Msg> dispatcher;
    private String deploymentId;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        driver = new FakeNativeDriver().withResultSet(SQL, TABLE);
        messages = new CopyOnWriteArrayList<>();
        dispatcher = new PgDispatcher<>(driver, DispatcherConfig.defaults(), NoOpDispatcherMetrics.INSTANCE,
            messages::add);
        deploymentId = await(vertx.deployVerticle(dispatcher));
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private void send(Command<Msg> command) {
        dispatcher.dispatch(List.of(command), List.of());
    }

    private Msg awaitMessage(int index) {
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> messages.size() > index);
        return messages.get(index);
    }

    private int connect() {
        int index = messages.size();
        send(Commands.connect(Msg::error, Msg::connected, Msg::lost, "localhost", 5432, "db", "u", "p"));
        Msg connected = awaitMessage(index);
        assertEquals("connected", connected.kind());
        return connected.connectionId();
    }

    @Test
    void connectQueryAndPaginateUntilEmptyBatch() {
        int connectionId = connect();
        assertEquals(1, connectionId);

        send(Commands.query(Msg::error, Msg::rows, 1, SQL, 2));
        Msg first = awaitMessage(1);
        assertEquals("rows", first.kind());
        assertEquals(2, first.asRows().size());

        List<JsonObject> collected = new ArrayList<>(first.asRows());
        int index = 2;
        while (true) {
            send(Commands.moreQueryResults(Msg::error, Msg::rows, 1));
            Msg batch = awaitMessage(index++);
            assertEquals("rows", batch.kind());
            assertTrue(batch.asRows().size() <= 2);
            if (batch.asRows().isEmpty()) {
                break;
            }
            collected.addAll(batch.asRows());
        }

        assertEquals(TABLE, collected);
        assertEquals(List.of("query:" + SQL + ":2", "more:2", "more:2", "more:2"),
            driver.calls().stream().filter(c -> c.startsWith("query") || c.startsWith("more")).toList());
    }

    @Test
    void commandsWithinOneBatchAreIssuedInOrder() {
        connect();

        dispatcher.dispatch(List.of(
            Commands.executeSql(Msg::error, Msg::executed, 1, "UPDATE t SET name = 'x'"),
            Commands.query(Msg::error, Msg::rows, 1, SQL, 10),
            Commands.executeSql(Msg::error, Msg::executed, 1, "DELETE FROM t")), List.of());

        awaitMessage(3);
        assertEquals(List.of("execute:UPDATE t SET name = 'x'", "query:" + SQL + ":10", "execute:DELETE FROM t"),
            driver.calls().subList(1, 4));
    }

    @Test
    void unknownConnectionIdProducesInvalidConnectionIdError() {
        send(Commands.query(Msg::error, Msg::rows, 42, SQL, 2));

        Msg error = awaitMessage(0);
        assertEquals("error", error.kind());
        assertEquals(42, error.connectionId());
        assertEquals("Invalid connectionId", error.asError().message());
        assertTrue(driver.calls().isEmpty());
    }

    @Test
    void disconnectRemovesConnectionAndLaterCommandsAreInvalid() throws Exception {
        connect();

        send(Commands.disconnect(Msg::error, Msg::disconnected, 1, true));
        assertEquals(Msg.disconnected(1), awaitMessage(1));
        send(Commands.executeSql(Msg::error, Msg::executed, 1, "SELECT 1"));

        Msg error = awaitMessage(2);
        assertEquals("Invalid connectionId", error.asError().message());
        assertTrue(driver.client(1).isClosed());
        assertTrue(await(dispatcher.registrySnapshot()).getJsonArray("connections").isEmpty());
    }

    @Test
    void failedConnectRemovesHalfCreatedEntry() throws Exception {
        driver.failingConnects("password authentication failed");

        send(Commands.connect(Msg::error, Msg::connected, Msg::lost, "localhost", 5432, "db", "u", "bad"));

        Msg error = awaitMessage(0);
        assertEquals("password authentication failed", error.asError().message());
        assertTrue(await(dispatcher.registrySnapshot()).getJsonArray("connections").isEmpty());
    }

    @Test
    void connectionLostWhileQueryInFlightIsNotResurrected() throws Exception {
        connect();
        driver.holdQueries();
        send(Commands.query(Msg::error, Msg::rows, 1, SQL, 2));
        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> driver.heldCount() == 1);

        driver.loseConnection(driver.client(1));
        assertEquals("lost", awaitMessage(1).kind());
        driver.releaseHeld();

        await(dispatcher.registrySnapshot());
        JsonObject snapshot = await(dispatcher.registrySnapshot());
        assertTrue(snapshot.getJsonArray("connections").isEmpty());
        assertEquals(2, messages.size());
    }

    @Test
    void listenDeliversLifecycleAndNotifications() {
        connect();
        List<Listen<Msg>> subscriptions = List.of(
            Subscriptions.listen(Msg::error, Msg::listenEvent, Msg::notification, 1, "orders"));

        dispatcher.dispatch(List.of(), subscriptions);
        assertEquals(new Msg("listen", 1, "orders"), awaitMessage(1));

        driver.notify(driver.client(1), "orders", "created:7");
        assertEquals(Msg.notification(1, "orders", "created:7"), awaitMessage(2));

        dispatcher.dispatch(List.of(), subscriptions);
        dispatcher.dispatch(List.of(), List.of());
        assertEquals(new Msg("unlisten", 1, "orders"), awaitMessage(3));
        assertEquals(List.of("listen:LISTEN \"orders\"", "unlisten:UNLISTEN \"orders\""),
            driver.calls().stream().filter(c -> c.contains("LISTEN")).toList());
    }

    @Test
    void replacedChannelReportsUnlistenToItsOwnLifecycleTagger() {
        connect();

        dispatcher.dispatch(List.of(), List.of(Subscriptions.listen(Msg::error,
            (id, channel, type) -> new Msg("A-" + type.tag(), id, channel), Msg::notification, 1, "a")));
        assertEquals(new Msg("A-listen", 1, "a"), awaitMessage(1));

        dispatcher.dispatch(List.of(), List.of(Subscriptions.listen(Msg::error,
            (id, channel, type) -> new Msg("B-" + type.tag(), id, channel), Msg::notification, 1, "b")));
        awaitMessage(3);

        assertEquals(List.of(new Msg("A-unlisten", 1, "a"), new Msg("B-listen", 1, "b")), messages.subList(2, 4));
    }

    @Test
    void moreQueryResultsWithoutQueryHaltsTheDispatcher() {
        AtomicReference<DispatcherInvariantException> fatal = new AtomicReference<>();
        dispatcher.setFatalErrorHandler(fatal::set);
        connect();

        send(Commands.moreQueryResults(Msg::error, Msg::rows, 1));

        Awaitility.await().atMost(Duration.ofSeconds(5)).until(() -> fatal.get() != null);
        assertEquals(1, fatal.get().getConnectionId());
        assertTrue(dispatcher.isHalted());
        assertThrows(IllegalStateException.class, () -> send(Commands.query(Msg::error, Msg::rows, 1, SQL, 2)));
        assertEquals(1, messages.size());
    }

    @Test
    void dispatchBeforeDeploymentIsRejected() {
        PgDispatcher<Msg> undeployed = new PgDispatcher<>(driver, messages::add);

        assertThrows(IllegalStateException.class, () -> undeployed.dispatch(List.of(), List.of()));
        assertTrue(undeployed.registrySnapshot().failed());
    }

    @Test
    void undeployClosesOpenConnections(Vertx vertx) throws Exception {
        connect();
        connect();

        await(vertx.undeploy(deploymentId));

        assertTrue(driver.client(1).isClosed());
        assertTrue(driver.client(2).isClosed());
        assertEquals(2, driver.callsStartingWith("disconnect:discard=true").size());
        assertThrows(IllegalStateException.class, () -> dispatcher.dispatch(List.of(), List.of()));
    }
}
