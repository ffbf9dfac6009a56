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
import dev.mars.pgdispatch.api.driver.NativeDriver;
import dev.mars.pgdispatch.api.metrics.DispatcherMetrics;
import dev.mars.pgdispatch.api.subscription.Listen;
import dev.mars.pgdispatch.core.completion.Completion;
import dev.mars.pgdispatch.core.completion.CompletionRouter;
import dev.mars.pgdispatch.core.config.DispatcherConfig;
import dev.mars.pgdispatch.core.dispatch.CommandDispatcher;
import dev.mars.pgdispatch.core.dispatch.DispatcherInvariantException;
import dev.mars.pgdispatch.core.dispatch.SubscriptionReconciler;
import dev.mars.pgdispatch.core.metrics.NoOpDispatcherMetrics;
import dev.mars.pgdispatch.core.registry.ConnectionRegistry;
import dev.mars.pgdispatch.core.registry.ConnectionState;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.VerticleBase;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stateful asynchronous PostgreSQL command dispatcher.
 *
 * <p>The verticle's context is the single thread of control that owns the connection
 * registry. {@link #dispatch(List, List)} posts one cycle (a batch of commands plus the full
 * set of LISTEN declarations) onto that context and returns immediately. Native driver
 * outcomes are posted onto the same context as completion events, so registry reads and
 * writes never race. Application messages are delivered to the handler given at
 * construction, on the dispatcher context, in the order they were produced.</p>
 *
 * <pre>{@code
 * PgDispatcher<Msg> dispatcher = new PgDispatcher<>(new VertxPgDriver(vertx, config), config, metrics, this::onMessage);
 * vertx.deployVerticle(dispatcher).onSuccess(id ->
 *     dispatcher.dispatch(List.of(Commands.connect(Msg::error, Msg::connected, Msg::lost,
 *         "localhost", 5432, "db", "user", "secret")), List.of()));
 * }</pre>
 *
 * <p>An internal invariant violation halts the dispatcher: it is logged with a registry
 * snapshot, further submissions are refused and further completions are dropped, and the
 * exception is handed to the fatal error handler (by default rethrown on the context).</p>
 *
 * @param <M> The application message type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class PgDispatcher<M> extends VerticleBase {
    private static final Logger logger = LoggerFactory.getLogger(PgDispatcher.class);

    private final NativeDriver driver;
    private final DispatcherConfig config;
    private final DispatcherMetrics metrics;
    private final Handler<M> messageHandler;

    private volatile Context dispatchContext;
    private volatile boolean halted;
    private volatile Handler<DispatcherInvariantException> fatalErrorHandler = e -> {
        throw e;
    };

    private ConnectionRegistry<M> registry;
    private CommandDispatcher<M> commandDispatcher;
    private SubscriptionReconciler<M> reconciler;
    private CompletionRouter<M> router;

    public PgDispatcher(NativeDriver driver, Handler<M> messageHandler) {
        this(driver, DispatcherConfig.defaults(), NoOpDispatcherMetrics.INSTANCE, messageHandler);
    }

    public PgDispatcher(NativeDriver driver, DispatcherConfig config, DispatcherMetrics metrics,
                        Handler<M> messageHandler) {
        this.driver = Objects.requireNonNull(driver, "driver cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler cannot be null");
    }

    @Override
    public Future<?> start() {
        registry = new ConnectionRegistry<>();
        commandDispatcher = new CommandDispatcher<>(registry, driver, this::post, this::send, metrics,
            config.getConnectTimeoutMs());
        reconciler = new SubscriptionReconciler<>(registry, driver, this::post, this::send, metrics);
        router = new CompletionRouter<>(registry, driver, this::send, metrics);
        dispatchContext = context;
        logger.info("PgDispatcher started ({})", config);
        return Future.succeededFuture();
    }

    @Override
    public Future<?> stop() {
        dispatchContext = null;
        List<Future<Void>> closes = new ArrayList<>();
        for (ConnectionState<M> state : registry.connections()) {
            if (state.isConnected()) {
                int connectionId = state.getConnectionId();
                closes.add(driver.disconnect(state.getClient(), true, state.getListenChannel())
                    .onFailure(error -> logger.warn("Failed to close connection {} on stop: {}",
                        connectionId, error.getMessage())));
            }
        }
        int open = closes.size();
        registry.clear();
        metrics.recordRegisteredConnections(0);
        // best effort: a failed close does not fail undeployment
        return Future.join(closes)
            .transform(ar -> {
                logger.info("PgDispatcher stopped, closed {} connection(s)", open);
                return Future.succeededFuture();
            });
    }

    /**
     * Submits one dispatch cycle: commands are issued in order, then subscriptions are reconciled
     * against {@code subscriptions}, which must be the complete set of desired LISTEN declarations.
     *
     * @throws IllegalStateException if the dispatcher is not deployed or has halted
     */
    public void dispatch(List<Command<M>> commands, List<Listen<M>> subscriptions) {
        Objects.requireNonNull(commands, "commands cannot be null");
        Objects.requireNonNull(subscriptions, "subscriptions cannot be null");
        Context ctx = requireRunning();
        List<Command<M>> batch = List.copyOf(commands);
        List<Listen<M>> declared = List.copyOf(subscriptions);
        ctx.runOnContext(v -> runCycle(batch, declared));
    }

    /**
     * Diagnostic snapshot of the registry, computed on the dispatcher context.
     */
    public Future<JsonObject> registrySnapshot() {
        Context ctx = dispatchContext;
        if (ctx == null) {
            return Future.failedFuture(new IllegalStateException("PgDispatcher is not running"));
        }
        Promise<JsonObject> promise = Promise.promise();
        ctx.runOnContext(v -> promise.complete(registry.snapshot()));
        return promise.future();
    }

    public boolean isHalted() {
        return halted;
    }

    public void setFatalErrorHandler(Handler<DispatcherInvariantException> fatalErrorHandler) {
        this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler cannot be null");
    }

    private Context requireRunning() {
        Context ctx = dispatchContext;
        if (ctx == null) {
            throw new IllegalStateException("PgDispatcher is not running");
        }
        if (halted) {
            throw new IllegalStateException("PgDispatcher halted after an internal invariant violation");
        }
        return ctx;
    }

    private void runCycle(List<Command<M>> commands, List<Listen<M>> subscriptions) {
        if (halted) {
            logger.error("Dropping dispatch cycle of {} command(s): dispatcher halted", commands.size());
            return;
        }
        try {
            for (Command<M> command : commands) {
                commandDispatcher.dispatch(command);
            }
            reconciler.reconcile(subscriptions);
        } catch (DispatcherInvariantException e) {
            halt(e);
        }
    }

    private void post(Completion completion) {
        Context ctx = dispatchContext;
        if (ctx == null) {
            logger.debug("Dropping {} for connection {}: dispatcher stopped",
                completion.getClass().getSimpleName(), completion.connectionId());
            return;
        }
        ctx.runOnContext(v -> route(completion));
    }

    private void route(Completion completion) {
        if (halted) {
            logger.error("Dropping {} for connection {}: dispatcher halted",
                completion.getClass().getSimpleName(), completion.connectionId());
            return;
        }
        try {
            router.route(completion);
        } catch (DispatcherInvariantException e) {
            halt(e);
        }
    }

    private void send(M message) {
        Context ctx = dispatchContext;
        if (ctx == null) {
            logger.debug("Dropping application message {}: dispatcher stopped", message);
            return;
        }
        ctx.runOnContext(v -> {
            try {
                messageHandler.handle(message);
            } catch (RuntimeException e) {
                logger.error("Application message handler failed for {}", message, e);
            }
        });
    }

    private void halt(DispatcherInvariantException e) {
        halted = true;
        logger.error("PgDispatcher halted on connection {}: {}", e.getConnectionId(), e.getMessage(), e);
        fatalErrorHandler.handle(e);
    }
}
