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

import dev.mars.pgdispatch.api.driver.NativeDriver;
import dev.mars.pgdispatch.api.error.DispatchError;
import dev.mars.pgdispatch.api.error.DispatchErrorCodes;
import dev.mars.pgdispatch.api.metrics.DispatcherMetrics;
import dev.mars.pgdispatch.api.subscription.Listen;
import dev.mars.pgdispatch.api.subscription.ListenEventType;
import dev.mars.pgdispatch.core.completion.Completion;
import dev.mars.pgdispatch.core.completion.CompletionSink;
import dev.mars.pgdispatch.core.registry.ConnectionRegistry;
import dev.mars.pgdispatch.core.registry.ConnectionState;
import dev.mars.pgdispatch.core.registry.ListenerState;
import dev.mars.pgdispatch.core.util.ChannelNames;
import dev.mars.pgdispatch.core.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Brings the active LISTEN set in line with the declarations of one dispatch cycle.
 *
 * <p>Each connection listens on at most one channel. The declared set is compared with the
 * registry's active set per connection id:</p>
 * <ul>
 *   <li>removed: active, and either no longer declared or declared with another channel</li>
 *   <li>added: declared, and either not active or active on another channel</li>
 *   <li>unchanged: declared on the channel already active; no native call is issued</li>
 * </ul>
 * <p>UNLISTEN for every removed entry is issued before any LISTEN. Afterwards the active set
 * is exactly the unchanged entries plus the added entries that were issued.</p>
 *
 * @param <M> The application message type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public class SubscriptionReconciler<M> {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionReconciler.class);

    private final ConnectionRegistry<M> registry;
    private final NativeDriver driver;
    private final CompletionSink completions;
    private final Outbox<M> outbox;
    private final DispatcherMetrics metrics;

    public SubscriptionReconciler(ConnectionRegistry<M> registry, NativeDriver driver, CompletionSink completions,
                                  Outbox<M> outbox, DispatcherMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.driver = Objects.requireNonNull(driver, "driver cannot be null");
        this.completions = Objects.requireNonNull(completions, "completions cannot be null");
        this.outbox = Objects.requireNonNull(outbox, "outbox cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    /**
     * Reconciles the full set of declarations for this cycle. Must be called on the dispatcher context.
     */
    public Reconciliation<M> reconcile(List<Listen<M>> declarations) {
        Objects.requireNonNull(declarations, "declarations cannot be null");

        Map<Integer, ListenerState<M>> desired = new LinkedHashMap<>();
        for (Listen<M> listen : declarations) {
            ListenerState<M> previous = desired.put(listen.connectionId(), ListenerState.from(listen));
            if (previous != null) {
                logger.warn("Connection {} declared more than one channel ('{}' and '{}'); using '{}'",
                    listen.connectionId(), previous.channel(), listen.channel(), listen.channel());
            }
        }

        Map<Integer, ListenerState<M>> active = registry.activeListeners();
        Map<Integer, ListenerState<M>> removed = new TreeMap<>();
        Map<Integer, ListenerState<M>> added = new LinkedHashMap<>();
        Map<Integer, ListenerState<M>> unchanged = new TreeMap<>();

        active.forEach((connectionId, current) -> {
            ListenerState<M> wanted = desired.get(connectionId);
            if (wanted == null || !wanted.channel().equals(current.channel())) {
                removed.put(connectionId, current);
            } else {
                unchanged.put(connectionId, current);
            }
        });
        desired.forEach((connectionId, wanted) -> {
            ListenerState<M> current = active.get(connectionId);
            if (current == null || !current.channel().equals(wanted.channel())) {
                added.put(connectionId, wanted);
            }
        });

        removed.forEach(this::issueUnlisten);

        Map<Integer, ListenerState<M>> nextActive = new TreeMap<>(unchanged);
        added.forEach((connectionId, wanted) -> {
            if (issueListen(connectionId, wanted)) {
                nextActive.put(connectionId, wanted);
            }
        });
        registry.replaceActiveListeners(nextActive);

        if (!removed.isEmpty() || !added.isEmpty()) {
            logger.debug("Reconciled subscriptions: {} removed, {} added, {} unchanged",
                removed.size(), added.size(), unchanged.size());
        }
        return new Reconciliation<>(removed, added, unchanged);
    }

    private void issueUnlisten(int connectionId, ListenerState<M> listener) {
        ConnectionState<M> state = registry.find(connectionId).orElse(null);
        if (state == null || !state.isConnected()) {
            logger.debug("Skipping UNLISTEN of '{}' for connection {} which is no longer connected",
                listener.channel(), connectionId);
            return;
        }
        String channel = listener.channel();
        String sql = ChannelNames.unlistenSql(channel);
        state.addPendingUnlisten(listener);
        metrics.incrementListenOperations(ListenEventType.UNLISTEN.tag());
        logger.info("Connection {} stops listening on channel '{}'", connectionId, channel);

        driver.unlisten(state.getClient(), sql, state.getListenChannel())
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.ListenSucceeded(connectionId, channel, ListenEventType.UNLISTEN,
                        null));
                } else {
                    completions.post(new Completion.ListenFailed(connectionId, channel, ListenEventType.UNLISTEN,
                        sql, Failures.messageOf(ar.cause())));
                }
            });
    }

    /**
     * @return true if LISTEN was issued
     */
    private boolean issueListen(int connectionId, ListenerState<M> listener) {
        ConnectionState<M> state = registry.find(connectionId).orElse(null);
        if (state == null) {
            metrics.incrementInvalidConnectionIds();
            outbox.send(listener.errorTagger().onError(DispatchError.invalidConnectionId(connectionId)));
            return false;
        }
        if (!state.isConnected()) {
            outbox.send(listener.errorTagger().onError(DispatchError.notConnected(connectionId)));
            return false;
        }
        String channel = listener.channel();
        if (!ChannelNames.isValid(channel)) {
            outbox.send(listener.errorTagger().onError(DispatchError.of(DispatchErrorCodes.LISTEN_FAILED, connectionId,
                "Invalid channel name '" + channel + "'")));
            return false;
        }
        String sql = ChannelNames.listenSql(channel);
        state.setErrorTagger(listener.errorTagger());
        state.setListenTagger(listener.listenTagger());
        state.setNotificationTagger(listener.notificationTagger());
        metrics.incrementListenOperations(ListenEventType.LISTEN.tag());
        logger.info("Connection {} starts listening on channel '{}'", connectionId, channel);

        driver.listen(state.getClient(), sql,
                notification -> completions.post(new Completion.NotificationReceived(connectionId,
                    notification.channel(), notification.payload())))
            .onComplete(ar -> {
                if (ar.succeeded()) {
                    completions.post(new Completion.ListenSucceeded(connectionId, channel, ListenEventType.LISTEN,
                        ar.result()));
                } else {
                    completions.post(new Completion.ListenFailed(connectionId, channel, ListenEventType.LISTEN,
                        sql, Failures.messageOf(ar.cause())));
                }
            });
        return true;
    }
}
