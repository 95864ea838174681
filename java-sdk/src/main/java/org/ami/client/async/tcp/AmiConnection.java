/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.ami.client.async.tcp;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelPipeline;
import io.netty.util.ReferenceCountUtil;
import org.ami.client.async.Subscription;
import org.ami.exception.AmiConnectionClosedException;
import org.ami.exception.AmiConnectionEndingException;
import org.ami.exception.AmiConnectionException;
import org.ami.exception.AmiInvalidArgumentException;
import org.ami.exception.AmiResponseException;
import org.ami.message.Action;
import org.ami.message.Event;
import org.ami.message.Response;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A manager session over an already open channel. Owns the request/response correlation, the
 * event listeners and the connection lifecycle.
 *
 * <p>Creating a connection installs the manager codec on the channel pipeline:
 * {@link AmiFrameDecoder}, {@link AmiMessageClassifier}, {@link AmiActionEncoder} and the inbound
 * dispatch handler. Any transport handlers (TLS) must already be in place.
 *
 * <p>Responses are matched to actions by ActionID only, never by send order. A response whose
 * ActionID is missing, unknown or already answered is dropped. Events are never matched; they go to
 * the event listeners in the order they were read.
 *
 * <p>Inbound processing runs on the channel's event loop. {@link #queue(Action)}, {@link #end()},
 * {@link #close()} and the listener registrations may be called from any thread.
 */
public class AmiConnection {
    private static final Logger log = LoggerFactory.getLogger(AmiConnection.class);

    private final Channel channel;
    private final String actionIdPrefix;
    private final AtomicLong actionIdGenerator = new AtomicLong(0);
    private final AtomicLong sequenceGenerator = new AtomicLong(0);
    private final ConcurrentHashMap<String, PendingAction> pendingActions = new ConcurrentHashMap<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();
    private final EventDispatcher dispatcher = new EventDispatcher();
    private volatile ManagerBanner banner;

    public AmiConnection(Channel channel) {
        this(channel, AmiFrameDecoder.DEFAULT_MAX_LINE_LENGTH);
    }

    public AmiConnection(Channel channel, int maxLineLength) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.actionIdPrefix = RandomStringUtils.insecure().nextAlphanumeric(8);

        ChannelPipeline pipeline = channel.pipeline();
        pipeline.addLast("frameDecoder", new AmiFrameDecoder(maxLineLength));
        pipeline.addLast("messageClassifier", new AmiMessageClassifier());
        pipeline.addLast("actionEncoder", new AmiActionEncoder());
        pipeline.addLast("messageHandler", new AmiMessageHandler());
    }

    /**
     * Sends an action and returns a future for its response.
     *
     * <p>An ActionID is generated when the action has none. The future completes with the matching
     * {@link Response}, or exceptionally with:
     * <ul>
     *   <li>{@link AmiResponseException} if the manager answered {@code Response: Error}</li>
     *   <li>{@link AmiConnectionClosedException} if the connection is, or becomes, closed first</li>
     *   <li>{@link AmiConnectionEndingException} if {@link #end()} was already called</li>
     *   <li>{@link AmiInvalidArgumentException} if an action with the same ActionID is pending</li>
     *   <li>{@link AmiConnectionException} if the action could not be written</li>
     * </ul>
     * The future never times out on its own.
     */
    public CompletableFuture<Response> queue(Action action) {
        Objects.requireNonNull(action, "action");
        ConnectionState current = state.get();
        if (current != ConnectionState.OPEN) {
            return CompletableFuture.failedFuture(notOpen(current));
        }

        Action stamped = action.getActionId().isPresent() ? action : action.withActionId(nextActionId());
        String actionId = stamped.getActionId().orElseThrow();
        PendingAction pending =
                new PendingAction(actionId, stamped, sequenceGenerator.incrementAndGet(), new CompletableFuture<>());

        if (pendingActions.putIfAbsent(actionId, pending) != null) {
            return CompletableFuture.failedFuture(
                    new AmiInvalidArgumentException("ActionID " + actionId + " is already pending"));
        }

        // end() or close() may have run since the state check above
        current = state.get();
        if (current != ConnectionState.OPEN) {
            pendingActions.remove(actionId, pending);
            closeIfDrained();
            return CompletableFuture.failedFuture(notOpen(current));
        }

        log.trace("Sending action {} with ActionID {}", stamped.getName(), actionId);

        channel.writeAndFlush(stamped).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("Failed to send action {}", stamped.getName(), future.cause());
                if (pendingActions.remove(actionId, pending)) {
                    pending.future()
                            .completeExceptionally(new AmiConnectionException(
                                    "Failed to send action " + stamped.getName(), future.cause()));
                }
                closeIfDrained();
            }
        });

        return pending.future();
    }

    /**
     * Registers a listener for every event read from this connection.
     */
    public Subscription onEvent(Consumer<Event> listener) {
        return dispatcher.onEvent(null, Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a listener for events of one type, matched case-insensitively.
     */
    public Subscription onEvent(String eventName, Consumer<Event> listener) {
        return dispatcher.onEvent(
                Objects.requireNonNull(eventName, "eventName"), Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a listener run once when the connection becomes {@link ConnectionState#CLOSED}.
     */
    public Subscription onClose(Runnable listener) {
        return dispatcher.onClose(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Registers a listener for transport faults. The connection closes right after notifying it.
     */
    public Subscription onError(Consumer<Throwable> listener) {
        return dispatcher.onError(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Stops accepting actions and closes the connection once every pending action is answered.
     * Does nothing if the connection is already ending or closed.
     *
     * @return a future completed when the connection is closed
     */
    public CompletableFuture<Void> end() {
        if (state.compareAndSet(ConnectionState.OPEN, ConnectionState.ENDING)) {
            log.debug("Connection ending with {} pending actions", pendingActions.size());
            closeIfDrained();
        }
        return closeFuture;
    }

    /**
     * Closes the connection immediately. Pending actions fail with
     * {@link AmiConnectionClosedException}, oldest first.
     *
     * @return a future completed when the channel is closed
     */
    public CompletableFuture<Void> close() {
        return close(null);
    }

    private CompletableFuture<Void> close(Throwable cause) {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return closeFuture;
        }
        log.debug("Closing connection ({} -> CLOSED)", previous);

        failPendingActions(cause);
        dispatcher.fireClose();

        channel.close().addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                closeFuture.complete(null);
            } else {
                closeFuture.completeExceptionally(
                        new AmiConnectionException("Failed to close channel", future.cause()));
            }
        });
        return closeFuture;
    }

    private void failPendingActions(Throwable cause) {
        List<PendingAction> outstanding = new ArrayList<>(pendingActions.values());
        outstanding.sort(Comparator.comparingLong(PendingAction::sequence));
        for (PendingAction pending : outstanding) {
            if (pendingActions.remove(pending.actionId(), pending)) {
                pending.future()
                        .completeExceptionally(
                                cause == null
                                        ? new AmiConnectionClosedException()
                                        : new AmiConnectionClosedException(cause));
            }
        }
    }

    private void closeIfDrained() {
        if (state.get() == ConnectionState.ENDING && pendingActions.isEmpty()) {
            close(null);
        }
    }

    private String nextActionId() {
        return actionIdPrefix + "-" + actionIdGenerator.incrementAndGet();
    }

    private static AmiConnectionException notOpen(ConnectionState state) {
        return state == ConnectionState.ENDING ? new AmiConnectionEndingException() : new AmiConnectionClosedException();
    }

    private void onResponse(Response response) {
        Optional<String> actionId = response.getActionId();
        if (actionId.isEmpty()) {
            log.debug("Dropping response without ActionID: {}", response);
            return;
        }

        PendingAction pending = pendingActions.remove(actionId.get());
        if (pending == null) {
            log.debug("Dropping response for unknown ActionID {}", actionId.get());
            return;
        }

        if (response.isError()) {
            pending.future().completeExceptionally(AmiResponseException.fromResponse(pending.action(), response));
        } else {
            pending.future().complete(response);
        }
        closeIfDrained();
    }

    private void onTransportError(Throwable cause) {
        if (state.get() == ConnectionState.CLOSED) {
            log.debug("Ignoring transport error on closed connection: {}", cause.getMessage());
            return;
        }
        log.error("Transport error, closing connection", cause);
        dispatcher.fireError(cause);
        close(cause);
    }

    public ConnectionState getState() {
        return state.get();
    }

    /**
     * Whether actions are currently accepted.
     */
    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN && channel.isActive();
    }

    public int pendingCount() {
        return pendingActions.size();
    }

    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    public Optional<ManagerBanner> getBanner() {
        return Optional.ofNullable(banner);
    }

    public Optional<String> getProtocolVersion() {
        return getBanner().map(ManagerBanner::protocolVersion);
    }

    private record PendingAction(String actionId, Action action, long sequence, CompletableFuture<Response> future) {}

    /**
     * Last inbound handler: routes classified messages and transport signals into the connection.
     */
    private class AmiMessageHandler extends ChannelInboundHandlerAdapter {

        @Override
        public void channelRead(ChannelHandlerContext ctx, Object msg) {
            if (state.get() == ConnectionState.CLOSED) {
                log.trace("Connection closed, dropping {}", msg);
                ReferenceCountUtil.release(msg);
                return;
            }
            if (msg instanceof Response) {
                onResponse((Response) msg);
            } else if (msg instanceof Event) {
                dispatcher.fireEvent((Event) msg);
            } else if (msg instanceof ManagerBanner) {
                banner = (ManagerBanner) msg;
                log.debug("Connected to {}", banner.text());
            } else {
                log.debug("Ignoring unexpected inbound message: {}", msg);
                ReferenceCountUtil.release(msg);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            if (state.get() != ConnectionState.CLOSED) {
                log.debug("Channel closed by peer");
                close(null);
            }
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            onTransportError(cause);
        }
    }
}
