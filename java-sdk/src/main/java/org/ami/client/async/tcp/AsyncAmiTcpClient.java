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

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import org.ami.client.async.ChannelsClient;
import org.ami.client.async.SessionClient;
import org.ami.client.async.SystemClient;
import org.ami.exception.AmiConnectionException;
import org.ami.exception.AmiMissingCredentialsException;
import org.ami.exception.AmiNotConnectedException;
import org.ami.exception.AmiTlsException;
import org.ami.message.Action;
import org.ami.message.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.io.File;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Async TCP client for the Asterisk Manager Interface using Netty.
 *
 * <p>The client opens the socket (optionally over TLS), installs an {@link AmiConnection} on it and,
 * when credentials were configured, logs in. Everything past that point is delegated to the
 * connection and to the sub-clients.
 */
public class AsyncAmiTcpClient {
    private static final Logger log = LoggerFactory.getLogger(AsyncAmiTcpClient.class);

    private final String host;
    private final int port;
    private final Optional<String> username;
    private final Optional<String> secret;
    private final Optional<Duration> connectionTimeout;
    private final Optional<Duration> requestTimeout;
    private final boolean enableTls;
    private final Optional<File> tlsCertificate;
    private final int maxLineLength;
    private final boolean events;
    private EventLoopGroup eventLoopGroup;
    private volatile AmiConnection connection;
    private SessionClient sessionClient;
    private SystemClient systemClient;
    private ChannelsClient channelsClient;

    public AsyncAmiTcpClient(String host, int port) {
        this(host, port, null, null, null, null, false, Optional.empty(), AmiFrameDecoder.DEFAULT_MAX_LINE_LENGTH, true);
    }

    @SuppressWarnings("checkstyle:ParameterNumber")
    AsyncAmiTcpClient(
            String host,
            int port,
            String username,
            String secret,
            Duration connectionTimeout,
            Duration requestTimeout,
            boolean enableTls,
            Optional<File> tlsCertificate,
            int maxLineLength,
            boolean events) {
        this.host = host;
        this.port = port;
        this.username = Optional.ofNullable(username);
        this.secret = Optional.ofNullable(secret);
        this.connectionTimeout = Optional.ofNullable(connectionTimeout);
        this.requestTimeout = Optional.ofNullable(requestTimeout);
        this.enableTls = enableTls;
        this.tlsCertificate = tlsCertificate;
        this.maxLineLength = maxLineLength;
        this.events = events;
    }

    /**
     * Creates a new builder for configuring AsyncAmiTcpClient.
     *
     * @return a new builder instance
     */
    public static AsyncAmiTcpClientBuilder builder() {
        return new AsyncAmiTcpClientBuilder();
    }

    /**
     * Connects to the manager asynchronously, logging in when credentials were configured.
     * A rejected login closes the connection again.
     */
    public CompletableFuture<Void> connect() {
        SslContext sslContext = enableTls ? buildSslContext() : null;
        eventLoopGroup = new NioEventLoopGroup();

        Bootstrap bootstrap = new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        if (sslContext != null) {
                            ch.pipeline().addLast("ssl", sslContext.newHandler(ch.alloc(), host, port));
                        }
                        connection = new AmiConnection(ch, maxLineLength);
                    }
                });
        connectionTimeout.ifPresent(
                timeout -> bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis()));

        CompletableFuture<Void> future = new CompletableFuture<>();
        EventLoopGroup group = eventLoopGroup;
        bootstrap.connect(host, port).addListener((ChannelFutureListener) channelFuture -> {
            if (channelFuture.isSuccess()) {
                log.debug("Connected to {}:{}", host, port);
                AmiConnection established = connection;
                established.closeFuture().whenComplete((v, e) -> group.shutdownGracefully());
                ActionSender sender = new ActionSender(established, requestTimeout);
                sessionClient = new SessionTcpClient(sender);
                systemClient = new SystemTcpClient(sender);
                channelsClient = new ChannelsTcpClient(sender);
                future.complete(null);
            } else {
                group.shutdownGracefully();
                future.completeExceptionally(new AmiConnectionException(
                        "Failed to connect to " + host + ":" + port, channelFuture.cause()));
            }
        });

        return future.thenCompose(v -> {
                    if (username.isPresent() && secret.isPresent()) {
                        return login().thenApply(response -> (Void) null);
                    }
                    return CompletableFuture.<Void>completedFuture(null);
                })
                .whenComplete((v, e) -> {
                    if (e != null && connection != null) {
                        connection.close();
                    }
                });
    }

    private SslContext buildSslContext() {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient();
            tlsCertificate.ifPresent(builder::trustManager);
            return builder.build();
        } catch (SSLException | IllegalArgumentException e) {
            throw new AmiTlsException("Failed to build SSL context for AsyncAmiTcpClient", e);
        }
    }

    /**
     * Logs in using the credentials provided at build time.
     *
     * @return a future completing with the login response
     * @throws AmiMissingCredentialsException if no credentials were configured
     */
    public CompletableFuture<Response> login() {
        if (username.isEmpty() || secret.isEmpty()) {
            throw new AmiMissingCredentialsException();
        }
        return session().login(username.get(), secret.get(), events);
    }

    /**
     * Sends an arbitrary action; see {@link AmiConnection#queue(Action)}.
     */
    public CompletableFuture<Response> queue(Action action) {
        return connection().queue(action);
    }

    /**
     * Gets the underlying manager connection, for event listeners and lifecycle state.
     */
    public AmiConnection connection() {
        AmiConnection current = connection;
        if (current == null || sessionClient == null) {
            throw new AmiNotConnectedException();
        }
        return current;
    }

    /**
     * Gets the async session client.
     */
    public SessionClient session() {
        if (sessionClient == null) {
            throw new AmiNotConnectedException();
        }
        return sessionClient;
    }

    /**
     * Gets the async system client.
     */
    public SystemClient system() {
        if (systemClient == null) {
            throw new AmiNotConnectedException();
        }
        return systemClient;
    }

    /**
     * Gets the async channels client.
     */
    public ChannelsClient channels() {
        if (channelsClient == null) {
            throw new AmiNotConnectedException();
        }
        return channelsClient;
    }

    /**
     * Stops sending and closes the connection once every pending action has been answered.
     */
    public CompletableFuture<Void> end() {
        AmiConnection current = connection;
        if (current != null) {
            return current.end();
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Closes the connection and releases resources. Pending actions fail.
     */
    public CompletableFuture<Void> close() {
        AmiConnection current = connection;
        if (current != null) {
            return current.close();
        }
        if (eventLoopGroup != null) {
            eventLoopGroup.shutdownGracefully();
        }
        return CompletableFuture.completedFuture(null);
    }
}
