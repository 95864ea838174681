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

import org.ami.exception.AmiInvalidArgumentException;
import org.ami.exception.AmiMissingCredentialsException;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Builder for creating configured AsyncAmiTcpClient instances.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Basic usage with explicit connect and login
 * var client = AsyncAmiTcpClient.builder()
 *     .host("pbx.example.com")
 *     .build();
 * client.connect().join();
 * client.session().login("admin", "secret").join();
 *
 * // Convenience method with auto-login
 * var client = AsyncAmiTcpClient.builder()
 *     .host("pbx.example.com")
 *     .credentials("admin", "secret")
 *     .buildAndLogin()
 *     .join();
 *
 * // With TLS enabled
 * var client = AsyncAmiTcpClient.builder()
 *     .host("pbx.example.com")
 *     .port(5039)
 *     .enableTls()
 *     .tlsCertificate("/etc/ami/ca.pem")
 *     .credentials("admin", "secret")
 *     .buildAndLogin()
 *     .join();
 * }</pre>
 *
 * @see AsyncAmiTcpClient#builder()
 */
public final class AsyncAmiTcpClientBuilder {
    public static final int DEFAULT_PORT = 5038;

    private String host = "localhost";
    private Integer port = DEFAULT_PORT;
    private String username;
    private String secret;
    private boolean enableTls = false;
    private File tlsCertificate;
    private Duration connectionTimeout;
    private Duration requestTimeout;
    private int maxLineLength = AmiFrameDecoder.DEFAULT_MAX_LINE_LENGTH;
    private boolean events = true;

    AsyncAmiTcpClientBuilder() {}

    /**
     * Sets the host address of the manager.
     *
     * @param host the host address
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder host(String host) {
        this.host = host;
        return this;
    }

    /**
     * Sets the manager port, 5038 by default.
     *
     * @param port the port number
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder port(Integer port) {
        this.port = port;
        return this;
    }

    /**
     * Sets the credentials for authentication.
     * These credentials are stored and can be used with {@link AsyncAmiTcpClient#login()}.
     *
     * @param username the manager user
     * @param secret the user's secret
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder credentials(String username, String secret) {
        this.username = username;
        this.secret = secret;
        return this;
    }

    /**
     * Sets whether the session asks for events when logging in. Enabled by default.
     *
     * @param events whether to receive events
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder events(boolean events) {
        this.events = events;
        return this;
    }

    /**
     * Enables or disables TLS for the TCP connection.
     *
     * @param enableTls whether to enable TLS
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder tls(boolean enableTls) {
        this.enableTls = enableTls;
        return this;
    }

    /**
     * Enables TLS for the TCP connection.
     *
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder enableTls() {
        this.enableTls = true;
        return this;
    }

    /**
     * Sets a custom trusted certificate (PEM file) to validate the server certificate.
     *
     * @param tlsCertificate the PEM file containing the certificate or CA chain
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder tlsCertificate(File tlsCertificate) {
        this.tlsCertificate = tlsCertificate;
        return this;
    }

    /**
     * Sets a custom trusted certificate (PEM file path) to validate the server certificate.
     *
     * @param tlsCertificatePath the PEM file path containing the certificate or CA chain
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder tlsCertificate(String tlsCertificatePath) {
        this.tlsCertificate = StringUtils.isBlank(tlsCertificatePath) ? null : new File(tlsCertificatePath);
        return this;
    }

    /**
     * Sets the connection timeout.
     *
     * @param connectionTimeout the connection timeout duration
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder connectionTimeout(Duration connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    /**
     * Sets the request timeout applied by the session, system and channels clients. Actions sent
     * through {@link AsyncAmiTcpClient#queue} are not affected.
     *
     * @param requestTimeout the request timeout duration
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder requestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    /**
     * Sets the longest line the decoder buffers; longer lines are discarded.
     *
     * @param maxLineLength the limit in bytes
     * @return this builder
     */
    public AsyncAmiTcpClientBuilder maxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
        return this;
    }

    /**
     * Builds and returns a configured AsyncAmiTcpClient instance.
     * Note: You still need to call {@link AsyncAmiTcpClient#connect()} on the returned client.
     *
     * @return a new AsyncAmiTcpClient instance
     * @throws AmiInvalidArgumentException if the host is blank, the port is out of range, or the
     *         line limit is not positive
     */
    public AsyncAmiTcpClient build() {
        if (StringUtils.isBlank(host)) {
            throw new AmiInvalidArgumentException("Host cannot be null or empty");
        }
        if (port == null || port <= 0 || port > 65535) {
            throw new AmiInvalidArgumentException("Port must be between 1 and 65535");
        }
        if (maxLineLength <= 0) {
            throw new AmiInvalidArgumentException("Max line length must be a positive integer");
        }
        return new AsyncAmiTcpClient(
                host,
                port,
                username,
                secret,
                connectionTimeout,
                requestTimeout,
                enableTls,
                Optional.ofNullable(tlsCertificate),
                maxLineLength,
                events);
    }

    /**
     * Builds, connects, and logs in using the provided credentials.
     *
     * @return a CompletableFuture that completes with the connected and logged in client
     * @throws AmiMissingCredentialsException if no credentials were provided
     * @throws AmiInvalidArgumentException if the configuration is invalid
     */
    public CompletableFuture<AsyncAmiTcpClient> buildAndLogin() {
        if (username == null || secret == null) {
            throw new AmiMissingCredentialsException(
                    "Credentials must be provided to use buildAndLogin(). Use credentials(username, secret).");
        }
        AsyncAmiTcpClient client = build();
        return client.connect().thenApply(v -> client);
    }
}
