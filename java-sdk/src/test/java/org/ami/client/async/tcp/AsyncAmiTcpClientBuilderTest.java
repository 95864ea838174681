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
import org.ami.exception.AmiNotConnectedException;
import org.ami.exception.AmiTlsException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the AsyncAmiTcpClient builder, run against a loopback manager.
 */
class AsyncAmiTcpClientBuilderTest {

    private FakeManager manager;
    private AsyncAmiTcpClient client;

    @BeforeEach
    void setUp() throws Exception {
        manager = new FakeManager("admin");
    }

    @AfterEach
    void cleanup() throws Exception {
        if (client != null) {
            client.close().get(5, TimeUnit.SECONDS);
        }
        manager.close();
    }

    @Test
    void shouldCreateClientWithBuilder() throws Exception {
        // Given: Builder with basic configuration
        client = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .build();

        // When: Connect to manager
        client.connect().get(5, TimeUnit.SECONDS);

        // Then: Client should be connected and functional
        assertNotNull(client.session());
        assertNotNull(client.system());
        assertNotNull(client.channels());
        assertTrue(client.connection().isOpen());
    }

    @Test
    void shouldCreateClientWithTimeoutConfiguration() throws Exception {
        // Given: Builder with timeout configuration
        client = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .connectionTimeout(Duration.ofSeconds(30))
                .requestTimeout(Duration.ofSeconds(10))
                .credentials("admin", "admin")
                .build();

        // When: Connect to manager
        client.connect().get(5, TimeUnit.SECONDS);

        // Then: Requests should still succeed
        assertNotNull(client.system().ping().get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldLoginWithEventsDisabled() throws Exception {
        // Given: Builder asking for a session without events
        client = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .credentials("admin", "admin")
                .events(false)
                .build();

        // When: Connect (auto-login should happen)
        client.connect().get(5, TimeUnit.SECONDS);

        // Then: Login should have asked for no events
        assertTrue(manager.received().get(0).getFirst("Events").filter("off"::equals).isPresent());
    }

    @Test
    void shouldBuildAndLogin() throws Exception {
        // Given: Builder with credentials
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .credentials("admin", "admin");

        // When: Build, connect and log in in one step
        client = builder.buildAndLogin().get(5, TimeUnit.SECONDS);

        // Then: Client should be usable
        assertNotNull(client.system().ping().get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldRequireCredentialsForBuildAndLogin() {
        // Given: Builder without credentials
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder().host(manager.host());

        // When/Then: buildAndLogin should refuse
        assertThrows(AmiMissingCredentialsException.class, builder::buildAndLogin);
    }

    @Test
    void shouldRequireCredentialsForLogin() throws Exception {
        // Given: Connected client without credentials
        client = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .build();
        client.connect().get(5, TimeUnit.SECONDS);

        // When/Then: login should refuse
        assertThrows(AmiMissingCredentialsException.class, client::login);
    }

    @Test
    void shouldUseDefaultValues() {
        // Given: Builder with defaults only
        client = AsyncAmiTcpClient.builder().build();

        // Then: Client exists but is not connected
        assertNotNull(client);
        assertThrows(AmiNotConnectedException.class, client::system);
        assertThrows(AmiNotConnectedException.class, client::connection);
    }

    @Test
    void shouldThrowExceptionForEmptyHost() {
        // Given: Builder with empty host
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder().host("");

        // When/Then: Building should throw exception
        assertThrows(AmiInvalidArgumentException.class, builder::build);
    }

    @Test
    void shouldThrowExceptionForNullHost() {
        // Given: Builder with null host
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder().host(null);

        // When/Then: Building should throw exception
        assertThrows(AmiInvalidArgumentException.class, builder::build);
    }

    @Test
    void shouldThrowExceptionForInvalidPort() {
        // Given: Builder with out of range port
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder().port(70000);

        // When/Then: Building should throw exception
        assertThrows(AmiInvalidArgumentException.class, builder::build);
    }

    @Test
    void shouldThrowExceptionForZeroPort() {
        // Given: Builder with zero port
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder().port(0);

        // When/Then: Building should throw exception
        assertThrows(AmiInvalidArgumentException.class, builder::build);
    }

    @Test
    void shouldThrowExceptionForNonPositiveLineLimit() {
        // Given: Builder with zero line limit
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder().maxLineLength(0);

        // When/Then: Building should throw exception
        assertThrows(AmiInvalidArgumentException.class, builder::build);
    }

    @Test
    void shouldFailForUnreadableTlsCertificate() {
        // Given: TLS client trusting a missing certificate file
        client = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .enableTls()
                .tlsCertificate("/nonexistent/ami-ca.pem")
                .build();

        // When/Then: Connecting should fail before any I/O
        assertThrows(AmiTlsException.class, client::connect);
    }

    @Test
    void shouldHaveFluentApi() {
        AsyncAmiTcpClientBuilder builder = AsyncAmiTcpClient.builder();

        assertSame(builder, builder.host("localhost"));
        assertSame(builder, builder.port(5038));
        assertSame(builder, builder.credentials("admin", "admin"));
        assertSame(builder, builder.events(true));
        assertSame(builder, builder.enableTls());
        assertSame(builder, builder.tls(false));
        assertSame(builder, builder.maxLineLength(1024));
    }

    @Test
    void shouldCloseConnectionGracefully() throws Exception {
        // Given: Connected client
        client = AsyncAmiTcpClient.builder()
                .host(manager.host())
                .port(manager.port())
                .build();
        client.connect().get(5, TimeUnit.SECONDS);

        // When: Close the client
        CompletableFuture<Void> closeFuture = client.close();
        closeFuture.get(5, TimeUnit.SECONDS);

        // Then: Should close without errors
        assertTrue(closeFuture.isDone());
        assertFalse(closeFuture.isCompletedExceptionally());
        assertFalse(client.connection().isOpen());
    }
}
