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

package org.ami.client.async;

import org.ami.message.Response;

import java.util.concurrent.CompletableFuture;

/**
 * Async client interface for manager session operations.
 *
 * <p>A manager accepts nothing but {@code Login} until the session is authenticated. Events are
 * only delivered to sessions that asked for them at login (or later through
 * {@link SystemClient#events(String)}).
 *
 * <p>Usage example:
 * <pre>{@code
 * SessionClient session = client.session();
 *
 * session.login("admin", "secret")
 *     .thenAccept(response -> System.out.println("Logged in: " + response.getMessage().orElse("")))
 *     .exceptionally(ex -> {
 *         System.err.println("Login failed: " + ex.getMessage());
 *         return null;
 *     });
 * }</pre>
 *
 * @see org.ami.client.async.tcp.AsyncAmiTcpClient#session()
 */
public interface SessionClient {

    /**
     * Logs in and asks for all events.
     *
     * @param username the manager user
     * @param secret the user's secret
     * @return a {@link CompletableFuture} that completes with the login response
     * @throws org.ami.exception.AmiAuthenticationException (through the future) if the manager
     *         rejects the credentials
     */
    CompletableFuture<Response> login(String username, String secret);

    /**
     * Logs in, choosing whether the session receives events.
     *
     * @param username the manager user
     * @param secret the user's secret
     * @param events {@code true} to receive events, {@code false} for a command-only session
     * @return a {@link CompletableFuture} that completes with the login response
     */
    CompletableFuture<Response> login(String username, String secret, boolean events);

    /**
     * Ends the manager session. The manager answers {@code Response: Goodbye} and then closes the
     * connection.
     *
     * @return a {@link CompletableFuture} that completes when the manager acknowledged the logoff
     */
    CompletableFuture<Void> logoff();
}
