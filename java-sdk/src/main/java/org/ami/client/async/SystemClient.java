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

import org.ami.message.Fields;
import org.ami.message.Response;

import java.util.concurrent.CompletableFuture;

/**
 * Async client interface for manager-wide operations.
 *
 * @see org.ami.client.async.tcp.AsyncAmiTcpClient#system()
 */
public interface SystemClient {

    /**
     * Sends a {@code Ping}; useful as a keep-alive.
     */
    CompletableFuture<Response> ping();

    /**
     * Runs a CLI command and returns its output.
     *
     * @param command the CLI command, for example {@code core show uptime}
     * @return a {@link CompletableFuture} that completes with the command output, empty if the
     *         command printed nothing
     */
    CompletableFuture<String> command(String command);

    CompletableFuture<Response> coreSettings();

    CompletableFuture<Response> coreStatus();

    /**
     * Changes which event classes this session receives.
     *
     * @param eventMask {@code on}, {@code off}, or a comma separated list such as
     *        {@code system,call}
     */
    CompletableFuture<Response> events(String eventMask);

    /**
     * Raises a {@code UserEvent} that the manager broadcasts to every session.
     *
     * @param name the user event name
     * @param fields extra fields carried by the event
     */
    CompletableFuture<Response> userEvent(String name, Fields fields);
}
