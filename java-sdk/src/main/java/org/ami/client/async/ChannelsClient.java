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

import org.ami.channel.OriginateRequest;
import org.ami.message.Response;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Async client interface for call and channel operations.
 *
 * <p>Operations that report lists, such as {@link #status(Optional)}, only acknowledge the
 * request; the items themselves arrive as events carrying the same ActionID.
 *
 * @see org.ami.client.async.tcp.AsyncAmiTcpClient#channels()
 */
public interface ChannelsClient {

    /**
     * Places a call.
     *
     * @param request the originate parameters
     * @return a {@link CompletableFuture} that completes with the manager's response
     */
    CompletableFuture<Response> originate(OriginateRequest request);

    /**
     * Hangs up a channel.
     *
     * @param channel the channel name, for example {@code PJSIP/100-00000001}
     */
    CompletableFuture<Response> hangup(String channel);

    /**
     * Transfers a channel to another dialplan location.
     */
    CompletableFuture<Response> redirect(String channel, String context, String exten, int priority);

    /**
     * Reads a channel variable, or a global variable when no channel is given.
     *
     * @return a {@link CompletableFuture} that completes with the value, empty when unset
     */
    CompletableFuture<Optional<String>> getVar(Optional<String> channel, String variable);

    /**
     * Sets a channel variable, or a global variable when no channel is given.
     */
    CompletableFuture<Response> setVar(Optional<String> channel, String variable, String value);

    /**
     * Requests the status of one channel or of all channels.
     */
    CompletableFuture<Response> status(Optional<String> channel);
}
