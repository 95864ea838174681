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

import org.ami.message.Action;
import org.ami.message.Response;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Queues actions for the sub-clients and applies the client's optional request timeout.
 *
 * <p>The timeout only completes the caller's future with a {@link java.util.concurrent.TimeoutException};
 * the action stays pending on the connection until its response arrives or the connection closes.
 */
final class ActionSender {

    private final AmiConnection connection;
    private final Optional<Duration> requestTimeout;

    ActionSender(AmiConnection connection, Optional<Duration> requestTimeout) {
        this.connection = connection;
        this.requestTimeout = requestTimeout;
    }

    CompletableFuture<Response> send(Action action) {
        CompletableFuture<Response> future = connection.queue(action);
        return requestTimeout
                .map(timeout -> future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS))
                .orElse(future);
    }
}
