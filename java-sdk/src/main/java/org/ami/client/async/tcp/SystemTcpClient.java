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

import org.ami.client.async.SystemClient;
import org.ami.message.Action;
import org.ami.message.Fields;
import org.ami.message.Response;

import java.util.concurrent.CompletableFuture;

/**
 * Async TCP implementation of system client.
 */
public class SystemTcpClient implements SystemClient {

    private final ActionSender sender;

    SystemTcpClient(ActionSender sender) {
        this.sender = sender;
    }

    @Override
    public CompletableFuture<Response> ping() {
        return sender.send(Action.of("Ping"));
    }

    @Override
    public CompletableFuture<String> command(String command) {
        Action action = Action.builder("Command").field("Command", command).build();
        return sender.send(action).thenApply(response -> response.getOutput().orElse(""));
    }

    @Override
    public CompletableFuture<Response> coreSettings() {
        return sender.send(Action.of("CoreSettings"));
    }

    @Override
    public CompletableFuture<Response> coreStatus() {
        return sender.send(Action.of("CoreStatus"));
    }

    @Override
    public CompletableFuture<Response> events(String eventMask) {
        return sender.send(Action.builder("Events").field("EventMask", eventMask).build());
    }

    @Override
    public CompletableFuture<Response> userEvent(String name, Fields fields) {
        Action.Builder builder = Action.builder("UserEvent").field("UserEvent", name);
        fields.forEach(field -> builder.field(field.name(), field.value()));
        return sender.send(builder.build());
    }
}
