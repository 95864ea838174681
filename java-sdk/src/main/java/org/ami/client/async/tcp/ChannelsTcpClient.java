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

import org.ami.channel.OriginateRequest;
import org.ami.client.async.ChannelsClient;
import org.ami.message.Action;
import org.ami.message.Response;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Async TCP implementation of channels client.
 */
public class ChannelsTcpClient implements ChannelsClient {

    private final ActionSender sender;

    ChannelsTcpClient(ActionSender sender) {
        this.sender = sender;
    }

    @Override
    public CompletableFuture<Response> originate(OriginateRequest request) {
        return sender.send(request.toAction());
    }

    @Override
    public CompletableFuture<Response> hangup(String channel) {
        return sender.send(Action.builder("Hangup").field("Channel", channel).build());
    }

    @Override
    public CompletableFuture<Response> redirect(String channel, String context, String exten, int priority) {
        Action action = Action.builder("Redirect")
                .field("Channel", channel)
                .field("Context", context)
                .field("Exten", exten)
                .field("Priority", priority)
                .build();
        return sender.send(action);
    }

    @Override
    public CompletableFuture<Optional<String>> getVar(Optional<String> channel, String variable) {
        Action.Builder builder = Action.builder("Getvar");
        channel.ifPresent(name -> builder.field("Channel", name));
        builder.field("Variable", variable);
        return sender.send(builder.build())
                .thenApply(response -> response.get("Value").filter(value -> !value.isEmpty()));
    }

    @Override
    public CompletableFuture<Response> setVar(Optional<String> channel, String variable, String value) {
        Action.Builder builder = Action.builder("Setvar");
        channel.ifPresent(name -> builder.field("Channel", name));
        builder.field("Variable", variable).field("Value", value);
        return sender.send(builder.build());
    }

    @Override
    public CompletableFuture<Response> status(Optional<String> channel) {
        Action.Builder builder = Action.builder("Status");
        channel.ifPresent(name -> builder.field("Channel", name));
        return sender.send(builder.build());
    }
}
