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

import org.ami.client.async.SessionClient;
import org.ami.message.Action;
import org.ami.message.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Async TCP implementation of session client.
 */
public class SessionTcpClient implements SessionClient {
    private static final Logger log = LoggerFactory.getLogger(SessionTcpClient.class);

    private final ActionSender sender;

    SessionTcpClient(ActionSender sender) {
        this.sender = sender;
    }

    @Override
    public CompletableFuture<Response> login(String username, String secret) {
        return login(username, secret, true);
    }

    @Override
    public CompletableFuture<Response> login(String username, String secret, boolean events) {
        Action login = Action.builder("Login")
                .field("Username", username)
                .field("Secret", secret)
                .field("Events", events ? "on" : "off")
                .build();

        log.debug("Logging in user: {}", username);

        return sender.send(login).thenApply(response -> {
            log.debug("Logged in as {}", username);
            return response;
        });
    }

    @Override
    public CompletableFuture<Void> logoff() {
        log.debug("Logging off");

        return sender.send(Action.of("Logoff")).thenAccept(response -> log.debug("Logged off successfully"));
    }
}
