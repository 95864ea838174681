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

package org.ami.channel;

import org.ami.message.Action;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parameters of an {@code Originate} action that connects a channel to a dialplan extension.
 */
public record OriginateRequest(
        String channel,
        String context,
        String exten,
        int priority,
        Optional<String> callerId,
        Optional<Duration> timeout,
        boolean async,
        Map<String, String> variables) {

    public OriginateRequest {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static OriginateRequest toExtension(String channel, String context, String exten, int priority) {
        return new OriginateRequest(
                channel, context, exten, priority, Optional.empty(), Optional.empty(), true, Map.of());
    }

    public OriginateRequest withCallerId(String callerId) {
        return new OriginateRequest(
                channel, context, exten, priority, Optional.of(callerId), timeout, async, variables);
    }

    public OriginateRequest withTimeout(Duration timeout) {
        return new OriginateRequest(
                channel, context, exten, priority, callerId, Optional.of(timeout), async, variables);
    }

    public OriginateRequest withAsync(boolean async) {
        return new OriginateRequest(channel, context, exten, priority, callerId, timeout, async, variables);
    }

    public OriginateRequest withVariable(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(variables);
        copy.put(name, value);
        return new OriginateRequest(channel, context, exten, priority, callerId, timeout, async, copy);
    }

    public Action toAction() {
        Action.Builder builder = Action.builder("Originate")
                .field("Channel", channel)
                .field("Context", context)
                .field("Exten", exten)
                .field("Priority", priority);
        callerId.ifPresent(id -> builder.field("CallerID", id));
        timeout.ifPresent(t -> builder.field("Timeout", t.toMillis()));
        builder.field("Async", async ? "true" : "false");
        variables.forEach(builder::variable);
        return builder.build();
    }
}
