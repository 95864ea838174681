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

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import org.ami.message.AmiMessage;
import org.ami.message.Event;
import org.ami.message.Fields;
import org.ami.message.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Turns decoded blocks into typed messages. The protocol tags a message by a field rather than by
 * framing: a block with a {@code Response} field is a {@link Response}, otherwise a block with an
 * {@code Event} field is an {@link Event}. Anything else is dropped.
 */
public class AmiMessageClassifier extends MessageToMessageDecoder<Fields> {
    private static final Logger log = LoggerFactory.getLogger(AmiMessageClassifier.class);

    @Override
    protected void decode(ChannelHandlerContext ctx, Fields block, List<Object> out) {
        classify(block).ifPresentOrElse(out::add, () -> log.debug("Dropping unclassifiable block: {}", block));
    }

    public static Optional<AmiMessage> classify(Fields block) {
        if (block.contains(Response.RESPONSE)) {
            return Optional.of(Response.of(block));
        }
        if (block.contains(Event.EVENT)) {
            return Optional.of(Event.of(block));
        }
        return Optional.empty();
    }
}
