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

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import org.ami.message.Action;
import org.ami.message.Field;

import java.nio.charset.StandardCharsets;

/**
 * Writes an {@link Action} as {@code Name: Value} lines, CRLF terminated, followed by an empty
 * line. Field order and name casing are kept exactly as given.
 */
public class AmiActionEncoder extends MessageToByteEncoder<Action> {

    private static final byte[] SEPARATOR = {':', ' '};
    private static final byte[] CRLF = {'\r', '\n'};

    @Override
    protected void encode(ChannelHandlerContext ctx, Action action, ByteBuf out) {
        for (Field field : action.getFields()) {
            out.writeCharSequence(field.name(), StandardCharsets.UTF_8);
            out.writeBytes(SEPARATOR);
            out.writeCharSequence(field.value(), StandardCharsets.UTF_8);
            out.writeBytes(CRLF);
        }
        out.writeBytes(CRLF);
    }
}
