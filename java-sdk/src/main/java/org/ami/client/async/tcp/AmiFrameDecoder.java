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
import io.netty.handler.codec.ByteToMessageDecoder;
import org.ami.message.Fields;
import org.ami.message.Response;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoder for manager messages.
 *
 * <p>Input is a stream of {@code Name: Value} lines ending in LF (optionally CRLF); an empty line
 * closes the current block. Each complete block is emitted as one {@link Fields} in wire order, as
 * soon as its terminating empty line has been read. Partial lines and partial blocks are kept
 * across reads, so chunk boundaries never matter.
 *
 * <p>Anomalies are recovered in place: lines without a name separator are skipped, empty blocks are
 * dropped, and lines longer than the configured maximum are discarded. The greeting banner sent as
 * the very first line is emitted as a {@link ManagerBanner}.
 *
 * <p>A block tagged {@code Response: Follows} carries raw command output after its header fields.
 * The output starts at the first line that is not a field (no separator, or a name containing
 * whitespace); from there every line up to the {@code --END COMMAND--} marker is collected into a
 * single {@code Output} field. Output is bounded: once it exceeds the payload limit the block is
 * emitted with what was collected and normal parsing resumes.
 *
 * <p>Instances keep per-connection state and must not be shared between channels.
 */
public class AmiFrameDecoder extends ByteToMessageDecoder {
    private static final Logger log = LoggerFactory.getLogger(AmiFrameDecoder.class);

    public static final int DEFAULT_MAX_LINE_LENGTH = 65536;
    public static final int DEFAULT_MAX_PAYLOAD_LENGTH = 1024 * 1024;

    private static final String FOLLOWS = "Follows";
    private static final String END_COMMAND = "--END COMMAND--";

    private final int maxLineLength;
    private final int maxPayloadLength;
    private Fields.Builder block = Fields.builder();
    private boolean firstLine = true;
    private boolean follows;
    private List<String> output;
    private int outputLength;
    private boolean discarding;

    public AmiFrameDecoder() {
        this(DEFAULT_MAX_LINE_LENGTH);
    }

    public AmiFrameDecoder(int maxLineLength) {
        this(maxLineLength, DEFAULT_MAX_PAYLOAD_LENGTH);
    }

    /**
     * @param maxLineLength longest line kept, in bytes
     * @param maxPayloadLength most command output collected for one block, in characters
     */
    public AmiFrameDecoder(int maxLineLength, int maxPayloadLength) {
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        if (maxPayloadLength <= 0) {
            throw new IllegalArgumentException("maxPayloadLength must be positive: " + maxPayloadLength);
        }
        this.maxLineLength = maxLineLength;
        this.maxPayloadLength = maxPayloadLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        while (in.isReadable()) {
            int eol = in.indexOf(in.readerIndex(), in.writerIndex(), (byte) '\n');
            if (eol < 0) {
                // No complete line yet
                if (in.readableBytes() > maxLineLength) {
                    if (!discarding) {
                        log.warn("Discarding line longer than {} bytes", maxLineLength);
                        discarding = true;
                    }
                    in.skipBytes(in.readableBytes());
                }
                return;
            }

            int length = eol - in.readerIndex();
            if (discarding || length > maxLineLength) {
                if (!discarding) {
                    log.warn("Discarding line of {} bytes, limit is {}", length, maxLineLength);
                }
                discarding = false;
                in.readerIndex(eol + 1);
                continue;
            }

            String line = in.toString(in.readerIndex(), length, StandardCharsets.UTF_8);
            in.readerIndex(eol + 1);
            onLine(StringUtils.removeEnd(line, "\r"), out);
        }
    }

    private void onLine(String line, List<Object> out) {
        if (firstLine) {
            firstLine = false;
            if (ManagerBanner.matches(line)) {
                log.trace("Received banner: {}", line);
                out.add(new ManagerBanner(line));
                return;
            }
        }

        if (output != null) {
            collectOutput(line, out);
            return;
        }

        if (line.isEmpty()) {
            completeBlock(out);
            return;
        }

        int separator = line.indexOf(':');
        String name = separator > 0 ? line.substring(0, separator) : null;

        if (follows && (name == null || StringUtils.containsWhitespace(name))) {
            output = new ArrayList<>();
            outputLength = 0;
            collectOutput(line, out);
            return;
        }

        if (StringUtils.isBlank(name)) {
            log.debug("Skipping malformed line: {}", line);
            return;
        }

        String value = StringUtils.removeStart(line.substring(separator + 1), " ");
        block.add(name, value);
        if (Response.RESPONSE.equalsIgnoreCase(name) && FOLLOWS.equalsIgnoreCase(value.trim())) {
            follows = true;
        }
    }

    private void collectOutput(String line, List<Object> out) {
        int marker = line.indexOf(END_COMMAND);
        if (marker < 0) {
            outputLength += line.length() + 1;
            if (outputLength > maxPayloadLength) {
                log.warn("Command output exceeds {} characters without end marker, closing block", maxPayloadLength);
                endOutput();
                completeBlock(out);
                return;
            }
            output.add(line);
            return;
        }
        String rest = line.substring(0, marker);
        if (!rest.isEmpty()) {
            output.add(rest);
        }
        endOutput();
    }

    private void endOutput() {
        block.add(Response.OUTPUT, String.join("\n", output));
        output = null;
        follows = false;
    }

    private void completeBlock(List<Object> out) {
        follows = false;
        if (block.isEmpty()) {
            log.trace("Ignoring empty block");
            return;
        }
        Fields fields = block.build();
        block = Fields.builder();
        log.trace("Decoded block with {} fields", fields.size());
        out.add(fields);
    }
}
