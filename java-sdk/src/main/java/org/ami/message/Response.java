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

package org.ami.message;

import org.ami.exception.AmiInvalidArgumentException;

import java.util.List;
import java.util.Optional;

/**
 * An incoming answer to a previously sent {@link Action}, tagged by its {@code Response} field
 * ({@code Success}, {@code Error}, {@code Follows}, {@code Goodbye}, ...).
 */
public final class Response extends AmiMessage {

    public static final String RESPONSE = "Response";
    public static final String MESSAGE = "Message";
    public static final String OUTPUT = "Output";

    private static final String ERROR = "Error";

    private Response(Fields fields) {
        super(fields);
    }

    public static Response of(Fields fields) {
        if (!fields.contains(RESPONSE)) {
            throw new AmiInvalidArgumentException("Response must have a Response field");
        }
        return new Response(fields);
    }

    public String getStatus() {
        return get(RESPONSE).orElseThrow();
    }

    /**
     * Whether the manager reported a failure for the action.
     */
    public boolean isError() {
        return ERROR.equalsIgnoreCase(getStatus().trim());
    }

    public boolean isSuccess() {
        return !isError();
    }

    /**
     * The human-readable {@code Message} field, which carries the reason on errors.
     */
    public Optional<String> getMessage() {
        return get(MESSAGE);
    }

    /**
     * Command output, whether delivered as a multi-line payload or as repeated {@code Output}
     * fields, joined by newlines.
     */
    public Optional<String> getOutput() {
        List<String> lines = getAll(OUTPUT);
        return lines.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", lines));
    }
}
