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

package org.ami.exception;

import org.ami.message.Action;
import org.ami.message.Response;
import org.apache.commons.lang3.StringUtils;

import java.util.Optional;

/**
 * Exception used to complete an action's future when the manager answered it with
 * {@code Response: Error}.
 *
 * <p>Unlike a {@link AmiConnectionException}, this means the manager received and rejected the
 * action. The full {@link Response} is kept so callers can inspect every field the server sent,
 * not only its {@code Message}.
 */
public class AmiResponseException extends AmiException {

    private final Response response;

    /**
     * Constructs a new AmiResponseException for the given error response.
     *
     * @param response the error response as received
     */
    public AmiResponseException(Response response) {
        super(buildMessage(response));
        this.response = response;
    }

    /**
     * Creates the exception best describing a failed action.
     *
     * @param action the action the manager rejected
     * @param response the error response
     * @return an {@link AmiAuthenticationException} for a rejected {@code Login}, otherwise a plain
     *         AmiResponseException
     */
    public static AmiResponseException fromResponse(Action action, Response response) {
        if (AmiAuthenticationException.matches(action)) {
            return new AmiAuthenticationException(response);
        }
        return new AmiResponseException(response);
    }

    /**
     * Returns the error response as received from the manager.
     *
     * @return the response
     */
    public Response getResponse() {
        return response;
    }

    /**
     * Returns the reason reported by the manager in the {@code Message} field, or an empty string.
     *
     * @return the reason
     */
    public String getReason() {
        return response.getMessage().orElse("");
    }

    /**
     * Returns the ActionID of the rejected action, if the response carried one.
     *
     * @return the action identifier, if present
     */
    public Optional<String> getActionId() {
        return response.getActionId();
    }

    private static String buildMessage(Response response) {
        StringBuilder sb = new StringBuilder("Manager error");
        response.getActionId().ifPresent(id -> sb.append(" [actionId=").append(id).append("]"));
        String reason = response.getMessage().orElse(null);
        if (StringUtils.isNotBlank(reason)) {
            sb.append(": ").append(reason);
        }
        return sb.toString();
    }
}
