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
import org.apache.commons.lang3.StringUtils;

/**
 * An outgoing command sent to the manager.
 *
 * <p>Every action names itself in its {@code Action} field. The {@code ActionID} field is optional
 * here: the connection stamps a generated one on the action when it is queued without one.
 *
 * <pre>{@code
 * Action originate = Action.builder("Originate")
 *     .field("Channel", "PJSIP/100")
 *     .field("Context", "default")
 *     .field("Exten", "200")
 *     .field("Priority", "1")
 *     .variable("CALLERID(name)", "Reception")
 *     .build();
 * }</pre>
 */
public final class Action extends AmiMessage {

    public static final String ACTION = "Action";

    private Action(Fields fields) {
        super(fields);
    }

    /**
     * Creates an action with no fields besides its name.
     */
    public static Action of(String name) {
        return builder(name).build();
    }

    /**
     * Creates an action from a complete field set.
     *
     * @throws AmiInvalidArgumentException if the fields lack an {@code Action} field, contain text
     *         that cannot be written on a single wire line, or have a field name with whitespace
     */
    public static Action of(Fields fields) {
        if (StringUtils.isBlank(fields.getFirst(ACTION).orElse(null))) {
            throw new AmiInvalidArgumentException("Action must have a non-blank Action field");
        }
        for (Field field : fields) {
            validate(field);
        }
        return new Action(fields);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return get(ACTION).orElseThrow();
    }

    /**
     * Returns a copy of this action carrying the given correlation identifier.
     */
    public Action withActionId(String actionId) {
        Field field = new Field(ACTION_ID, actionId);
        validate(field);
        return new Action(getFields().withFirst(ACTION_ID, actionId));
    }

    private static void validate(Field field) {
        String name = field.name();
        if (StringUtils.isBlank(name) || name.indexOf(':') >= 0 || StringUtils.containsWhitespace(name)) {
            throw new AmiInvalidArgumentException("Invalid field name: '" + name + "'");
        }
        if (StringUtils.containsAny(field.value(), '\r', '\n')) {
            throw new AmiInvalidArgumentException("Value of field " + name + " must not contain line breaks");
        }
    }

    public static final class Builder {
        private final Fields.Builder fields = Fields.builder();

        private Builder(String name) {
            fields.add(ACTION, name);
        }

        public Builder field(String name, String value) {
            fields.add(name, value);
            return this;
        }

        public Builder field(String name, Object value) {
            fields.add(name, String.valueOf(value));
            return this;
        }

        /**
         * Adds a {@code Variable: name=value} field; may be called repeatedly.
         */
        public Builder variable(String name, String value) {
            fields.add("Variable", name + "=" + value);
            return this;
        }

        public Builder actionId(String actionId) {
            fields.add(ACTION_ID, actionId);
            return this;
        }

        public Action build() {
            return Action.of(fields.build());
        }
    }
}
