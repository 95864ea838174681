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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common base of the three manager message kinds: {@link Action}, {@link Response} and
 * {@link Event}.
 *
 * <p>A message is nothing more than its ordered {@link Fields}; the subclasses add named accessors
 * for the fields that give each kind its meaning.
 */
public abstract class AmiMessage {

    /** Correlates an {@link Action} with the {@link Response} that answers it. */
    public static final String ACTION_ID = "ActionID";

    private final Fields fields;

    protected AmiMessage(Fields fields) {
        this.fields = Objects.requireNonNull(fields, "fields");
    }

    public Fields getFields() {
        return fields;
    }

    public Optional<String> get(String name) {
        return fields.getFirst(name);
    }

    public List<String> getAll(String name) {
        return fields.getAll(name);
    }

    /**
     * Returns the correlation identifier, the value of the first {@code ActionID} field.
     */
    public Optional<String> getActionId() {
        return fields.getFirst(ACTION_ID);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return fields.equals(((AmiMessage) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), fields);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + fields;
    }
}
