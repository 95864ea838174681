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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, ordered set of message fields.
 *
 * <p>Names may repeat and are looked up case-insensitively; each field keeps the casing it was
 * created with, and iteration returns fields in the order they were received or added.
 */
public final class Fields implements Iterable<Field> {

    private static final Fields EMPTY = new Fields(List.of());

    private final List<Field> fields;

    private Fields(List<Field> fields) {
        this.fields = fields;
    }

    public static Fields empty() {
        return EMPTY;
    }

    public static Fields of(List<Field> fields) {
        return fields.isEmpty() ? EMPTY : new Fields(List.copyOf(fields));
    }

    /**
     * Creates a field set from alternating names and values.
     *
     * @param namesAndValues name, value, name, value, ...
     * @return the field set
     * @throws AmiInvalidArgumentException if an odd number of arguments is given
     */
    public static Fields of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new AmiInvalidArgumentException("Fields must be given as name/value pairs");
        }
        Builder builder = builder();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            builder.add(namesAndValues[i], namesAndValues[i + 1]);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the value of the first field whose name matches, ignoring case.
     */
    public Optional<String> getFirst(String name) {
        for (Field field : fields) {
            if (field.hasName(name)) {
                return Optional.of(field.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the values of all fields whose name matches, ignoring case, in order.
     */
    public List<String> getAll(String name) {
        List<String> values = new ArrayList<>();
        for (Field field : fields) {
            if (field.hasName(name)) {
                values.add(field.value());
            }
        }
        return Collections.unmodifiableList(values);
    }

    public boolean contains(String name) {
        return getFirst(name).isPresent();
    }

    public List<Field> asList() {
        return fields;
    }

    /**
     * Returns each distinct field name once, in the casing of its first occurrence.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        for (Field field : fields) {
            if (names.stream().noneMatch(field::hasName)) {
                names.add(field.name());
            }
        }
        return Collections.unmodifiableList(names);
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    /**
     * Returns a copy with the given field appended.
     */
    public Fields with(String name, String value) {
        List<Field> copy = new ArrayList<>(fields);
        copy.add(new Field(name, value));
        return new Fields(List.copyOf(copy));
    }

    /**
     * Returns a copy where the first field matching {@code name} carries {@code value}, keeping its
     * position and casing; the field is appended when absent.
     */
    public Fields withFirst(String name, String value) {
        List<Field> copy = new ArrayList<>(fields);
        for (int i = 0; i < copy.size(); i++) {
            Field field = copy.get(i);
            if (field.hasName(name)) {
                copy.set(i, new Field(field.name(), value));
                return new Fields(List.copyOf(copy));
            }
        }
        copy.add(new Field(name, value));
        return new Fields(List.copyOf(copy));
    }

    @Override
    public Iterator<Field> iterator() {
        return fields.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fields)) {
            return false;
        }
        return fields.equals(((Fields) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }

    public static final class Builder {
        private final List<Field> fields = new ArrayList<>();

        private Builder() {}

        public Builder add(String name, String value) {
            fields.add(new Field(name, value));
            return this;
        }

        public Builder add(Field field) {
            fields.add(field);
            return this;
        }

        public Builder addAll(Iterable<Field> other) {
            for (Field field : other) {
                fields.add(field);
            }
            return this;
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        public Fields build() {
            return Fields.of(fields);
        }
    }
}
