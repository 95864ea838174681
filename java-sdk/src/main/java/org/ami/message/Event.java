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

import java.util.Optional;

/**
 * An unsolicited notification from the manager. The {@code Event} field names its type.
 */
public final class Event extends AmiMessage {

    public static final String EVENT = "Event";
    public static final String PRIVILEGE = "Privilege";

    private Event(Fields fields) {
        super(fields);
    }

    public static Event of(Fields fields) {
        if (!fields.contains(EVENT)) {
            throw new AmiInvalidArgumentException("Event must have an Event field");
        }
        return new Event(fields);
    }

    public String getName() {
        return get(EVENT).orElseThrow();
    }

    /**
     * Whether this event has the given type, ignoring case.
     */
    public boolean is(String eventName) {
        return getName().equalsIgnoreCase(eventName);
    }

    public Optional<String> getPrivilege() {
        return get(PRIVILEGE);
    }
}
