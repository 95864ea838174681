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

/**
 * The greeting line a manager sends as soon as a connection is accepted, for example
 * {@code Asterisk Call Manager/7.0.3}.
 */
public record ManagerBanner(String text) {

    static final String PREFIX = "Asterisk Call Manager/";

    static boolean matches(String line) {
        return line.startsWith(PREFIX);
    }

    /**
     * Returns the protocol version announced by the banner, the text after the slash.
     */
    public String protocolVersion() {
        return text.substring(text.indexOf('/') + 1).trim();
    }
}
