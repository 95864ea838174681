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

package org.ami;

import org.ami.client.async.tcp.AsyncAmiTcpClient;
import org.ami.client.async.tcp.AsyncAmiTcpClientBuilder;

/**
 * Main entry point for creating manager clients.
 *
 * <pre>{@code
 * var client = Ami.tcpClientBuilder()
 *     .host("pbx.example.com")
 *     .credentials("admin", "secret")
 *     .buildAndLogin()
 *     .join();
 *
 * client.connection().onEvent("Hangup", event -> System.out.println(event.get("Channel")));
 * client.system().ping().join();
 * client.end().join();
 * }</pre>
 *
 * <h2>Version Information</h2>
 * <pre>{@code
 * String version = Ami.version();           // e.g., "0.3.0"
 * AmiVersion info = Ami.versionInfo();      // Full version details
 * }</pre>
 *
 * @see AsyncAmiTcpClientBuilder
 * @see AmiVersion
 */
public final class Ami {

    private Ami() {}

    /**
     * Creates a builder for TCP clients.
     *
     * @return a TCP client builder
     */
    public static AsyncAmiTcpClientBuilder tcpClientBuilder() {
        return AsyncAmiTcpClient.builder();
    }

    /**
     * Returns the SDK version string.
     *
     * @return the version string (e.g., "0.3.0")
     */
    public static String version() {
        return AmiVersion.getInstance().getVersion();
    }

    /**
     * Returns detailed version information.
     *
     * @return the version information object
     */
    public static AmiVersion versionInfo() {
        return AmiVersion.getInstance();
    }
}
