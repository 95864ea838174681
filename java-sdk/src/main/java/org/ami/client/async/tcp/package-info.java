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

/**
 * Netty-based TCP implementation of the async manager client.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link org.ami.client.async.tcp.AsyncAmiTcpClient} - main client entry
 *       point; opens the socket and provides access to all sub-clients</li>
 *   <li>{@link org.ami.client.async.tcp.AsyncAmiTcpClientBuilder} - fluent builder
 *       for configuring and constructing the client</li>
 *   <li>{@link org.ami.client.async.tcp.AmiConnection} - owns the channel, ActionID
 *       correlation, event listeners and the connection lifecycle</li>
 * </ul>
 *
 * <h2>Protocol Details</h2>
 * <p>Manager messages are text blocks of {@code Name: Value} lines ended by an empty line:
 * <ul>
 *   <li><strong>Action:</strong> {@code Action: Ping\r\nActionID: 42\r\n\r\n}</li>
 *   <li><strong>Response:</strong> {@code Response: Success\r\nActionID: 42\r\nPing: Pong\r\n\r\n}</li>
 *   <li><strong>Event:</strong> {@code Event: FullyBooted\r\nPrivilege: system,all\r\n\r\n}</li>
 * </ul>
 * <p>Responses are matched to actions by their ActionID, in whatever order they arrive. Events
 * are interleaved freely with responses and are handed to the event listeners.
 *
 * @see org.ami.client.async.tcp.AsyncAmiTcpClient
 */
package org.ami.client.async.tcp;
