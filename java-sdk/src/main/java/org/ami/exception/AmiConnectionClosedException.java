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

/**
 * Exception used to fail an action that was queued on, or still pending at, a closed
 * connection.
 *
 * <p>It only ever completes the future of the one action concerned. Connection-wide
 * notifications go through the {@code close} and {@code error} subscriptions instead.
 */
public class AmiConnectionClosedException extends AmiConnectionException {

    private static final String DEFAULT_MESSAGE = "Connection closed";

    /**
     * Constructs a new AmiConnectionClosedException with a default message.
     */
    public AmiConnectionClosedException() {
        super(DEFAULT_MESSAGE);
    }

    /**
     * Constructs a new AmiConnectionClosedException caused by a transport fault.
     *
     * @param cause the fault that closed the connection
     */
    public AmiConnectionClosedException(Throwable cause) {
        super(DEFAULT_MESSAGE, cause);
    }
}
