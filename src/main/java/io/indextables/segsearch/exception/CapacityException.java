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

package io.indextables.segsearch.exception;

/**
 * Thrown when adding a document would push a builder past its arena budget.
 * Carries the budget figures so callers can decide to finalize and start a
 * new builder.
 */
public class CapacityException extends SegSearchException {
    private static final long serialVersionUID = 1L;

    private final long arenaBytes;
    private final long usedBytes;
    private final long requestedBytes;

    public CapacityException(long arenaBytes, long usedBytes, long requestedBytes) {
        super(ErrorKind.CAPACITY, String.format(
            "Arena budget exceeded: %d bytes used of %d, document needs %d more",
            usedBytes, arenaBytes, requestedBytes));
        this.arenaBytes = arenaBytes;
        this.usedBytes = usedBytes;
        this.requestedBytes = requestedBytes;
    }

    /** Arena budget of the builder, in bytes. */
    public long getArenaBytes() { return arenaBytes; }

    /** Bytes already consumed when the document was rejected. */
    public long getUsedBytes() { return usedBytes; }

    /** Encoded size of the rejected document. */
    public long getRequestedBytes() { return requestedBytes; }
}
