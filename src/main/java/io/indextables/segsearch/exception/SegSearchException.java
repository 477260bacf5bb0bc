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
 * Root of the segsearch4java exception hierarchy.
 *
 * <p>All failures are unchecked and surfaced synchronously to the caller of
 * the failing operation. Use {@link #getKind()} to distinguish them
 * programmatically.
 */
public class SegSearchException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public SegSearchException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SegSearchException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Get the kind of this failure.
     * @return Error kind, never null
     */
    public ErrorKind getKind() {
        return kind;
    }
}
