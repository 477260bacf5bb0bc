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
 * Programmatic classification of every failure raised by segsearch4java.
 * Each kind maps to exactly one {@link SegSearchException} subclass.
 */
public enum ErrorKind {
    /** Bad construction or configuration parameters. */
    CONFIG,
    /** Invalid schema definition. */
    SCHEMA,
    /** A document, option or segment does not match the schema in use. */
    SCHEMA_MISMATCH,
    /** The builder's arena budget would be exceeded. */
    CAPACITY,
    /** Operation not valid in the object's current lifecycle state. */
    STATE,
    /** Exported segment bytes could not be parsed. */
    CORRUPT_DATA,
    /** The segment is already registered in the index. */
    DUPLICATE_SEGMENT,
    /** The segment is not registered in the index. */
    NOT_REGISTERED,
    /** The engine has not been initialized. */
    UNINITIALIZED,
    /** The query text could not be parsed. */
    INVALID_QUERY,
    /** The underlying engine failed. */
    ENGINE
}
