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

package io.indextables.segsearch.config;

import io.indextables.segsearch.exception.ConfigException;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Process-wide defaults for segsearch4java.
 *
 * <p>Values are seeded from system properties when the class is loaded and
 * can be changed at runtime:</p>
 * <ul>
 *   <li><b>segsearch.arena.defaultBytes</b> - arena budget used by
 *       {@code new SegmentBuilder(schema)} (default 50,000,000)</li>
 *   <li><b>segsearch.arena.maxBytes</b> - largest arena budget a builder
 *       may request (default 2,000,000,000)</li>
 *   <li><b>segsearch.search.defaultLimit</b> - hit limit used when
 *       {@code SearchOptions} does not set one (default 10)</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * This class is thread-safe and uses atomic operations for configuration changes.
 */
public final class SegSearchConfig {
    private static final Logger LOG = Logger.getLogger(SegSearchConfig.class.getName());

    public static final long DEFAULT_ARENA_BYTES = 50_000_000L;
    public static final long DEFAULT_MAX_ARENA_BYTES = 2_000_000_000L;
    public static final int DEFAULT_SEARCH_LIMIT = 10;

    static final String ARENA_DEFAULT_PROPERTY = "segsearch.arena.defaultBytes";
    static final String ARENA_MAX_PROPERTY = "segsearch.arena.maxBytes";
    static final String SEARCH_LIMIT_PROPERTY = "segsearch.search.defaultLimit";

    private static final AtomicLong maxArenaBytes =
        new AtomicLong(positiveLong(ARENA_MAX_PROPERTY, DEFAULT_MAX_ARENA_BYTES));
    private static final AtomicLong defaultArenaBytes =
        new AtomicLong(positiveLong(ARENA_DEFAULT_PROPERTY, DEFAULT_ARENA_BYTES));
    private static final AtomicInteger defaultSearchLimit =
        new AtomicInteger((int) Math.min(Integer.MAX_VALUE, positiveLong(SEARCH_LIMIT_PROPERTY, DEFAULT_SEARCH_LIMIT)));

    private SegSearchConfig() {
    }

    /**
     * Get the arena budget applied when a builder is created without one.
     * @return Arena budget in bytes
     */
    public static long getDefaultArenaBytes() {
        return defaultArenaBytes.get();
    }

    /**
     * Set the arena budget applied when a builder is created without one.
     * @param bytes Arena budget in bytes, positive and at most {@link #getMaxArenaBytes()}
     * @throws ConfigException if the value is out of range
     */
    public static void setDefaultArenaBytes(long bytes) {
        validateArenaBytes(bytes);
        defaultArenaBytes.set(bytes);
    }

    /**
     * Get the largest arena budget a builder may request.
     * @return Maximum arena budget in bytes
     */
    public static long getMaxArenaBytes() {
        return maxArenaBytes.get();
    }

    /**
     * Set the largest arena budget a builder may request.
     * @param bytes Maximum arena budget in bytes
     * @throws ConfigException if the value is not positive
     */
    public static void setMaxArenaBytes(long bytes) {
        if (bytes <= 0) {
            throw new ConfigException("Maximum arena bytes must be positive, got " + bytes);
        }
        maxArenaBytes.set(bytes);
    }

    /**
     * Get the hit limit used when a search does not specify one.
     * @return Default limit
     */
    public static int getDefaultSearchLimit() {
        return defaultSearchLimit.get();
    }

    /**
     * Set the hit limit used when a search does not specify one.
     * @param limit Default limit, must be positive
     * @throws ConfigException if the value is not positive
     */
    public static void setDefaultSearchLimit(int limit) {
        if (limit <= 0) {
            throw new ConfigException("Default search limit must be positive, got " + limit);
        }
        defaultSearchLimit.set(limit);
    }

    /**
     * Validate an arena budget against the configured bounds.
     * @param bytes Arena budget in bytes
     * @throws ConfigException if the budget is zero, negative or above the maximum
     */
    public static void validateArenaBytes(long bytes) {
        if (bytes <= 0) {
            throw new ConfigException("Arena bytes must be a positive integer, got " + bytes);
        }
        long max = maxArenaBytes.get();
        if (bytes > max) {
            throw new ConfigException("Arena bytes " + bytes + " exceed the configured maximum of " + max);
        }
    }

    /**
     * Restore every setting to its built-in default, ignoring system properties.
     */
    public static void reset() {
        maxArenaBytes.set(DEFAULT_MAX_ARENA_BYTES);
        defaultArenaBytes.set(DEFAULT_ARENA_BYTES);
        defaultSearchLimit.set(DEFAULT_SEARCH_LIMIT);
    }

    private static long positiveLong(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim().replace("_", ""));
            if (value > 0) {
                return value;
            }
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring non-numeric " + property + "=" + raw);
            return fallback;
        }
        LOG.warning("Ignoring out-of-range " + property + "=" + raw);
        return fallback;
    }
}
