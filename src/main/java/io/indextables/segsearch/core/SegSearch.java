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

package io.indextables.segsearch.core;

import io.indextables.segsearch.engine.SearchEngine;
import io.indextables.segsearch.exception.ConfigException;
import io.indextables.segsearch.exception.UninitializedException;

import java.util.Iterator;
import java.util.ServiceLoader;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Main entry point for segsearch4java.
 * Installs the search engine every builder, segment and index binds to.
 *
 * <pre>{@code
 * SegSearch.initialize();                       // engine from META-INF/services
 * SegSearch.initializeAsync().join();           // same, off the calling thread
 * SegSearch.initialize(new LuceneSearchEngine()); // explicit engine
 * }</pre>
 *
 * Constructors of {@link SegmentBuilder}, {@link SearchIndex} and
 * {@link SegmentMerger}, and {@link Segment#fromBytes(byte[])}, fail with
 * {@link UninitializedException} until an engine is installed.
 */
public final class SegSearch {
    private static final Logger LOG = Logger.getLogger(SegSearch.class.getName());

    public static final String VERSION = "0.1.0";

    private static volatile SearchEngine engine;
    private static CompletableFuture<Void> pendingInitialization;

    private SegSearch() {
    }

    /**
     * Install the first {@link SearchEngine} registered with {@link ServiceLoader}.
     * Does nothing if an engine is already installed.
     * @throws ConfigException if no engine implementation is registered
     */
    public static synchronized void initialize() {
        if (engine != null) {
            return;
        }
        Iterator<SearchEngine> engines = ServiceLoader.load(SearchEngine.class).iterator();
        if (!engines.hasNext()) {
            throw new ConfigException("No " + SearchEngine.class.getName() + " implementation is registered");
        }
        install(engines.next());
    }

    /**
     * Install an explicit engine.
     * @param searchEngine Engine to install
     * @throws ConfigException if a different engine is already installed
     */
    public static synchronized void initialize(SearchEngine searchEngine) {
        if (searchEngine == null) {
            throw new IllegalArgumentException("Search engine cannot be null");
        }
        if (engine == searchEngine) {
            return;
        }
        if (engine != null) {
            throw new ConfigException("Engine " + engine.getName() + " is already installed; call shutdown() first");
        }
        install(searchEngine);
    }

    /**
     * Initialize without blocking the caller. Concurrent and repeated calls
     * share one initialization; a failed one is retried on the next call.
     * @return Future completing once an engine is installed
     */
    public static synchronized CompletableFuture<Void> initializeAsync() {
        if (engine != null) {
            return CompletableFuture.completedFuture(null);
        }
        if (pendingInitialization == null || pendingInitialization.isCompletedExceptionally()) {
            pendingInitialization = CompletableFuture.runAsync(SegSearch::initialize);
        }
        return pendingInitialization;
    }

    /**
     * Uninstall the engine. Objects created earlier keep working with the
     * engine they were created with.
     */
    public static synchronized void shutdown() {
        if (engine != null) {
            LOG.info("Shutting down search engine " + engine.getName());
        }
        engine = null;
        pendingInitialization = null;
    }

    /**
     * Check whether an engine is installed.
     * @return true once initialized
     */
    public static boolean isInitialized() {
        return engine != null;
    }

    /**
     * Get the version of segsearch4java and of the installed engine.
     * @return Version string
     */
    public static String getVersion() {
        SearchEngine current = engine;
        return current == null
            ? "segsearch4java " + VERSION
            : "segsearch4java " + VERSION + " (" + current.getName() + " " + current.getVersion() + ")";
    }

    static SearchEngine requireEngine() {
        SearchEngine current = engine;
        if (current == null) {
            throw new UninitializedException("SegSearch.initialize() must complete before creating builders, segments or indexes");
        }
        return current;
    }

    private static void install(SearchEngine searchEngine) {
        engine = searchEngine;
        LOG.info("Initialized search engine " + searchEngine.getName() + " " + searchEngine.getVersion());
    }
}
