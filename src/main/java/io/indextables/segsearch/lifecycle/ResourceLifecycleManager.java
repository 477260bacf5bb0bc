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

package io.indextables.segsearch.lifecycle;

import io.indextables.segsearch.exception.EngineException;

import java.lang.ref.Cleaner;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Couples the reachability of a public handle to the release of the engine
 * resource it fronts.
 *
 * <p>There is one manager per wrapper kind, obtained with
 * {@link #forKind(String)}. A handle registers its resource on construction
 * and receives a {@link Registration}. The resource is then released exactly
 * once, by whichever of these happens first:</p>
 * <ul>
 *   <li>{@link Registration#release()} - explicit, deterministic release
 *       (what {@code close()} on every handle calls)</li>
 *   <li>the owner becoming phantom reachable - automatic release on the
 *       shared {@link Cleaner} thread</li>
 * </ul>
 * <p>{@link Registration#transfer()} hands the resource to a new owner
 * instead, disarming both paths for the old one.</p>
 *
 * <p>Automatic release is a leak safety net. The JVM gives no guarantee it
 * runs at all, so code that cares about memory should close handles.</p>
 */
public final class ResourceLifecycleManager {
    private static final Logger LOG = Logger.getLogger(ResourceLifecycleManager.class.getName());

    private static final Cleaner CLEANER = Cleaner.create(runnable -> {
        Thread thread = new Thread(runnable, "segsearch-resource-cleaner");
        thread.setDaemon(true);
        return thread;
    });

    private static final Map<String, ResourceLifecycleManager> MANAGERS = new ConcurrentHashMap<>();

    private final String kind;
    private final AtomicInteger live = new AtomicInteger();
    private final AtomicLong explicitReleases = new AtomicLong();
    private final AtomicLong automaticReleases = new AtomicLong();
    private final AtomicLong transfers = new AtomicLong();

    private ResourceLifecycleManager(String kind) {
        this.kind = kind;
    }

    /**
     * Get the shared manager for a wrapper kind, creating it on first use.
     * @param kind Wrapper kind, e.g. "Segment"
     * @return Manager for that kind
     */
    public static ResourceLifecycleManager forKind(String kind) {
        if (kind == null || kind.isEmpty()) {
            throw new IllegalArgumentException("Wrapper kind cannot be null or empty");
        }
        return MANAGERS.computeIfAbsent(kind, ResourceLifecycleManager::new);
    }

    /**
     * Track a resource on behalf of its owning handle.
     *
     * <p>The owner must not be reachable from the resource, otherwise it can
     * never become unreachable and only the explicit path will fire.</p>
     *
     * @param owner Handle whose reachability governs automatic release
     * @param resource Resource to close when released
     * @return Registration used for explicit release or transfer
     */
    public <R extends AutoCloseable> Registration<R> register(Object owner, R resource) {
        if (owner == null) {
            throw new IllegalArgumentException("Owner cannot be null");
        }
        if (resource == null) {
            throw new IllegalArgumentException("Resource cannot be null");
        }
        if (owner == resource) {
            throw new IllegalArgumentException("A resource cannot own itself");
        }
        ReleaseAction<R> action = new ReleaseAction<>(this, resource);
        Cleaner.Cleanable cleanable = CLEANER.register(owner, action);
        live.incrementAndGet();
        LOG.fine(() -> kind + ": registered " + resource.getClass().getSimpleName());
        return new Registration<>(action, cleanable);
    }

    /** Wrapper kind this manager tracks. */
    public String getKind() {
        return kind;
    }

    /** Number of registrations not yet released or transferred. */
    public int getLiveCount() {
        return live.get();
    }

    /** Number of resources released through {@link Registration#release()}. */
    public long getExplicitReleaseCount() {
        return explicitReleases.get();
    }

    /** Number of resources released because their owner became unreachable. */
    public long getAutomaticReleaseCount() {
        return automaticReleases.get();
    }

    /** Number of registrations that handed their resource to another owner. */
    public long getTransferCount() {
        return transfers.get();
    }

    @Override
    public String toString() {
        return String.format("ResourceLifecycleManager{kind='%s', live=%d, explicit=%d, automatic=%d, transferred=%d}",
            kind, live.get(), explicitReleases.get(), automaticReleases.get(), transfers.get());
    }

    /**
     * Per-handle view of a tracked resource.
     * @param <R> Resource type
     */
    public static final class Registration<R extends AutoCloseable> {
        private final ReleaseAction<R> action;
        private final Cleaner.Cleanable cleanable;

        private Registration(ReleaseAction<R> action, Cleaner.Cleanable cleanable) {
            this.action = action;
            this.cleanable = cleanable;
        }

        /**
         * Get the tracked resource.
         * @return Resource
         * @throws IllegalStateException if it was already released or transferred
         */
        public R get() {
            if (action.state.get() != ReleaseAction.LIVE) {
                throw new IllegalStateException("Resource has already been " + action.describeState());
            }
            return action.resource;
        }

        /**
         * Check whether the resource is still held by this registration.
         * @return true while neither released nor transferred
         */
        public boolean isLive() {
            return action.state.get() == ReleaseAction.LIVE;
        }

        /**
         * Release the resource now. Later calls, and the automatic path, do nothing.
         * @return true if this call released the resource
         * @throws EngineException if closing the resource failed
         */
        public boolean release() {
            if (!action.state.compareAndSet(ReleaseAction.LIVE, ReleaseAction.RELEASING_EXPLICITLY)) {
                return false;
            }
            cleanable.clean();
            if (action.failure != null) {
                throw new EngineException("Failed to release " + action.resource.getClass().getSimpleName(),
                    action.failure);
            }
            return true;
        }

        /**
         * Stop tracking the resource without closing it and return it to the caller,
         * which becomes responsible for it (typically by registering it under a new owner).
         * @return Resource whose ownership moves to the caller
         * @throws IllegalStateException if it was already released or transferred
         */
        public R transfer() {
            if (!action.state.compareAndSet(ReleaseAction.LIVE, ReleaseAction.TRANSFERRED)) {
                throw new IllegalStateException("Resource has already been " + action.describeState());
            }
            cleanable.clean();
            return action.resource;
        }
    }

    /**
     * Cleaner action. Holds the resource and the manager, never the owner.
     */
    private static final class ReleaseAction<R extends AutoCloseable> implements Runnable {
        static final int LIVE = 0;
        static final int RELEASING_EXPLICITLY = 1;
        static final int TRANSFERRED = 2;
        static final int RELEASED = 3;

        private final ResourceLifecycleManager manager;
        private final R resource;
        private final AtomicInteger state = new AtomicInteger(LIVE);
        private volatile Exception failure;

        ReleaseAction(ResourceLifecycleManager manager, R resource) {
            this.manager = manager;
            this.resource = resource;
        }

        @Override
        public void run() {
            if (state.compareAndSet(LIVE, RELEASED)) {
                close(manager.automaticReleases, "automatically");
            } else if (state.compareAndSet(RELEASING_EXPLICITLY, RELEASED)) {
                close(manager.explicitReleases, "explicitly");
            } else if (state.get() == TRANSFERRED) {
                manager.live.decrementAndGet();
                manager.transfers.incrementAndGet();
                LOG.fine(() -> manager.kind + ": transferred " + resource.getClass().getSimpleName());
            }
        }

        private void close(AtomicLong counter, String how) {
            manager.live.decrementAndGet();
            counter.incrementAndGet();
            try {
                resource.close();
                LOG.fine(() -> manager.kind + ": released " + resource.getClass().getSimpleName() + " " + how);
            } catch (Exception e) {
                failure = e;
                LOG.log(Level.WARNING, manager.kind + ": failed to release " + resource.getClass().getSimpleName(), e);
            }
        }

        String describeState() {
            return state.get() == TRANSFERRED ? "transferred" : "released";
        }
    }
}
