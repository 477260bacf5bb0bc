package io.indextables.segsearch.lifecycle;

import io.indextables.segsearch.exception.EngineException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Exactly-once release of tracked resources, explicit and automatic.
 */
@ExtendWith(MockitoExtension.class)
public class ResourceLifecycleManagerTest {

    @Mock
    private AutoCloseable resource;

    private static boolean awaitCollection(BooleanSupplier condition) throws InterruptedException {
        for (int i = 0; i < 200 && !condition.getAsBoolean(); i++) {
            System.gc();
            Thread.sleep(50);
        }
        return condition.getAsBoolean();
    }

    @Test
    @DisplayName("Explicit release closes the resource once")
    public void testExplicitRelease() throws Exception {
        ResourceLifecycleManager manager = ResourceLifecycleManager.forKind("test-explicit");
        Object owner = new Object();
        ResourceLifecycleManager.Registration<AutoCloseable> registration = manager.register(owner, resource);
        assertTrue(registration.isLive());
        assertSame(resource, registration.get());
        assertEquals(1, manager.getLiveCount());

        assertTrue(registration.release());
        assertFalse(registration.release());
        assertFalse(registration.isLive());
        assertThrows(IllegalStateException.class, registration::get);
        assertThrows(IllegalStateException.class, registration::transfer);

        verify(resource, times(1)).close();
        assertEquals(0, manager.getLiveCount());
        assertEquals(1, manager.getExplicitReleaseCount());
        assertEquals(0, manager.getAutomaticReleaseCount());
        assertNotNull(owner);
    }

    @Test
    @DisplayName("Transfer hands the resource over without closing it")
    public void testTransfer() throws Exception {
        ResourceLifecycleManager builders = ResourceLifecycleManager.forKind("test-transfer-from");
        ResourceLifecycleManager segments = ResourceLifecycleManager.forKind("test-transfer-to");
        Object builder = new Object();
        Object segment = new Object();

        ResourceLifecycleManager.Registration<AutoCloseable> first = builders.register(builder, resource);
        AutoCloseable moved = first.transfer();
        ResourceLifecycleManager.Registration<AutoCloseable> second = segments.register(segment, moved);

        assertFalse(first.release());
        verify(resource, never()).close();
        assertEquals(1, builders.getTransferCount());
        assertEquals(0, builders.getLiveCount());
        assertEquals(1, segments.getLiveCount());

        assertTrue(second.release());
        verify(resource, times(1)).close();
        assertNotNull(builder);
        assertNotNull(segment);
    }

    @Test
    @DisplayName("A failing close is reported once and not retried")
    public void testFailingClose() throws Exception {
        ResourceLifecycleManager manager = ResourceLifecycleManager.forKind("test-failing");
        doThrow(new IOException("disk on fire")).when(resource).close();
        Object owner = new Object();
        ResourceLifecycleManager.Registration<AutoCloseable> registration = manager.register(owner, resource);

        EngineException e = assertThrows(EngineException.class, registration::release);
        assertTrue(e.getCause() instanceof IOException);
        assertFalse(registration.release());
        verify(resource, times(1)).close();
        assertNotNull(owner);
    }

    @Test
    @DisplayName("Concurrent releases close the resource exactly once")
    public void testConcurrentRelease() throws Exception {
        ResourceLifecycleManager manager = ResourceLifecycleManager.forKind("test-concurrent");
        AtomicInteger closes = new AtomicInteger();
        Object owner = new Object();
        AutoCloseable counting = closes::incrementAndGet;
        ResourceLifecycleManager.Registration<AutoCloseable> registration = manager.register(owner, counting);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return registration.release();
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            assertEquals(1, winners);
            assertEquals(1, closes.get());
        } finally {
            executor.shutdown();
        }
        assertNotNull(owner);
    }

    @Test
    @DisplayName("An unreachable owner releases its resource automatically")
    public void testAutomaticRelease() throws Exception {
        ResourceLifecycleManager manager = ResourceLifecycleManager.forKind("test-automatic");
        AtomicInteger closes = new AtomicInteger();
        registerAndDrop(manager, closes);

        assertTrue(awaitCollection(() -> closes.get() == 1), "Resource was not released after collection");
        assertEquals(1, manager.getAutomaticReleaseCount());
        assertEquals(0, manager.getExplicitReleaseCount());
        assertEquals(0, manager.getLiveCount());
        System.out.println(manager);
    }

    private static void registerAndDrop(ResourceLifecycleManager manager, AtomicInteger closes) {
        AutoCloseable counting = closes::incrementAndGet;
        manager.register(new Object(), counting);
    }

    @Test
    @DisplayName("Invalid registrations are rejected")
    public void testInvalidRegistration() {
        ResourceLifecycleManager manager = ResourceLifecycleManager.forKind("test-invalid");
        assertThrows(IllegalArgumentException.class, () -> manager.register(null, resource));
        assertThrows(IllegalArgumentException.class, () -> manager.register(new Object(), null));
        assertThrows(IllegalArgumentException.class, () -> manager.register(resource, resource));
        assertThrows(IllegalArgumentException.class, () -> ResourceLifecycleManager.forKind(""));
        assertSame(manager, ResourceLifecycleManager.forKind("test-invalid"));
    }
}
