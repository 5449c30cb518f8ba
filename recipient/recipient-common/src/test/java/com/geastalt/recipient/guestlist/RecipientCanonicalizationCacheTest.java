/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.guestlist;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RecipientCanonicalizationCache.
 */
class RecipientCanonicalizationCacheTest {

    @Test
    @DisplayName("Should compute each value once")
    void shouldComputeOnce() {
        var cache = new RecipientCanonicalizationCache(4);
        var computations = new AtomicInteger();

        cache.computeIfAbsent("a", key -> key + computations.incrementAndGet());
        var second = cache.computeIfAbsent("a", key -> key + computations.incrementAndGet());

        assertEquals("a1", second);
        assertEquals(1, computations.get());
    }

    @Test
    @DisplayName("Should evict the least recently used entry")
    void shouldEvictLeastRecentlyUsed() {
        var cache = new RecipientCanonicalizationCache(2);

        cache.computeIfAbsent("a", String::toUpperCase);
        cache.computeIfAbsent("b", String::toUpperCase);
        cache.computeIfAbsent("a", String::toUpperCase);
        cache.computeIfAbsent("c", String::toUpperCase);

        assertTrue(cache.contains("a"));
        assertFalse(cache.contains("b"));
        assertTrue(cache.contains("c"));
        assertEquals(2, cache.size());
    }

    @Test
    @DisplayName("Should reject a maximum size below one")
    void shouldRejectZeroSize() {
        assertThrows(IllegalArgumentException.class, () -> new RecipientCanonicalizationCache(0));
    }

    @Test
    @DisplayName("Should stay bounded under concurrent access")
    void shouldStayBoundedUnderConcurrentAccess() throws InterruptedException {
        var cache = new RecipientCanonicalizationCache(16);
        int threadCount = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        AtomicInteger mismatches = new AtomicInteger(0);

        for (int t = 0; t < threadCount; t++) {
            final int thread = t;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < 500; i++) {
                        String key = "recipient-" + ((thread * 7 + i) % 64);
                        if (!cache.computeIfAbsent(key, String::toUpperCase).equals(key.toUpperCase())) {
                            mismatches.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, mismatches.get());
        assertEquals(16, cache.size());
    }
}
