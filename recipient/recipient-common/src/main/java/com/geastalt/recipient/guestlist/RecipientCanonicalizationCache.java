/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.recipient.guestlist;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Bounded least-recently-used cache of canonical recipient forms. Safe for use
 * from multiple threads.
 */
public class RecipientCanonicalizationCache {

    private final int maxSize;
    private final Map<String, String> entries;

    public RecipientCanonicalizationCache(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                return size() > RecipientCanonicalizationCache.this.maxSize;
            }
        };
    }

    public synchronized String computeIfAbsent(String recipient, Function<String, String> canonicalizer) {
        return entries.computeIfAbsent(recipient, canonicalizer);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean contains(String recipient) {
        return entries.containsKey(recipient);
    }

    public int getMaxSize() {
        return maxSize;
    }
}
