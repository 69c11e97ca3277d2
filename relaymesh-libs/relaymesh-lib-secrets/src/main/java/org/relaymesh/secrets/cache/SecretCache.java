/*
 * Licensed to the RelayMesh project under one or more contributor
 * license agreements. See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * The RelayMesh project licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.relaymesh.secrets.cache;

import org.relaymesh.secrets.model.SecretSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;


/**
 * Time-bounded cache of resolved secrets.
 *
 * <p>All entries share the TTL fixed at construction. Expiry is checked on read, expired
 * entries are not returned but stay in the map until they are overwritten, invalidated or
 * removed by {@link #cleanupExpired()}.</p>
 *
 * <p>Reads share a read lock and do not block each other. Writes hold the write lock only
 * while the map is changed. Callers must not do any I/O while holding a cache lock,
 * no method here calls out to a backend.</p>
 */
public class SecretCache {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);

    private static final Logger log = LoggerFactory.getLogger(SecretCache.class);

    private final Map<CacheKey, CacheEntry> entries;
    private final ReadWriteLock lock;
    private final Duration ttl;
    private final Clock clock;

    public SecretCache() {
        this(DEFAULT_TTL);
    }

    public SecretCache(Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    public SecretCache(Duration ttl, Clock clock) {

        if (ttl.isNegative())
            throw new IllegalArgumentException("Cache TTL cannot be negative");

        this.entries = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<SecretSpec> get(CacheKey key) {

        lock.readLock().lock();

        try {

            var entry = entries.get(key);

            if (entry == null)
                return Optional.empty();

            if (isExpired(entry, clock.instant())) {
                log.trace("Cache entry expired: [{}]", key);
                return Optional.empty();
            }

            return Optional.of(entry.value);
        }
        finally {
            lock.readLock().unlock();
        }
    }

    public void insert(CacheKey key, SecretSpec value) {

        var entry = new CacheEntry(value, clock.instant());

        lock.writeLock().lock();

        try {
            entries.put(key, entry);
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidate(CacheKey key) {

        lock.writeLock().lock();

        try {
            entries.remove(key);
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove every entry for a reference, across all backends and secret types.
     */
    public void invalidateReference(String reference) {

        lock.writeLock().lock();

        try {
            entries.keySet().removeIf(key -> key.reference().equals(reference));
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    public void clear() {

        lock.writeLock().lock();

        try {
            entries.clear();
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove expired entries.
     *
     * @return The number of entries removed
     */
    public int cleanupExpired() {

        var now = clock.instant();

        lock.writeLock().lock();

        try {

            var before = entries.size();
            entries.values().removeIf(entry -> isExpired(entry, now));

            var removed = before - entries.size();

            if (removed > 0)
                log.debug("Removed {} expired secret cache entries", removed);

            return removed;
        }
        finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of entries held, including expired entries that have not been removed yet.
     */
    public int size() {

        lock.readLock().lock();

        try {
            return entries.size();
        }
        finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Duration ttl() {
        return ttl;
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return !now.isBefore(entry.insertedAt.plus(ttl));
    }

    private static final class CacheEntry {

        private final SecretSpec value;
        private final Instant insertedAt;

        CacheEntry(SecretSpec value, Instant insertedAt) {
            this.value = value;
            this.insertedAt = insertedAt;
        }
    }
}
