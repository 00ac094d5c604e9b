/**
 * Copyright Delegator Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.delegator.client.security.cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.delegator.common.cache.KeyedCache;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * Time-bounded cache of verification keys, indexed by key id.
 * <p>
 * An entry is valid while its age is below the TTL; a lookup that finds an older entry evicts it. When the cache is
 * full and a new key id arrives, all entries are discarded first. Key rotation is rare and the key set small, so an
 * occasional refetch is cheaper than tracking recency.
 */
@Slf4j
@ThreadSafe
public class JwksCache implements KeyedCache<String, CachedKey> {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_SIZE = 10;

    /**
     * Key id used for keys that have none.
     */
    public static final String DEFAULT_KEY_ID = "_default";

    private final long ttlNanos;
    private final int maxSize;
    private final Supplier<Long> currentTime;
    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Map<String, Entry> entries = new HashMap<>();

    public JwksCache() {
        this(DEFAULT_TTL, DEFAULT_MAX_SIZE);
    }

    public JwksCache(Duration ttl, int maxSize) {
        this(ttl, maxSize, System::nanoTime);
    }

    @VisibleForTesting
    JwksCache(Duration ttl, int maxSize, Supplier<Long> currentTime) {
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
        Preconditions.checkArgument(maxSize > 0, "maxSize must be a positive integer");
        this.ttlNanos = ttl.toNanos();
        this.maxSize = maxSize;
        this.currentTime = Preconditions.checkNotNull(currentTime, "currentTime");
    }

    @Override
    public CachedKey get(String keyId) {
        String cacheKey = normalize(keyId);
        synchronized (lock) {
            Entry entry = entries.get(cacheKey);
            if (entry == null) {
                return null;
            }
            if (isExpired(entry, currentTime.get())) {
                entries.remove(cacheKey);
                log.debug("Evicted expired key {}.", cacheKey);
                return null;
            }
            return entry.getValue();
        }
    }

    @Override
    public void put(String keyId, CachedKey key) {
        Preconditions.checkNotNull(key, "key");
        String cacheKey = normalize(keyId);
        synchronized (lock) {
            if (entries.size() >= maxSize && !entries.containsKey(cacheKey)) {
                log.debug("Key cache full ({} entries), clearing before adding {}.", entries.size(), cacheKey);
                entries.clear();
            }
            entries.put(cacheKey, new Entry(key, currentTime.get()));
        }
    }

    public boolean remove(String keyId) {
        synchronized (lock) {
            return entries.remove(normalize(keyId)) != null;
        }
    }

    public void clear() {
        synchronized (lock) {
            entries.clear();
        }
    }

    /**
     * @return the number of entries, including expired ones not yet evicted.
     */
    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public Set<String> cachedKeyIds() {
        synchronized (lock) {
            return ImmutableSet.copyOf(entries.keySet());
        }
    }

    /**
     * Evicts every expired entry.
     *
     * @return the number of entries evicted.
     */
    public int cleanupExpired() {
        synchronized (lock) {
            long now = currentTime.get();
            int removed = 0;
            Iterator<Entry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                if (isExpired(iterator.next(), now)) {
                    iterator.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                log.debug("Evicted {} expired keys.", removed);
            }
            return removed;
        }
    }

    public JwksCacheStats getStats() {
        synchronized (lock) {
            long now = currentTime.get();
            ImmutableMap.Builder<String, Long> ages = ImmutableMap.builder();
            int expired = 0;
            for (Map.Entry<String, Entry> e : entries.entrySet()) {
                ages.put(e.getKey(), TimeUnit.NANOSECONDS.toSeconds(now - e.getValue().getInsertedAt()));
                if (isExpired(e.getValue(), now)) {
                    expired++;
                }
            }
            return JwksCacheStats.builder()
                    .size(entries.size())
                    .maxSize(maxSize)
                    .ttlSeconds(TimeUnit.NANOSECONDS.toSeconds(ttlNanos))
                    .expiredEntries(expired)
                    .entryAgeSeconds(ages.build())
                    .build();
        }
    }

    private boolean isExpired(Entry entry, long now) {
        return now - entry.getInsertedAt() >= ttlNanos;
    }

    private static String normalize(String keyId) {
        return keyId == null ? DEFAULT_KEY_ID : keyId;
    }

    @Data
    private static class Entry {
        private final CachedKey value;
        private final long insertedAt;
    }
}
