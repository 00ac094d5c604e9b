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
package io.delegator.common.cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.delegator.common.Exceptions;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads values into a {@link KeyedCache} so that concurrent misses on the same key share a single load.
 * <p>
 * Lookups first consult the cache without taking the loader lock. On a miss the cache is checked again under the
 * lock and the caller either joins the load already running for that key or becomes its owner. The owner stores the
 * result and retires the in-flight entry under the same lock before completing the shared future, so a caller that
 * arrives afterwards always finds the value in the cache. Failed loads are not cached; the next caller retries.
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
@Slf4j
@ThreadSafe
public class SingleFlightCache<K, V> {

    private final KeyedCache<K, V> cache;
    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Map<K, CompletableFuture<V>> inFlight = new HashMap<>();

    public SingleFlightCache(KeyedCache<K, V> cache) {
        this.cache = Preconditions.checkNotNull(cache, "cache");
    }

    /**
     * Returns the cached value for the key, loading it at most once across concurrent callers if it is missing.
     *
     * @param key    The key.
     * @param loader Invoked by exactly one caller per miss. A null result is delivered but not cached.
     * @return A future with the cached or freshly loaded value.
     */
    public CompletableFuture<V> getOrLoad(K key, Function<? super K, CompletableFuture<V>> loader) {
        Preconditions.checkNotNull(key, "key");
        V cached = cache.get(key);
        if (cached != null) {
            log.debug("Cache hit for {}.", key);
            return CompletableFuture.completedFuture(cached);
        }

        final CompletableFuture<V> result;
        synchronized (lock) {
            cached = cache.get(key);
            if (cached != null) {
                log.debug("Cache hit for {} after acquiring the loader lock.", key);
                return CompletableFuture.completedFuture(cached);
            }
            CompletableFuture<V> pending = inFlight.get(key);
            if (pending != null) {
                log.debug("Joining in-flight load for {}.", key);
                return pending;
            }
            result = new CompletableFuture<>();
            inFlight.put(key, result);
        }

        log.debug("Cache miss for {}, loading.", key);
        CompletableFuture<V> load;
        try {
            load = loader.apply(key);
        } catch (Throwable ex) {
            if (Exceptions.mustRethrow(ex)) {
                throw ex;
            }
            load = CompletableFuture.failedFuture(ex);
        }
        load.whenComplete((value, ex) -> {
            synchronized (lock) {
                if (ex == null && value != null) {
                    cache.put(key, value);
                }
                inFlight.remove(key, result);
            }
            if (ex != null) {
                result.completeExceptionally(Exceptions.unwrap(ex));
            } else {
                result.complete(value);
            }
        });
        return result;
    }

    @VisibleForTesting
    int inFlightCount() {
        synchronized (lock) {
            return inFlight.size();
        }
    }
}
