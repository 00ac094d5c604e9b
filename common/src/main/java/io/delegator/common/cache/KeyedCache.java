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

/**
 * A key/value store whose entries may disappear on their own (expiry, eviction).
 *
 * @param <K> Key type.
 * @param <V> Value type.
 */
public interface KeyedCache<K, V> {

    /**
     * Looks up a live entry.
     *
     * @param key The key.
     * @return The value, or null if absent or no longer valid.
     */
    V get(K key);

    /**
     * Inserts or replaces an entry.
     *
     * @param key   The key.
     * @param value The value.
     */
    void put(K key, V value);
}
