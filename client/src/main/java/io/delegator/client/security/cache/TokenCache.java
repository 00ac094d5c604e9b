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

import io.delegator.common.cache.KeyedCache;

/**
 * Cache of derived tokens. Implementations decide how close to expiry a token stops being served.
 */
public interface TokenCache extends KeyedCache<String, CachedToken> {

    /**
     * @param key cache key
     * @return the token, or null if absent or too close to expiry.
     */
    @Override
    CachedToken get(String key);

    @Override
    void put(String key, CachedToken token);

    default void put(String key, String token, long expiresAt) {
        put(key, new CachedToken(token, expiresAt));
    }

    void remove(String key);

    void clear();
}
