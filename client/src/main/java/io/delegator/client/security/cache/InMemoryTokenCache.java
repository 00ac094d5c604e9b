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
import io.delegator.common.util.ConfigurationOptionsExtractor;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-local {@link TokenCache}. A token stops being served once the current time reaches its expiry minus the
 * leeway, and is evicted by the lookup that notices.
 */
@Slf4j
@ThreadSafe
public class InMemoryTokenCache implements TokenCache {

    @VisibleForTesting
    static final int DEFAULT_LEEWAY_SECONDS = 300;

    private static final String LEEWAY_SYSTEM_PROPERTY = "delegator.auth.token-cache.leeway";

    private static final String LEEWAY_ENV_VARIABLE = "delegator_auth_token-cache_leeway";

    @Getter(AccessLevel.PACKAGE)
    private final long leewaySeconds;
    private final Supplier<Long> epochSeconds;
    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Map<String, CachedToken> tokens = new HashMap<>();

    public InMemoryTokenCache() {
        this(ConfigurationOptionsExtractor.extractInt(LEEWAY_SYSTEM_PROPERTY, LEEWAY_ENV_VARIABLE,
                DEFAULT_LEEWAY_SECONDS));
    }

    public InMemoryTokenCache(long leewaySeconds) {
        this(leewaySeconds, () -> System.currentTimeMillis() / 1000);
    }

    /**
     * @param leewaySeconds how long before expiry a token stops being served
     * @param epochSeconds  time source, in epoch seconds
     */
    public InMemoryTokenCache(long leewaySeconds, Supplier<Long> epochSeconds) {
        Preconditions.checkArgument(leewaySeconds >= 0, "leewaySeconds must not be negative");
        this.leewaySeconds = leewaySeconds;
        this.epochSeconds = Preconditions.checkNotNull(epochSeconds, "epochSeconds");
    }

    @Override
    public CachedToken get(String key) {
        synchronized (lock) {
            CachedToken token = tokens.get(key);
            if (token == null) {
                return null;
            }
            if (epochSeconds.get() >= token.getExpiresAt() - leewaySeconds) {
                tokens.remove(key);
                log.debug("Token cached under {} is within {}s of expiry, evicted.", key, leewaySeconds);
                return null;
            }
            return token;
        }
    }

    @Override
    public void put(String key, CachedToken token) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(token, "token");
        synchronized (lock) {
            tokens.put(key, token);
        }
    }

    @Override
    public void remove(String key) {
        synchronized (lock) {
            tokens.remove(key);
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            tokens.clear();
        }
    }

    public int size() {
        synchronized (lock) {
            return tokens.size();
        }
    }
}
