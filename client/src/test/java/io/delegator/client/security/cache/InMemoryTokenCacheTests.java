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

import java.util.concurrent.atomic.AtomicLong;
import lombok.val;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

/**
 * Unit tests for the {@link InMemoryTokenCache} class.
 */
public class InMemoryTokenCacheTests {

    /**
     * A token is served until now reaches expiry minus the leeway, and repeated reads return the same token.
     */
    @Test
    public void testLeeway() {
        val now = new AtomicLong(1_000);
        val cache = new InMemoryTokenCache(300, now::get);
        cache.put("jti-1", "derived", 2_000);

        assertEquals("derived", cache.get("jti-1").getToken());
        now.set(1_699);
        assertEquals("derived", cache.get("jti-1").getToken());
        assertEquals("derived", cache.get("jti-1").getToken());

        now.set(1_700);
        assertNull(cache.get("jti-1"));
        assertEquals(0, cache.size());
    }

    @Test
    public void testZeroLeeway() {
        val now = new AtomicLong(100);
        val cache = new InMemoryTokenCache(0, now::get);
        cache.put("k", new CachedToken("t", 101));
        assertEquals(101, cache.get("k").getExpiresAt());
        now.set(101);
        assertNull(cache.get("k"));
    }

    @Test
    public void testRemoveAndClear() {
        val cache = new InMemoryTokenCache(0, () -> 0L);
        cache.put("a", "t", 10);
        cache.put("b", "t", 10);
        cache.remove("a");
        assertNull(cache.get("a"));
        assertEquals(1, cache.size());
        cache.clear();
        assertEquals(0, cache.size());
    }

    @Test
    public void testDefaultLeeway() {
        assertEquals(InMemoryTokenCache.DEFAULT_LEEWAY_SECONDS, new InMemoryTokenCache().getLeewaySeconds());
    }
}
