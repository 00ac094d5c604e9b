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

import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Point-in-time view of a {@link JwksCache}.
 */
@Getter
@Builder
@ToString
public class JwksCacheStats {
    private final int size;
    private final int maxSize;
    private final long ttlSeconds;
    private final int expiredEntries;
    /**
     * Key id to entry age in seconds.
     */
    private final Map<String, Long> entryAgeSeconds;
}
