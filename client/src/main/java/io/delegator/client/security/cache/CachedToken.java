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

import io.delegator.common.Exceptions;
import io.delegator.common.LoggerHelpers;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A derived token and the absolute time (epoch seconds) at which it expires.
 */
@Getter
@EqualsAndHashCode
public final class CachedToken {
    private final String token;
    private final long expiresAt;

    public CachedToken(String token, long expiresAt) {
        this.token = Exceptions.checkNotNullOrEmpty(token, "token");
        this.expiresAt = expiresAt;
    }

    @Override
    public String toString() {
        return "CachedToken(token=" + LoggerHelpers.redact(token) + ", expiresAt=" + expiresAt + ")";
    }
}
