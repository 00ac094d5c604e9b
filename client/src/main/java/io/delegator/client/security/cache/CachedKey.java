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

import com.google.common.base.Preconditions;
import com.nimbusds.jose.jwk.JWK;
import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A verification key taken from a JWKS document.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CachedKey {
    private final JWK key;
    private final String algorithm;
    private final Instant fetchedAt;

    public CachedKey(JWK key, String algorithm, Instant fetchedAt) {
        this.key = Preconditions.checkNotNull(key, "key");
        this.algorithm = algorithm;
        this.fetchedAt = Preconditions.checkNotNull(fetchedAt, "fetchedAt");
    }
}
