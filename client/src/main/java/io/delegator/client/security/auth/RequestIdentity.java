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
package io.delegator.client.security.auth;

import io.delegator.common.LoggerHelpers;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable {@link IdentityContext}.
 */
@Getter
@Builder
@EqualsAndHashCode
public class RequestIdentity implements IdentityContext {
    private final String bearerToken;
    private final String zoneId;

    public static RequestIdentity of(String bearerToken) {
        return new RequestIdentity(bearerToken, null);
    }

    public static RequestIdentity of(String bearerToken, String zoneId) {
        return new RequestIdentity(bearerToken, zoneId);
    }

    @Override
    public String toString() {
        return "RequestIdentity(bearerToken=" + LoggerHelpers.redact(bearerToken) + ", zoneId=" + zoneId + ")";
    }
}
