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
package io.delegator.client.security.verifier;

import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A verified inbound bearer token and the claims the service acts on.
 */
@Getter
@Builder
@EqualsAndHashCode
public class AccessToken {
    private final String token;
    private final String clientId;
    private final List<String> scopes;
    /**
     * Expiry, in epoch seconds.
     */
    private final long expiresAt;
    private final String resource;

    @Override
    public String toString() {
        return "AccessToken(clientId=" + clientId + ", scopes=" + scopes + ", expiresAt=" + expiresAt
                + ", resource=" + resource + ")";
    }
}
