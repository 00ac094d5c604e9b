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
package io.delegator.client.security.credentials;

import io.delegator.common.Exceptions;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A client id and secret registered with an authorization server.
 */
@Getter
@EqualsAndHashCode
public final class ClientCredentials {
    private final String clientId;
    private final String clientSecret;

    public ClientCredentials(String clientId, String clientSecret) {
        this.clientId = Exceptions.checkNotNullOrEmpty(clientId, "clientId");
        this.clientSecret = Exceptions.checkNotNullOrEmpty(clientSecret, "clientSecret");
    }

    @Override
    public String toString() {
        return "ClientCredentials(clientId=" + clientId + ")";
    }
}
