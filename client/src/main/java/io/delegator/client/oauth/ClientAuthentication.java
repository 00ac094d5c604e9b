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
package io.delegator.client.oauth;

import com.google.common.base.Preconditions;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * How the exchange client authenticates itself to the token endpoint at the transport level.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ClientAuthentication {

    private static final ClientAuthentication NONE = new ClientAuthentication(null, null);

    private final String clientId;
    private final String clientSecret;

    /**
     * No transport authentication. The request itself may still carry a client assertion.
     */
    public static ClientAuthentication none() {
        return NONE;
    }

    /**
     * HTTP Basic authentication with the client id and secret (RFC 6749 section 2.3.1).
     */
    public static ClientAuthentication basic(String clientId, String clientSecret) {
        Preconditions.checkNotNull(clientId, "clientId");
        Preconditions.checkNotNull(clientSecret, "clientSecret");
        return new ClientAuthentication(clientId, clientSecret);
    }

    public boolean isNone() {
        return clientId == null;
    }

    /**
     * @return the value of the Authorization header, or null for {@link #none()}.
     */
    public String toAuthorizationHeader() {
        if (isNone()) {
            return null;
        }
        String credentials = URLEncoder.encode(clientId, StandardCharsets.UTF_8) + ":"
                + URLEncoder.encode(clientSecret, StandardCharsets.UTF_8);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return isNone() ? "ClientAuthentication(none)" : "ClientAuthentication(basic, clientId=" + clientId + ")";
    }
}
