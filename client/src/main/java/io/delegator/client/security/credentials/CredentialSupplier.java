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

import io.delegator.client.oauth.ClientAuthentication;
import io.delegator.client.oauth.OAuthConstants;
import io.delegator.client.oauth.TokenExchangeClient;
import io.delegator.client.oauth.TokenExchangeRequest;
import io.delegator.client.security.auth.AuthInfo;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies the material that authenticates this service when it exchanges a caller's token.
 * <p>
 * Suppliers fail with an {@link io.delegator.auth.AuthConfigurationException} subtype for input that can never work,
 * and with a {@link io.delegator.auth.CredentialRuntimeException} when a credential source that was valid becomes
 * unavailable.
 */
public interface CredentialSupplier {

    /**
     * Builds the exchange request for one resource.
     *
     * @param client       the exchange client of the zone being served
     * @param subjectToken the caller's token
     * @param resource     the target resource
     * @param authInfo     request details; see each implementation for what it requires
     * @return a future with the request to send
     */
    CompletableFuture<TokenExchangeRequest> prepare(TokenExchangeClient client, String subjectToken, String resource,
                                                    AuthInfo authInfo);

    /**
     * Transport-level authentication for the exchange client of the given zone.
     *
     * @param zoneId the zone, or null outside multi-zone deployments
     * @return the authentication to use; {@link ClientAuthentication#none()} by default
     */
    default ClientAuthentication clientAuthentication(String zoneId) {
        return ClientAuthentication.none();
    }

    /**
     * @return the JWKS document of the keys this supplier signs with, or an empty map if it signs nothing.
     */
    default Map<String, Object> getJwks() {
        return Collections.emptyMap();
    }

    /**
     * The request every supplier starts from: the caller's access token exchanged for the resource.
     */
    static TokenExchangeRequest.TokenExchangeRequestBuilder baseRequest(String subjectToken, String resource) {
        return TokenExchangeRequest.builder()
                .subjectToken(subjectToken)
                .subjectTokenType(OAuthConstants.TOKEN_TYPE_ACCESS_TOKEN)
                .resource(resource);
    }
}
