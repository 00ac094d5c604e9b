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

import java.util.concurrent.CompletableFuture;

/**
 * Client for a single authorization server (issuer).
 */
public interface TokenExchangeClient {

    /**
     * @return the issuer URL this client is bound to.
     */
    String getIssuer();

    /**
     * Fetches (once) and returns the authorization server metadata.
     *
     * @return a future that fails with {@link io.delegator.auth.MetadataDiscoveryException} if discovery fails.
     */
    CompletableFuture<AuthorizationServerMetadata> discoverServerMetadata();

    /**
     * Performs a token exchange.
     *
     * @param request the request
     * @return a future that fails with {@link io.delegator.auth.TokenExchangeException} if the server rejects it.
     */
    CompletableFuture<TokenResponse> exchangeToken(TokenExchangeRequest request);
}
