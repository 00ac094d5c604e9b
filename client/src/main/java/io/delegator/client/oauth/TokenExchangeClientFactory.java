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

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates a {@link TokenExchangeClient} for an issuer.
 */
@FunctionalInterface
public interface TokenExchangeClientFactory {

    Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    TokenExchangeClient create(String issuer, ClientAuthentication authentication);

    /**
     * A factory whose clients share one {@link HttpClient}.
     */
    static TokenExchangeClientFactory http(HttpClient httpClient, Duration requestTimeout) {
        return (issuer, authentication) -> new HttpTokenExchangeClient(issuer, authentication, httpClient, requestTimeout);
    }

    static TokenExchangeClientFactory http() {
        return http(HttpClient.newBuilder().connectTimeout(DEFAULT_REQUEST_TIMEOUT).build(), DEFAULT_REQUEST_TIMEOUT);
    }
}
