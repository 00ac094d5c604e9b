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

import io.delegator.client.oauth.TokenExchangeClientFactory;
import io.delegator.client.security.credentials.CredentialSupplier;
import io.delegator.client.security.verifier.JwksFetcher;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Configuration of an {@link AuthProvider}.
 */
@Getter
@Builder
@ToString
public class AuthProviderConfig {

    /**
     * Zone this service belongs to. Used with {@link #baseUrl} when {@link #zoneUrl} is not given.
     */
    private final String zoneId;

    /**
     * Issuer URL of the zone. In multi-zone mode, zone-specific issuers are derived from it by prefixing the host.
     */
    private final String zoneUrl;

    private final String baseUrl;

    /**
     * Name of this service, for logging and key naming.
     */
    private final String serviceName;

    /**
     * Public URL of this service (the protected resource).
     */
    private final String resourceServerUrl;

    /**
     * Client id of this service at the authorization server. Defaults to {@link #resourceServerUrl}.
     */
    private final String resourceClientId;

    @Singular
    private final List<String> requiredScopes;

    /**
     * Audience inbound tokens must carry, if any.
     */
    private final String audience;

    private final boolean multiZone;

    private final CredentialSupplier credentialSupplier;

    /**
     * How exchange clients are created; HTTP by default.
     */
    private final TokenExchangeClientFactory exchangeClientFactory;

    /**
     * How verifiers fetch keys; HTTP by default.
     */
    private final JwksFetcher jwksFetcher;
}
