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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import io.delegator.auth.ClientSecretConfigurationException;
import io.delegator.client.oauth.ClientAuthentication;
import io.delegator.client.oauth.TokenExchangeClient;
import io.delegator.client.oauth.TokenExchangeRequest;
import io.delegator.client.security.auth.AuthInfo;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates with a client id and secret over HTTP Basic, either one pair for every zone or one pair per zone.
 * Exchange requests carry no client assertion.
 */
@Slf4j
public class ClientSecretSupplier implements CredentialSupplier {

    private final ClientCredentials credentials;
    private final Map<String, ClientCredentials> zoneCredentials;

    public ClientSecretSupplier(ClientCredentials credentials) {
        if (credentials == null) {
            throw new ClientSecretConfigurationException("Client credentials must not be null");
        }
        this.credentials = credentials;
        this.zoneCredentials = null;
    }

    public ClientSecretSupplier(Map<String, ClientCredentials> zoneCredentials) {
        if (zoneCredentials == null || zoneCredentials.isEmpty()) {
            throw new ClientSecretConfigurationException("At least one zone must be configured");
        }
        zoneCredentials.forEach((zone, creds) -> {
            if (zone == null || creds == null) {
                throw new ClientSecretConfigurationException("Zone credentials must not contain null entries");
            }
        });
        this.credentials = null;
        this.zoneCredentials = ImmutableMap.copyOf(zoneCredentials);
    }

    /**
     * Creates a supplier from loosely typed configuration: a {@link ClientCredentials}, or a map of zone id to
     * {@link ClientCredentials}.
     *
     * @param configuration the configuration value
     * @return the supplier
     * @throws ClientSecretConfigurationException for any other input
     */
    public static ClientSecretSupplier fromConfiguration(Object configuration) {
        if (configuration instanceof ClientCredentials) {
            return new ClientSecretSupplier((ClientCredentials) configuration);
        }
        if (configuration instanceof Map) {
            ImmutableMap.Builder<String, ClientCredentials> zones = ImmutableMap.builder();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) configuration).entrySet()) {
                if (!(e.getKey() instanceof String) || !(e.getValue() instanceof ClientCredentials)) {
                    throw new ClientSecretConfigurationException(
                            "Invalid credentials type provided to ClientSecret: map entries must be zone id to "
                                    + "ClientCredentials, found " + typeName(e.getKey()) + " to " + typeName(e.getValue()));
                }
                zones.put((String) e.getKey(), (ClientCredentials) e.getValue());
            }
            return new ClientSecretSupplier(zones.build());
        }
        throw new ClientSecretConfigurationException("Invalid credentials type provided to ClientSecret: "
                + typeName(configuration) + ". Expected ClientCredentials or Map<String, ClientCredentials>.");
    }

    public boolean isMultiZone() {
        return zoneCredentials != null;
    }

    public Set<String> getConfiguredZones() {
        return zoneCredentials == null ? ImmutableSortedSet.of() : ImmutableSortedSet.copyOf(zoneCredentials.keySet());
    }

    @Override
    public CompletableFuture<TokenExchangeRequest> prepare(TokenExchangeClient client, String subjectToken,
                                                           String resource, AuthInfo authInfo) {
        return CompletableFuture.completedFuture(CredentialSupplier.baseRequest(subjectToken, resource).build());
    }

    @Override
    public ClientAuthentication clientAuthentication(String zoneId) {
        if (!isMultiZone()) {
            return ClientAuthentication.basic(credentials.getClientId(), credentials.getClientSecret());
        }
        ClientCredentials zone = zoneId == null ? null : zoneCredentials.get(zoneId);
        if (zone == null) {
            throw new ClientSecretConfigurationException(String.format(
                    "No credentials configured for zone '%s'. Available zones: %s", zoneId, getConfiguredZones()));
        }
        log.debug("Using client credentials {} for zone {}.", zone.getClientId(), zoneId);
        return ClientAuthentication.basic(zone.getClientId(), zone.getClientSecret());
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
