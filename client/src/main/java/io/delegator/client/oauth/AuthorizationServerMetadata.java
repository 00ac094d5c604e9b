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

import com.google.gson.annotations.SerializedName;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * The subset of RFC 8414 authorization server metadata used by the exchange client.
 */
@Getter
@Builder
@ToString
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizationServerMetadata {

    @SerializedName("issuer")
    private String issuer;

    @SerializedName("token_endpoint")
    private String tokenEndpoint;

    @SerializedName("jwks_uri")
    private String jwksUri;

    @SerializedName("authorization_endpoint")
    private String authorizationEndpoint;

    @SerializedName("introspection_endpoint")
    private String introspectionEndpoint;

    @SerializedName("revocation_endpoint")
    private String revocationEndpoint;

    @SerializedName("registration_endpoint")
    private String registrationEndpoint;

    @SerializedName("grant_types_supported")
    private List<String> grantTypesSupported;

    @SerializedName("token_endpoint_auth_methods_supported")
    private List<String> tokenEndpointAuthMethodsSupported;
}
