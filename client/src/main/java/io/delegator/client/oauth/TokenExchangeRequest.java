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

import io.delegator.common.Exceptions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An RFC 8693 token exchange request. Instances are immutable; credential suppliers derive enriched copies through
 * {@link #toBuilder()}.
 */
@Getter
@EqualsAndHashCode
public final class TokenExchangeRequest {

    private final String subjectToken;
    private final String subjectTokenType;
    private final String resource;
    private final String audience;
    private final String scope;
    private final String requestedTokenType;
    private final String actorToken;
    private final String actorTokenType;
    private final String clientId;
    private final String clientAssertion;
    private final String clientAssertionType;

    @Builder(toBuilder = true)
    private TokenExchangeRequest(String subjectToken, String subjectTokenType, String resource, String audience,
                                 String scope, String requestedTokenType, String actorToken, String actorTokenType,
                                 String clientId, String clientAssertion, String clientAssertionType) {
        this.subjectToken = Exceptions.checkNotNullOrEmpty(subjectToken, "subjectToken");
        this.subjectTokenType = subjectTokenType == null ? OAuthConstants.TOKEN_TYPE_ACCESS_TOKEN : subjectTokenType;
        Exceptions.checkArgument(actorToken == null || actorTokenType != null, "actorTokenType",
                "Required when an actor token is present.");
        Exceptions.checkArgument(clientAssertion == null || clientAssertionType != null, "clientAssertionType",
                "Required when a client assertion is present.");
        this.resource = resource;
        this.audience = audience;
        this.scope = scope;
        this.requestedTokenType = requestedTokenType;
        this.actorToken = actorToken;
        this.actorTokenType = actorTokenType;
        this.clientId = clientId;
        this.clientAssertion = clientAssertion;
        this.clientAssertionType = clientAssertionType;
    }

    public String getGrantType() {
        return OAuthConstants.GRANT_TYPE_TOKEN_EXCHANGE;
    }

    /**
     * Renders the request as form parameters in a stable order, leaving out absent values.
     *
     * @return parameter name to value.
     */
    public Map<String, String> toFormParameters() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", getGrantType());
        form.put("subject_token", subjectToken);
        form.put("subject_token_type", subjectTokenType);
        putIfPresent(form, "resource", resource);
        putIfPresent(form, "audience", audience);
        putIfPresent(form, "scope", scope);
        putIfPresent(form, "requested_token_type", requestedTokenType);
        putIfPresent(form, "actor_token", actorToken);
        putIfPresent(form, "actor_token_type", actorTokenType);
        putIfPresent(form, "client_id", clientId);
        putIfPresent(form, "client_assertion", clientAssertion);
        putIfPresent(form, "client_assertion_type", clientAssertionType);
        return Collections.unmodifiableMap(form);
    }

    private static void putIfPresent(Map<String, String> form, String name, String value) {
        if (value != null && !value.isEmpty()) {
            form.put(name, value);
        }
    }

    @Override
    public String toString() {
        // Tokens and assertions stay out of logs.
        return "TokenExchangeRequest(resource=" + resource + ", audience=" + audience + ", scope=" + scope
                + ", subjectTokenType=" + subjectTokenType + ", clientAssertion=" + (clientAssertion != null) + ")";
    }
}
