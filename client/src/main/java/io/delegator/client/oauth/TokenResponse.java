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

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.delegator.auth.TokenExchangeException;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A successful token endpoint response.
 */
@Getter
@EqualsAndHashCode
public final class TokenResponse {

    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    private final String accessToken;
    private final String tokenType;
    /**
     * Lifetime in seconds, or null when the server did not say.
     */
    private final Long expiresIn;
    private final String refreshToken;
    private final List<String> scope;
    private final String issuedTokenType;
    private final String subjectIssuer;

    @Builder
    private TokenResponse(String accessToken, String tokenType, Long expiresIn, String refreshToken,
                          List<String> scope, String issuedTokenType, String subjectIssuer) {
        this.accessToken = accessToken;
        this.tokenType = tokenType == null ? DEFAULT_TOKEN_TYPE : tokenType;
        this.expiresIn = expiresIn;
        this.refreshToken = refreshToken;
        this.scope = scope == null ? null : ImmutableList.copyOf(scope);
        this.issuedTokenType = issuedTokenType;
        this.subjectIssuer = subjectIssuer;
    }

    /**
     * Reads a token endpoint JSON body. The "scope" member may be a space-delimited string or an array.
     *
     * @param json the parsed body
     * @return the response
     * @throws TokenExchangeException if the body carries an OAuth error or lacks an access token
     */
    public static TokenResponse fromJson(JsonObject json) throws TokenExchangeException {
        if (json.has("error")) {
            String error = string(json, "error");
            throw new TokenExchangeException(error == null ? "invalid_response" : error,
                    string(json, "error_description"), TokenExchangeException.NO_HTTP_STATUS);
        }
        String accessToken = string(json, "access_token");
        if (accessToken == null || accessToken.isEmpty()) {
            throw new TokenExchangeException("invalid_response", "Token response has no access_token.",
                    TokenExchangeException.NO_HTTP_STATUS);
        }
        JsonElement expiresIn = json.get("expires_in");
        return TokenResponse.builder()
                .accessToken(accessToken)
                .tokenType(string(json, "token_type"))
                .expiresIn(expiresIn == null || expiresIn.isJsonNull() ? null : expiresIn.getAsLong())
                .refreshToken(string(json, "refresh_token"))
                .scope(scopes(json.get("scope")))
                .issuedTokenType(string(json, "issued_token_type"))
                .subjectIssuer(string(json, "subject_issuer"))
                .build();
    }

    private static List<String> scopes(JsonElement scope) {
        if (scope == null || scope.isJsonNull()) {
            return null;
        }
        ImmutableList.Builder<String> result = ImmutableList.builder();
        if (scope.isJsonArray()) {
            JsonArray array = scope.getAsJsonArray();
            array.forEach(e -> result.add(e.getAsString()));
        } else {
            for (String s : scope.getAsString().trim().split("\\s+")) {
                if (!s.isEmpty()) {
                    result.add(s);
                }
            }
        }
        return result.build();
    }

    private static String string(JsonObject json, String member) {
        JsonElement e = json.get(member);
        return e != null && e.isJsonPrimitive() ? e.getAsString() : null;
    }

    @Override
    public String toString() {
        return "TokenResponse(tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", scope=" + scope
                + ", issuedTokenType=" + issuedTokenType + ")";
    }
}
