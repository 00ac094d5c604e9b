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
package io.delegator.common.security;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility methods for reading the unverified contents of JSON Web Tokens (JWT).
 * <p>
 * Nothing here checks signatures. Callers use these helpers only for cache bookkeeping (expiry, token id) on tokens
 * that they obtained from a trusted source, never to make authorization decisions.
 */
@Slf4j
public final class JwtUtils {

    private JwtUtils() {
    }

    /**
     * Extracts the "exp" claim.
     *
     * @param jsonWebToken the JWT
     * @return the expiration time in epoch seconds, or null if the token is blank, malformed, or has no numeric "exp"
     */
    public static Long extractExpirationTime(String jsonWebToken) {
        return parseExpirationTime(decodeBody(jsonWebToken));
    }

    /**
     * Extracts the "jti" claim.
     *
     * @param jsonWebToken the JWT
     * @return the token id, or null if absent or the token is malformed
     */
    public static String extractJwtId(String jsonWebToken) {
        return extractStringClaim(jsonWebToken, "jti");
    }

    /**
     * Extracts a string-valued claim from the token body.
     *
     * @param jsonWebToken the JWT
     * @param claim        the claim name
     * @return the claim value, or null if absent, not a string, or the token is malformed
     */
    public static String extractStringClaim(String jsonWebToken, String claim) {
        JsonObject body = decodeBody(jsonWebToken);
        if (body == null) {
            return null;
        }
        JsonElement value = body.get(claim);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            return null;
        }
        return value.getAsString();
    }

    /**
     * Decodes the claims (second segment) of a JWT.
     *
     * @param jsonWebToken the JWT
     * @return the claims object, or null if the token is not a well-formed three-part JWT
     */
    public static JsonObject decodeBody(String jsonWebToken) {
        if (jsonWebToken == null || jsonWebToken.trim().isEmpty()) {
            return null;
        }
        // header.body.signature
        String[] tokenParts = jsonWebToken.trim().split("\\.", -1);
        if (tokenParts.length != 3) {
            return null;
        }
        try {
            JsonElement element = JsonParser.parseString(decodeBase64(tokenParts[1]));
            return element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (IllegalArgumentException | JsonParseException e) {
            log.debug("Unable to decode JWT body: {}", e.toString());
            return null;
        }
    }

    private static String decodeBase64(String segment) {
        byte[] decoded;
        if (segment.indexOf('+') >= 0 || segment.indexOf('/') >= 0) {
            decoded = Base64.getDecoder().decode(segment);
        } else {
            decoded = Base64.getUrlDecoder().decode(segment);
        }
        return new String(decoded, StandardCharsets.UTF_8);
    }

    @VisibleForTesting
    static Long parseExpirationTime(JsonObject jwtBody) {
        if (jwtBody == null) {
            return null;
        }
        JsonElement exp = jwtBody.get("exp");
        if (exp == null || !exp.isJsonPrimitive() || !exp.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        return exp.getAsLong();
    }
}
