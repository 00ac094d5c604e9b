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
package io.delegator.client.security.verifier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.AsymmetricJWK;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.delegator.auth.InvalidClaimException;
import io.delegator.auth.InvalidTokenException;
import io.delegator.auth.TokenException;
import io.delegator.auth.TokenExpiredException;
import io.delegator.client.security.cache.CachedKey;
import io.delegator.client.security.cache.JwksCache;
import io.delegator.client.security.cache.JwksCacheStats;
import io.delegator.common.Exceptions;
import io.delegator.common.cache.SingleFlightCache;
import java.security.PublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies inbound bearer tokens issued by one authorization server.
 * <p>
 * Verification keys are fetched from the issuer's JWKS endpoint and cached by key id. Concurrent lookups of the same
 * uncached key id share one fetch.
 */
@Slf4j
public class TokenVerifier {

    public static final String DEFAULT_ALGORITHM = "RS256";

    @Getter
    private final String issuer;
    @Getter
    private final String jwksUri;
    @Getter
    private final List<String> requiredScopes;
    private final Set<JWSAlgorithm> allowedAlgorithms;
    private final String audience;
    private final JwksFetcher jwksFetcher;
    private final Clock clock;
    private final JwksCache keyCache;
    private final SingleFlightCache<String, CachedKey> keyLoader;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    /**
     * @param issuer            expected "iss" of every token
     * @param jwksUri           JWKS endpoint of the issuer
     * @param requiredScopes    scopes every token must carry
     * @param allowedAlgorithms accepted "alg" header values; RS256 by default
     * @param cacheTtl          lifetime of cached keys
     * @param audience          when set, must appear in "aud"
     * @param jwksFetcher       how keys are retrieved; HTTP by default
     * @param clock             time source
     */
    @Builder
    private TokenVerifier(String issuer, String jwksUri, List<String> requiredScopes, List<String> allowedAlgorithms,
                          Duration cacheTtl, String audience, JwksFetcher jwksFetcher, Clock clock) {
        this.issuer = Exceptions.checkNotNullOrEmpty(issuer, "issuer");
        this.jwksUri = jwksUri;
        this.requiredScopes = requiredScopes == null ? ImmutableList.of() : ImmutableList.copyOf(requiredScopes);
        List<String> algorithms = allowedAlgorithms == null || allowedAlgorithms.isEmpty()
                ? ImmutableList.of(DEFAULT_ALGORITHM) : allowedAlgorithms;
        this.allowedAlgorithms = algorithms.stream().map(JWSAlgorithm::parse).collect(ImmutableSet.toImmutableSet());
        this.audience = audience;
        this.jwksFetcher = jwksFetcher == null ? new HttpJwksFetcher() : jwksFetcher;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.keyCache = new JwksCache(cacheTtl == null ? JwksCache.DEFAULT_TTL : cacheTtl, JwksCache.DEFAULT_MAX_SIZE);
        this.keyLoader = new SingleFlightCache<>(keyCache);
    }

    /**
     * Verifies a token.
     *
     * @param token the serialized JWT
     * @return the verified token, or empty if the token is rejected for any reason. The future never fails.
     */
    public CompletableFuture<Optional<AccessToken>> verifyToken(String token) {
        final SignedJWT jwt;
        try {
            jwt = parse(token);
        } catch (TokenException e) {
            log.debug("Token rejected: {}", e.getMessage());
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return resolveKey(jwt)
                .thenApply(key -> {
                    try {
                        return Optional.of(validate(jwt, token, key));
                    } catch (TokenException e) {
                        log.debug("Token rejected: {}", e.getMessage());
                        return Optional.<AccessToken>empty();
                    }
                })
                .exceptionally(ex -> {
                    log.debug("Token rejected: {}", Exceptions.unwrap(ex).toString());
                    return Optional.empty();
                });
    }

    private SignedJWT parse(String token) throws TokenException {
        if (token == null || token.isEmpty()) {
            throw new InvalidTokenException("Token is empty");
        }
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new InvalidTokenException("Token is not a signed JWT", e);
        }
        JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
        if (!allowedAlgorithms.contains(algorithm)) {
            throw new InvalidTokenException("Unsupported algorithm: " + algorithm);
        }
        return jwt;
    }

    private CompletableFuture<CachedKey> resolveKey(SignedJWT jwt) {
        if (jwksUri == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("JWKS URI not configured"));
        }
        String keyId = jwt.getHeader().getKeyID();
        String algorithm = jwt.getHeader().getAlgorithm().getName();
        String cacheKey = keyId == null ? JwksCache.DEFAULT_KEY_ID : keyId;
        return keyLoader.getOrLoad(cacheKey, k -> jwksFetcher.fetch(jwksUri).thenApply(jwks -> {
            JWK key = selectKey(jwks, keyId);
            if (key == null) {
                throw Exceptions.asCompletionException(
                        new InvalidTokenException("No verification key " + (keyId == null ? "" : keyId + " ") + "at " + jwksUri));
            }
            return new CachedKey(key, algorithm, Instant.now(clock));
        }));
    }

    @VisibleForTesting
    static JWK selectKey(JWKSet jwks, String keyId) {
        if (keyId != null) {
            return jwks.getKeyByKeyId(keyId);
        }
        return jwks.getKeys().stream()
                .filter(k -> k.getKeyUse() == null || KeyUse.SIGNATURE.equals(k.getKeyUse()))
                .findFirst()
                .orElse(null);
    }

    private AccessToken validate(SignedJWT jwt, String token, CachedKey cachedKey) throws TokenException {
        if (!(cachedKey.getKey() instanceof AsymmetricJWK)) {
            throw new InvalidTokenException("Key " + cachedKey.getKey().getKeyID() + " is not a public key");
        }
        try {
            PublicKey publicKey = ((AsymmetricJWK) cachedKey.getKey()).toPublicKey();
            JWSVerifier verifier = verifierFactory.createJWSVerifier(jwt.getHeader(), publicKey);
            if (!jwt.verify(verifier)) {
                throw new InvalidTokenException("Signature verification failed");
            }
        } catch (JOSEException e) {
            throw new InvalidTokenException("Signature could not be verified", e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new InvalidTokenException("Claims are not valid JSON", e);
        }

        Date exp = claims.getExpirationTime();
        if (exp == null) {
            throw new InvalidClaimException("exp", "Token has no expiration time");
        }
        if (!exp.toInstant().isAfter(clock.instant())) {
            throw new TokenExpiredException("Token expired at " + exp.toInstant());
        }
        if (!issuer.equals(claims.getIssuer())) {
            throw new InvalidClaimException("iss", "Unexpected issuer " + claims.getIssuer());
        }
        if (audience != null && (claims.getAudience() == null || !claims.getAudience().contains(audience))) {
            throw new InvalidClaimException("aud", "Token is not intended for " + audience);
        }

        List<String> scopes = scopes(claims);
        if (!scopes.containsAll(requiredScopes)) {
            throw new InvalidClaimException("scope", "Token lacks required scopes " + requiredScopes);
        }

        return AccessToken.builder()
                .token(token)
                .clientId(clientId(claims))
                .scopes(scopes)
                .expiresAt(exp.toInstant().getEpochSecond())
                .resource(stringClaim(claims, "resource"))
                .build();
    }

    private static List<String> scopes(JWTClaimsSet claims) {
        String scope = stringClaim(claims, "scope");
        if (scope == null || scope.trim().isEmpty()) {
            return ImmutableList.of();
        }
        return Arrays.stream(scope.trim().split("\\s+")).collect(Collectors.collectingAndThen(Collectors.toList(),
                ImmutableList::copyOf));
    }

    private static String clientId(JWTClaimsSet claims) {
        String clientId = stringClaim(claims, "client_id");
        if (clientId == null) {
            clientId = stringClaim(claims, "azp");
        }
        return clientId != null ? clientId : claims.getSubject();
    }

    private static String stringClaim(JWTClaimsSet claims, String name) {
        Object value = claims.getClaim(name);
        return value instanceof String ? (String) value : null;
    }

    public void clearCache() {
        keyCache.clear();
    }

    public JwksCacheStats getCacheStats() {
        return keyCache.getStats();
    }
}
