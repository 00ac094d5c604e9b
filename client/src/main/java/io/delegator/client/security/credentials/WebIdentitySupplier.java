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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.delegator.auth.CredentialRuntimeException;
import io.delegator.auth.WebIdentityConfigurationException;
import io.delegator.client.oauth.OAuthConstants;
import io.delegator.client.oauth.TokenExchangeClient;
import io.delegator.client.oauth.TokenExchangeRequest;
import io.delegator.client.security.auth.AuthInfo;
import java.io.IOException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates with a private key JWT (RFC 7523) signed by a key pair that this service owns.
 * <p>
 * The key pair is loaded from storage, or generated and stored, on first use. Its public half is published through
 * {@link #getJwks()} so that the authorization server can verify the assertions.
 */
@Slf4j
public class WebIdentitySupplier implements CredentialSupplier {

    public static final Duration DEFAULT_ASSERTION_LIFETIME = Duration.ofMinutes(5);

    @VisibleForTesting
    static final int KEY_SIZE = 2048;

    @Getter
    private final String keyId;
    private final PrivateKeyStorage storage;
    private final String audience;
    private final Map<String, String> zoneAudiences;
    private final Duration assertionLifetime;
    private final Clock clock;

    private final Object lock = new Object();
    private volatile RSAKey signingKey;

    /**
     * @param serviceName       name of this service; the key id is derived from it unless one is given
     * @param keyId             explicit key id
     * @param storage           where the key pair lives; {@link FilePrivateKeyStorage} in the working directory by default
     * @param audience          audience of the assertions; the exchange client's issuer by default
     * @param zoneAudiences     per-zone audiences, taking precedence over audience
     * @param assertionLifetime validity of each assertion
     * @param clock             time source
     */
    @Builder
    private WebIdentitySupplier(String serviceName, String keyId, PrivateKeyStorage storage, String audience,
                                Map<String, String> zoneAudiences, Duration assertionLifetime, Clock clock) {
        String source = keyId != null && !keyId.trim().isEmpty() ? keyId : serviceName;
        if (source == null || source.trim().isEmpty()) {
            throw new WebIdentityConfigurationException("A service name or key id is required for web identity");
        }
        this.keyId = sanitizeKeyId(source.trim());
        this.storage = storage == null ? new FilePrivateKeyStorage() : storage;
        this.audience = audience;
        this.zoneAudiences = zoneAudiences == null ? ImmutableMap.of() : ImmutableMap.copyOf(zoneAudiences);
        this.assertionLifetime = assertionLifetime == null ? DEFAULT_ASSERTION_LIFETIME : assertionLifetime;
        Preconditions.checkArgument(!this.assertionLifetime.isNegative() && !this.assertionLifetime.isZero(),
                "assertionLifetime must be positive");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Replaces every character outside {@code [A-Za-z0-9_-]} with an underscore, so the id is safe as a file name.
     */
    @VisibleForTesting
    static String sanitizeKeyId(String source) {
        return source.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    @Override
    public CompletableFuture<TokenExchangeRequest> prepare(TokenExchangeClient client, String subjectToken,
                                                           String resource, AuthInfo authInfo) {
        if (authInfo == null || authInfo.getResourceClientId() == null || authInfo.getResourceClientId().isEmpty()) {
            throw new IllegalArgumentException("AuthInfo with a resourceClientId is required for web identity");
        }
        String assertionAudience = resolveAudience(authInfo.getZoneId(), client);
        try {
            String assertion = createClientAssertion(authInfo.getResourceClientId(), assertionAudience);
            return CompletableFuture.completedFuture(CredentialSupplier.baseRequest(subjectToken, resource)
                    .clientAssertion(assertion)
                    .clientAssertionType(OAuthConstants.CLIENT_ASSERTION_TYPE_JWT_BEARER)
                    .build());
        } catch (CredentialRuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String resolveAudience(String zoneId, TokenExchangeClient client) {
        if (zoneId != null && zoneAudiences.containsKey(zoneId)) {
            return zoneAudiences.get(zoneId);
        }
        if (audience != null) {
            return audience;
        }
        return client.getIssuer();
    }

    /**
     * Signs a client assertion.
     *
     * @param clientId the client id, used as issuer and subject
     * @param audience the intended audience
     * @return the serialized JWT
     * @throws CredentialRuntimeException if signing fails
     */
    public String createClientAssertion(String clientId, String audience) throws CredentialRuntimeException {
        RSAKey key = signingKey();
        Instant now = clock.instant();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(clientId)
                .subject(clientId)
                .audience(audience)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(assertionLifetime)))
                .jwtID(UUID.randomUUID().toString())
                .build();
        JWSHeader header = new JWSHeader.Builder(JWSAlgorithm.RS256)
                .keyID(key.getKeyID())
                .type(JOSEObjectType.JWT)
                .build();
        try {
            SignedJWT jwt = new SignedJWT(header, claims);
            jwt.sign(new RSASSASigner(key));
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new CredentialRuntimeException("Unable to sign client assertion with key " + keyId, e);
        }
    }

    @Override
    public Map<String, Object> getJwks() {
        return new JWKSet(getPublicJwk()).toJSONObject();
    }

    public RSAKey getPublicJwk() {
        return signingKey().toPublicJWK();
    }

    /**
     * Loads or creates the key pair on first use. Later calls return the same key.
     */
    private RSAKey signingKey() {
        RSAKey key = signingKey;
        if (key == null) {
            synchronized (lock) {
                key = signingKey;
                if (key == null) {
                    key = toJwk(loadOrCreateKeyPair());
                    signingKey = key;
                }
            }
        }
        return key;
    }

    private KeyPair loadOrCreateKeyPair() {
        try {
            KeyPair existing = storage.load(keyId);
            if (existing != null) {
                log.info("Loaded key pair {} from storage.", keyId);
                return existing;
            }
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(KEY_SIZE);
            KeyPair created = generator.generateKeyPair();
            storage.store(keyId, created);
            log.info("Created key pair {}.", keyId);
            return created;
        } catch (IOException | NoSuchAlgorithmException e) {
            throw new WebIdentityConfigurationException("Failed to bootstrap web identity key pair " + keyId, e);
        }
    }

    private RSAKey toJwk(KeyPair keyPair) {
        return new RSAKey.Builder((RSAPublicKey) keyPair.getPublic())
                .privateKey((RSAPrivateKey) keyPair.getPrivate())
                .keyID(keyId)
                .algorithm(JWSAlgorithm.RS256)
                .keyUse(KeyUse.SIGNATURE)
                .build();
    }
}
