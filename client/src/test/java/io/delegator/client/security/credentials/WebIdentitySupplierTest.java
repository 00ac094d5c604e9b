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
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.SignedJWT;
import io.delegator.auth.WebIdentityConfigurationException;
import io.delegator.client.oauth.OAuthConstants;
import io.delegator.client.oauth.TokenExchangeClient;
import io.delegator.client.oauth.TokenExchangeRequest;
import io.delegator.client.security.auth.AuthInfo;
import io.delegator.test.common.AssertExtensions;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class WebIdentitySupplierTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testKeyIdDerivation() {
        assertEquals("my_service_v1", WebIdentitySupplier.sanitizeKeyId("my service.v1"));
        assertEquals("abc-DEF_09", WebIdentitySupplier.sanitizeKeyId("abc-DEF_09"));

        WebIdentitySupplier supplier = WebIdentitySupplier.builder()
                .serviceName("billing/api")
                .storage(new InMemoryPrivateKeyStorage())
                .build();
        assertEquals("billing_api", supplier.getKeyId());

        WebIdentitySupplier explicit = WebIdentitySupplier.builder()
                .serviceName("billing")
                .keyId("billing-key-2")
                .storage(new InMemoryPrivateKeyStorage())
                .build();
        assertEquals("billing-key-2", explicit.getKeyId());

        AssertExtensions.assertThrows("Name or key id is required.",
                () -> WebIdentitySupplier.builder().storage(new InMemoryPrivateKeyStorage()).build(),
                ex -> ex instanceof WebIdentityConfigurationException);
        AssertExtensions.assertThrows("Blank name is rejected.",
                () -> WebIdentitySupplier.builder().serviceName("  ").build(),
                ex -> ex instanceof WebIdentityConfigurationException);
    }

    @Test
    public void testClientAssertion() throws Exception {
        WebIdentitySupplier supplier = WebIdentitySupplier.builder()
                .serviceName("svc")
                .storage(new InMemoryPrivateKeyStorage())
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .assertionLifetime(Duration.ofMinutes(2))
                .build();
        TokenExchangeClient client = mock(TokenExchangeClient.class);
        when(client.getIssuer()).thenReturn("https://auth.example.com/zone1");

        TokenExchangeRequest request = supplier.prepare(client, "caller-token", "https://api",
                AuthInfo.builder().resourceClientId("svc-client").build()).join();
        assertEquals("caller-token", request.getSubjectToken());
        assertEquals("https://api", request.getResource());
        assertEquals(OAuthConstants.CLIENT_ASSERTION_TYPE_JWT_BEARER, request.getClientAssertionType());

        SignedJWT assertion = SignedJWT.parse(request.getClientAssertion());
        assertEquals(JWSAlgorithm.RS256, assertion.getHeader().getAlgorithm());
        assertEquals("svc", assertion.getHeader().getKeyID());
        assertTrue(assertion.verify(new RSASSAVerifier(supplier.getPublicJwk())));
        assertEquals("svc-client", assertion.getJWTClaimsSet().getIssuer());
        assertEquals("svc-client", assertion.getJWTClaimsSet().getSubject());
        assertEquals(Collections.singletonList("https://auth.example.com/zone1"),
                assertion.getJWTClaimsSet().getAudience());
        assertEquals(NOW, assertion.getJWTClaimsSet().getIssueTime().toInstant());
        assertEquals(NOW.plus(Duration.ofMinutes(2)), assertion.getJWTClaimsSet().getExpirationTime().toInstant());

        String other = supplier.createClientAssertion("svc-client", "aud");
        assertNotEquals(assertion.getJWTClaimsSet().getJWTID(), SignedJWT.parse(other).getJWTClaimsSet().getJWTID());
    }

    @Test
    public void testAudienceResolution() throws Exception {
        WebIdentitySupplier supplier = WebIdentitySupplier.builder()
                .serviceName("svc")
                .storage(new InMemoryPrivateKeyStorage())
                .audience("https://default-aud")
                .zoneAudiences(ImmutableMap.of("zone2", "https://zone2-aud"))
                .build();
        TokenExchangeClient client = mock(TokenExchangeClient.class);
        when(client.getIssuer()).thenReturn("https://issuer");

        TokenExchangeRequest zoned = supplier.prepare(client, "t", "r",
                AuthInfo.builder().resourceClientId("c").zoneId("zone2").build()).join();
        assertEquals(Collections.singletonList("https://zone2-aud"),
                SignedJWT.parse(zoned.getClientAssertion()).getJWTClaimsSet().getAudience());

        TokenExchangeRequest other = supplier.prepare(client, "t", "r",
                AuthInfo.builder().resourceClientId("c").zoneId("zone1").build()).join();
        assertEquals(Collections.singletonList("https://default-aud"),
                SignedJWT.parse(other.getClientAssertion()).getJWTClaimsSet().getAudience());
    }

    @Test
    public void testMissingResourceClientId() {
        WebIdentitySupplier supplier = WebIdentitySupplier.builder()
                .serviceName("svc")
                .storage(new InMemoryPrivateKeyStorage())
                .build();
        TokenExchangeClient client = mock(TokenExchangeClient.class);
        AssertExtensions.assertThrows("AuthInfo is required.",
                () -> supplier.prepare(client, "t", "r", null),
                ex -> ex instanceof IllegalArgumentException && ex.getMessage().contains("resourceClientId"));
        AssertExtensions.assertThrows("resourceClientId is required.",
                () -> supplier.prepare(client, "t", "r", AuthInfo.EMPTY),
                ex -> ex instanceof IllegalArgumentException);
    }

    @Test
    public void testJwksPublishesPublicKeyOnly() throws Exception {
        WebIdentitySupplier supplier = WebIdentitySupplier.builder()
                .serviceName("svc")
                .storage(new InMemoryPrivateKeyStorage())
                .build();
        Map<String, Object> jwks = supplier.getJwks();
        JWKSet set = JWKSet.parse(jwks);
        assertEquals(1, set.getKeys().size());
        RSAKey key = (RSAKey) set.getKeys().get(0);
        assertEquals("svc", key.getKeyID());
        assertEquals(JWSAlgorithm.RS256, key.getAlgorithm());
        assertFalse(key.isPrivate());
    }

    @Test
    public void testKeyPairSurvivesRestart() throws Exception {
        FilePrivateKeyStorage storage = new FilePrivateKeyStorage(folder.getRoot().toPath());
        RSAKey first = WebIdentitySupplier.builder().serviceName("svc").storage(storage).build().getPublicJwk();
        RSAKey second = WebIdentitySupplier.builder().serviceName("svc").storage(storage).build().getPublicJwk();
        assertEquals(first.getKeyID(), second.getKeyID());
        assertEquals(first.getModulus(), second.getModulus());
        assertEquals(first.getPublicExponent(), second.getPublicExponent());

        RSAKey inMemoryFirst = WebIdentitySupplier.builder().serviceName("svc")
                .storage(new InMemoryPrivateKeyStorage()).build().getPublicJwk();
        assertNotEquals(first.getModulus(), inMemoryFirst.getModulus());
    }
}
