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

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.delegator.auth.MetadataDiscoveryException;
import io.delegator.auth.TokenExchangeException;
import io.delegator.test.common.AssertExtensions;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class HttpTokenExchangeClientTest {

    @Rule
    public Timeout globalTimeout = Timeout.seconds(60);

    private HttpServer server;
    private String issuer;
    private final AtomicInteger metadataRequests = new AtomicInteger();
    private final AtomicReference<Map<String, String>> lastForm = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();
    private final AtomicReference<String> tokenResponseBody = new AtomicReference<>(
            "{\"access_token\":\"exchanged\",\"token_type\":\"Bearer\",\"expires_in\":3600,\"scope\":\"read write\"}");
    private final AtomicInteger tokenResponseStatus = new AtomicInteger(200);

    @Before
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        issuer = "http://127.0.0.1:" + server.getAddress().getPort();
        server.createContext(OAuthConstants.WELL_KNOWN_METADATA_PATH, exchange -> {
            metadataRequests.incrementAndGet();
            respond(exchange, 200, "{\"issuer\":\"" + issuer + "\",\"token_endpoint\":\"" + issuer + "/token\","
                    + "\"jwks_uri\":\"" + issuer + "/.well-known/jwks.json\"}");
        });
        server.createContext("/token", exchange -> {
            lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastForm.set(parseForm(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8)));
            respond(exchange, tokenResponseStatus.get(), tokenResponseBody.get());
        });
        server.start();
    }

    @After
    public void tearDown() {
        server.stop(0);
    }

    private HttpTokenExchangeClient newClient(ClientAuthentication authentication) {
        return new HttpTokenExchangeClient(issuer + "/", authentication, HttpClient.newHttpClient(), Duration.ofSeconds(10));
    }

    @Test
    public void testExchangeSendsFormAndBasicAuthentication() {
        HttpTokenExchangeClient client = newClient(ClientAuthentication.basic("svc", "s3cret"));
        TokenResponse response = client.exchangeToken(TokenExchangeRequest.builder()
                .subjectToken("caller-token")
                .resource("https://api.example.com/v1")
                .build()).join();

        assertEquals(issuer, client.getIssuer());
        assertEquals("exchanged", response.getAccessToken());
        assertEquals(Long.valueOf(3600), response.getExpiresIn());
        assertEquals(Arrays.asList("read", "write"), response.getScope());
        assertEquals("caller-token", lastForm.get().get("subject_token"));
        assertEquals("https://api.example.com/v1", lastForm.get().get("resource"));
        assertEquals(OAuthConstants.GRANT_TYPE_TOKEN_EXCHANGE, lastForm.get().get("grant_type"));
        assertEquals(ClientAuthentication.basic("svc", "s3cret").toAuthorizationHeader(), lastAuthorization.get());
    }

    @Test
    public void testMetadataIsDiscoveredOnce() {
        HttpTokenExchangeClient client = newClient(ClientAuthentication.none());
        for (int i = 0; i < 3; i++) {
            client.exchangeToken(TokenExchangeRequest.builder().subjectToken("t").build()).join();
        }
        assertEquals(1, metadataRequests.get());
        assertNull(lastAuthorization.get());
        assertEquals(issuer + "/token", client.discoverServerMetadata().join().getTokenEndpoint());
    }

    @Test
    public void testServerErrorBecomesTokenExchangeException() {
        tokenResponseStatus.set(400);
        tokenResponseBody.set("{\"error\":\"invalid_target\",\"error_description\":\"unknown resource\"}");
        HttpTokenExchangeClient client = newClient(ClientAuthentication.none());
        AssertExtensions.assertFutureThrows("OAuth error should be surfaced.",
                client.exchangeToken(TokenExchangeRequest.builder().subjectToken("t").resource("r").build()),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("invalid_target")
                        && ((TokenExchangeException) ex).getHttpStatus() == 400);
    }

    @Test
    public void testFailedDiscoveryIsRetried() throws IOException {
        HttpServer broken = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        AtomicInteger attempts = new AtomicInteger();
        broken.createContext(OAuthConstants.WELL_KNOWN_METADATA_PATH, exchange -> {
            attempts.incrementAndGet();
            respond(exchange, 503, "unavailable");
        });
        broken.start();
        try {
            HttpTokenExchangeClient client = new HttpTokenExchangeClient("http://127.0.0.1:" + broken.getAddress().getPort(),
                    ClientAuthentication.none(), HttpClient.newHttpClient(), Duration.ofSeconds(10));

            AssertExtensions.assertFutureThrows("Discovery should fail.", client.discoverServerMetadata(),
                    ex -> ex instanceof MetadataDiscoveryException);
            AssertExtensions.assertFutureThrows("Discovery should fail again.", client.discoverServerMetadata(),
                    ex -> ex instanceof MetadataDiscoveryException);
            assertEquals(2, attempts.get());
        } finally {
            broken.stop(0);
        }
    }

    @Test
    public void testParseTokenResponseWithScopeList() throws Exception {
        TokenResponse response = HttpTokenExchangeClient.parseTokenResponse(200,
                "{\"access_token\":\"a\",\"scope\":[\"x\",\"y\"],\"issued_token_type\":\"" + OAuthConstants.TOKEN_TYPE_ACCESS_TOKEN + "\"}");
        assertEquals(Arrays.asList("x", "y"), response.getScope());
        assertEquals(TokenResponse.DEFAULT_TOKEN_TYPE, response.getTokenType());
        assertEquals(OAuthConstants.TOKEN_TYPE_ACCESS_TOKEN, response.getIssuedTokenType());
        assertNull(response.getExpiresIn());
    }

    @Test
    public void testParseTokenResponseFailures() {
        AssertExtensions.assertThrows("Error member in a 200 response.",
                () -> HttpTokenExchangeClient.parseTokenResponse(200, "{\"error\":\"invalid_grant\"}"),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("invalid_grant"));
        AssertExtensions.assertThrows("Missing access token.",
                () -> HttpTokenExchangeClient.parseTokenResponse(200, "{\"token_type\":\"Bearer\"}"),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("invalid_response"));
        String longBody = Strings.repeat("x", 2000);
        AssertExtensions.assertThrows("Non-JSON error body is truncated.",
                () -> HttpTokenExchangeClient.parseTokenResponse(502, longBody),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getHttpStatus() == 502
                        && ((TokenExchangeException) ex).getErrorDescription().length()
                        == HttpTokenExchangeClient.MAX_ERROR_BODY_CHARS);
        AssertExtensions.assertThrows("Non-JSON success body.",
                () -> HttpTokenExchangeClient.parseTokenResponse(200, "<html/>"),
                ex -> ex instanceof TokenExchangeException);
    }

    @Test
    public void testMalformedErrorMember() {
        AssertExtensions.assertThrows("Error object in an HTTP error response.",
                () -> HttpTokenExchangeClient.parseTokenResponse(400, "{\"error\":{\"code\":\"x\"}}"),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("http_error")
                        && ((TokenExchangeException) ex).getHttpStatus() == 400);
        AssertExtensions.assertThrows("Null error in an HTTP error response.",
                () -> HttpTokenExchangeClient.parseTokenResponse(401, "{\"error\":null}"),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("http_error"));
        AssertExtensions.assertThrows("Non-string description is dropped.",
                () -> HttpTokenExchangeClient.parseTokenResponse(400,
                        "{\"error\":\"invalid_request\",\"error_description\":{\"detail\":1}}"),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("invalid_request")
                        && ((TokenExchangeException) ex).getErrorDescription() == null);
        AssertExtensions.assertThrows("Error array in a 200 response.",
                () -> HttpTokenExchangeClient.parseTokenResponse(200, "{\"error\":[\"a\"]}"),
                ex -> ex instanceof TokenExchangeException
                        && ((TokenExchangeException) ex).getErrorCode().equals("invalid_response"));
    }

    @Test
    public void testParseMetadataRequiresIssuer() {
        AssertExtensions.assertThrows("Issuer is required.",
                () -> HttpTokenExchangeClient.parseMetadata(200, "{\"token_endpoint\":\"https://as/token\"}", "u"),
                ex -> ex instanceof MetadataDiscoveryException);
        AssertExtensions.assertThrows("HTTP errors are rejected.",
                () -> HttpTokenExchangeClient.parseMetadata(404, "not found", "u"),
                ex -> ex instanceof MetadataDiscoveryException && ex.getMessage().contains("404"));
    }

    @Test
    public void testEncodeForm() {
        String encoded = HttpTokenExchangeClient.encodeForm(ImmutableMap.of("a", "b c", "resource", "https://x/y?z=1"));
        assertEquals("a=b+c&resource=https%3A%2F%2Fx%2Fy%3Fz%3D1", encoded);
    }

    @Test
    public void testBasicAuthorizationHeaderEncodesCredentials() {
        String header = ClientAuthentication.basic("id:1", "p w").toAuthorizationHeader();
        assertTrue(header.startsWith("Basic "));
        String decoded = new String(Base64.getDecoder().decode(header.substring(6)), StandardCharsets.UTF_8);
        assertEquals("id%3A1:p+w", decoded);
        assertNull(ClientAuthentication.none().toAuthorizationHeader());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> form = new HashMap<>();
        for (String pair : body.split("&")) {
            String[] kv = pair.split("=", 2);
            form.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8),
                    kv.length > 1 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "");
        }
        return form;
    }
}
