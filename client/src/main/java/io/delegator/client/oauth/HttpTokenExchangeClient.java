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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.delegator.auth.MetadataDiscoveryException;
import io.delegator.auth.TokenExchangeException;
import io.delegator.common.Exceptions;
import io.delegator.common.LoggerHelpers;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link TokenExchangeClient} speaking RFC 8414 discovery and RFC 8693 exchange over {@link HttpClient}.
 * <p>
 * Metadata is discovered on first use and memoized. A failed discovery is not memoized: the next call tries again.
 */
@Slf4j
public class HttpTokenExchangeClient implements TokenExchangeClient {

    @VisibleForTesting
    static final int MAX_ERROR_BODY_CHARS = 512;

    private static final Gson GSON = new Gson();

    @Getter
    private final String issuer;
    private final ClientAuthentication authentication;
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    @VisibleForTesting
    @Getter(AccessLevel.PACKAGE)
    private final AtomicReference<CompletableFuture<AuthorizationServerMetadata>> metadataFuture = new AtomicReference<>();

    public HttpTokenExchangeClient(String issuer, ClientAuthentication authentication, HttpClient httpClient,
                                   Duration requestTimeout) {
        this.issuer = stripTrailingSlash(Exceptions.checkNotNullOrEmpty(issuer, "issuer"));
        this.authentication = Preconditions.checkNotNull(authentication, "authentication");
        this.httpClient = Preconditions.checkNotNull(httpClient, "httpClient");
        this.requestTimeout = Preconditions.checkNotNull(requestTimeout, "requestTimeout");
    }

    @Override
    public CompletableFuture<AuthorizationServerMetadata> discoverServerMetadata() {
        while (true) {
            CompletableFuture<AuthorizationServerMetadata> current = metadataFuture.get();
            if (current != null && !current.isCompletedExceptionally()) {
                return current;
            }
            CompletableFuture<AuthorizationServerMetadata> attempt = new CompletableFuture<>();
            if (metadataFuture.compareAndSet(current, attempt)) {
                fetchMetadata().whenComplete((metadata, ex) -> {
                    if (ex != null) {
                        attempt.completeExceptionally(Exceptions.unwrap(ex));
                    } else {
                        attempt.complete(metadata);
                    }
                });
                return attempt;
            }
        }
    }

    private CompletableFuture<AuthorizationServerMetadata> fetchMetadata() {
        String url = issuer + OAuthConstants.WELL_KNOWN_METADATA_PATH;
        long traceId = LoggerHelpers.traceEnterWithContext(log, issuer, "discoverServerMetadata", url);
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        throw Exceptions.asCompletionException(new MetadataDiscoveryException(
                                "Unable to reach " + url + ": " + Exceptions.unwrap(ex), Exceptions.unwrap(ex)));
                    }
                    try {
                        AuthorizationServerMetadata metadata = parseMetadata(response.statusCode(), response.body(), url);
                        LoggerHelpers.traceLeave(log, issuer, "discoverServerMetadata", traceId, metadata.getTokenEndpoint());
                        return metadata;
                    } catch (MetadataDiscoveryException e) {
                        log.warn("Metadata discovery for {} failed: {}", issuer, e.getMessage());
                        throw Exceptions.asCompletionException(e);
                    }
                });
    }

    @Override
    public CompletableFuture<TokenResponse> exchangeToken(TokenExchangeRequest request) {
        Preconditions.checkNotNull(request, "request");
        return discoverServerMetadata().thenCompose(metadata -> {
            if (metadata.getTokenEndpoint() == null || metadata.getTokenEndpoint().isEmpty()) {
                return CompletableFuture.failedFuture(new MetadataDiscoveryException(
                        "Authorization server " + issuer + " does not advertise a token_endpoint."));
            }
            return postExchange(metadata.getTokenEndpoint(), request);
        });
    }

    private CompletableFuture<TokenResponse> postExchange(String tokenEndpoint, TokenExchangeRequest request) {
        long traceId = LoggerHelpers.traceEnterWithContext(log, issuer, "exchangeToken", request);
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(tokenEndpoint))
                .timeout(requestTimeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(request.toFormParameters())));
        if (!authentication.isNone()) {
            builder.header("Authorization", authentication.toAuthorizationHeader());
        }
        return httpClient.sendAsync(builder.build(), HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        throw Exceptions.asCompletionException(new TokenExchangeException("request_failed",
                                "Token endpoint " + tokenEndpoint + " unreachable: " + Exceptions.unwrap(ex),
                                Exceptions.unwrap(ex)));
                    }
                    try {
                        TokenResponse tokenResponse = parseTokenResponse(response.statusCode(), response.body());
                        LoggerHelpers.traceLeave(log, issuer, "exchangeToken", traceId, tokenResponse);
                        return tokenResponse;
                    } catch (TokenExchangeException e) {
                        log.warn("Token exchange for resource {} at {} failed: {}", request.getResource(), issuer,
                                e.getMessage());
                        throw Exceptions.asCompletionException(e);
                    }
                });
    }

    @VisibleForTesting
    static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    @VisibleForTesting
    static TokenResponse parseTokenResponse(int statusCode, String body) throws TokenExchangeException {
        JsonObject json = parseObject(body);
        if (statusCode >= 400) {
            String error = json == null ? null : primitiveString(json.get("error"));
            if (error != null) {
                throw new TokenExchangeException(error, primitiveString(json.get("error_description")), statusCode);
            }
            throw new TokenExchangeException("http_error", truncate(body), statusCode);
        }
        if (json == null) {
            throw new TokenExchangeException("invalid_response", "Token response is not a JSON object: " + truncate(body),
                    statusCode);
        }
        return TokenResponse.fromJson(json);
    }

    private static String primitiveString(JsonElement element) {
        return element != null && element.isJsonPrimitive() ? element.getAsString() : null;
    }

    @VisibleForTesting
    static AuthorizationServerMetadata parseMetadata(int statusCode, String body, String url) throws MetadataDiscoveryException {
        if (statusCode >= 400) {
            throw new MetadataDiscoveryException("Metadata request to " + url + " returned HTTP " + statusCode + ": "
                    + truncate(body));
        }
        AuthorizationServerMetadata metadata;
        try {
            metadata = GSON.fromJson(body, AuthorizationServerMetadata.class);
        } catch (JsonParseException e) {
            throw new MetadataDiscoveryException("Metadata at " + url + " is not valid JSON.", e);
        }
        if (metadata == null || metadata.getIssuer() == null || metadata.getIssuer().isEmpty()) {
            throw new MetadataDiscoveryException("Metadata at " + url + " has no issuer.");
        }
        return metadata;
    }

    private static JsonObject parseObject(String body) {
        if (body == null || body.trim().isEmpty()) {
            return null;
        }
        try {
            JsonElement element = JsonParser.parseString(body);
            return element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            return null;
        }
    }

    private static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
