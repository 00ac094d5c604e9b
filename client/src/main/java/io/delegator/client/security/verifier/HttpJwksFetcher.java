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

import com.google.common.base.Preconditions;
import com.nimbusds.jose.jwk.JWKSet;
import io.delegator.auth.MetadataDiscoveryException;
import io.delegator.common.Exceptions;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.text.ParseException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches JWKS documents over HTTP.
 */
@Slf4j
public class HttpJwksFetcher implements JwksFetcher {

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpJwksFetcher() {
        this(HttpClient.newHttpClient(), Duration.ofSeconds(10));
    }

    public HttpJwksFetcher(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Preconditions.checkNotNull(httpClient, "httpClient");
        this.requestTimeout = Preconditions.checkNotNull(requestTimeout, "requestTimeout");
    }

    @Override
    public CompletableFuture<JWKSet> fetch(String jwksUri) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(jwksUri))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("Fetching JWKS from {}.", jwksUri);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, ex) -> {
                    if (ex != null) {
                        throw Exceptions.asCompletionException(new MetadataDiscoveryException(
                                "Unable to fetch JWKS from " + jwksUri, Exceptions.unwrap(ex)));
                    }
                    if (response.statusCode() >= 400) {
                        throw Exceptions.asCompletionException(new MetadataDiscoveryException(
                                "JWKS request to " + jwksUri + " returned HTTP " + response.statusCode()));
                    }
                    try {
                        return JWKSet.parse(response.body());
                    } catch (ParseException e) {
                        throw Exceptions.asCompletionException(new MetadataDiscoveryException(
                                "Document at " + jwksUri + " is not a JWKS", e));
                    }
                });
    }
}
