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
package io.delegator.client.security.auth;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.delegator.auth.AuthProviderConfigurationException;
import io.delegator.client.oauth.OAuthConstants;
import io.delegator.client.oauth.TokenExchangeClient;
import io.delegator.client.oauth.TokenExchangeClientFactory;
import io.delegator.client.oauth.TokenExchangeRequest;
import io.delegator.client.oauth.TokenResponse;
import io.delegator.client.security.credentials.CredentialSupplier;
import io.delegator.client.security.verifier.HttpJwksFetcher;
import io.delegator.client.security.verifier.JwksFetcher;
import io.delegator.client.security.verifier.TokenVerifier;
import io.delegator.common.Exceptions;
import io.delegator.common.LoggerHelpers;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Exchanges a caller's token for tokens scoped to downstream resources, then runs handler logic with the outcome.
 * <p>
 * Exchange failures never prevent the handler from running: they are recorded in the {@link AccessContext} handed to
 * it, either for a single resource or, when nothing can be exchanged at all, as a global error. Exchange clients are
 * created lazily, once per zone, and shared by all requests of that zone.
 */
@Slf4j
public class AuthProvider {

    static final String AUTHENTICATION_REQUIRED_MESSAGE =
            "No authentication token available. Please ensure you're properly authenticated.";
    static final String MISSING_ZONE_ID_MESSAGE =
            "Zone ID is required for multi-zone configuration but not found in request.";
    static final String SERVER_CONFIGURATION_MESSAGE =
            "Failed to initialize OAuth client. Server configuration issue.";
    static final String INVALID_ZONE_ID_MESSAGE =
            "Zone ID in request is not a valid zone identifier.";

    /**
     * A single DNS label: zone ids become the leftmost label of the zone's issuer host.
     */
    private static final Pattern ZONE_ID_PATTERN = Pattern.compile("[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?");

    private static final String DEFAULT_CLIENT_KEY = "default";

    @Getter
    private final String zoneUrl;
    private final AuthProviderConfig config;
    private final CredentialSupplier credentialSupplier;
    private final TokenExchangeClientFactory exchangeClientFactory;
    private final JwksFetcher jwksFetcher;
    private final ConcurrentHashMap<String, TokenExchangeClient> exchangeClients = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, TokenVerifier> verifiers = new ConcurrentHashMap<>();

    /**
     * @param config the configuration
     * @throws AuthProviderConfigurationException if neither a zone URL nor a zone id with a base URL is configured, or
     *                                            no credential supplier is set
     */
    public AuthProvider(AuthProviderConfig config) {
        Preconditions.checkNotNull(config, "config");
        this.config = config;
        this.zoneUrl = resolveZoneUrl(config);
        if (config.getCredentialSupplier() == null) {
            throw new AuthProviderConfigurationException("A credential supplier is required");
        }
        this.credentialSupplier = config.getCredentialSupplier();
        this.exchangeClientFactory = config.getExchangeClientFactory() != null
                ? config.getExchangeClientFactory() : TokenExchangeClientFactory.http();
        this.jwksFetcher = config.getJwksFetcher() != null ? config.getJwksFetcher() : new HttpJwksFetcher();
        log.info("Delegated access for {} configured against {} (multiZone={}).", config.getServiceName(), zoneUrl,
                config.isMultiZone());
    }

    private static String resolveZoneUrl(AuthProviderConfig config) {
        if (!Exceptions.isNullOrBlank(config.getZoneUrl())) {
            return stripTrailingSlash(config.getZoneUrl().trim());
        }
        if (!Exceptions.isNullOrBlank(config.getZoneId()) && !Exceptions.isNullOrBlank(config.getBaseUrl())) {
            try {
                return createZoneScopedUrl(config.getBaseUrl().trim(), config.getZoneId().trim());
            } catch (IllegalArgumentException e) {
                throw new AuthProviderConfigurationException(e.getMessage(), e);
            }
        }
        throw new AuthProviderConfigurationException("zoneUrl, or zoneId together with baseUrl, is required");
    }

    /**
     * Tells whether the zone id is a single DNS label.
     */
    @VisibleForTesting
    static boolean isValidZoneId(String zoneId) {
        return zoneId != null && ZONE_ID_PATTERN.matcher(zoneId).matches();
    }

    /**
     * Prefixes the host of a URL with a zone id, keeping the scheme and any non-default port.
     *
     * @throws IllegalArgumentException if zoneId is not a single DNS label
     */
    @VisibleForTesting
    static String createZoneScopedUrl(String baseUrl, String zoneId) {
        if (!isValidZoneId(zoneId)) {
            throw new IllegalArgumentException("Invalid zone id: must be a single DNS label");
        }
        URI uri;
        try {
            uri = new URI(baseUrl);
        } catch (URISyntaxException e) {
            throw new AuthProviderConfigurationException("Invalid base URL " + baseUrl, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new AuthProviderConfigurationException("Base URL " + baseUrl + " must be absolute");
        }
        int port = uri.getPort();
        boolean defaultPort = port == -1
                || ("https".equalsIgnoreCase(uri.getScheme()) && port == 443)
                || ("http".equalsIgnoreCase(uri.getScheme()) && port == 80);
        String zoneUrl = uri.getScheme() + "://" + zoneId + "." + uri.getHost() + (defaultPort ? "" : ":" + port);
        String expectedHost = zoneId + "." + uri.getHost();
        if (!expectedHost.equalsIgnoreCase(URI.create(zoneUrl).getHost())) {
            throw new IllegalArgumentException("Zone id " + zoneId + " does not scope host " + uri.getHost());
        }
        return zoneUrl;
    }

    /**
     * Wraps a handler for delegated access to the given resources.
     *
     * @param resources the resources to exchange the caller's token for
     * @param handler   the logic to run afterwards
     * @param <C>       identity type
     * @param <T>       result type
     * @return the wrapped handler; it fails only if the handler itself throws
     */
    public <C extends IdentityContext, T> DelegatedHandler<C, T> grant(List<String> resources, GrantedHandler<C, T> handler) {
        List<String> targets = ImmutableList.copyOf(Exceptions.checkNotNullOrEmpty(resources, "resources"));
        Preconditions.checkNotNull(handler, "handler");
        return (identity, args) -> exchangeFor(identity, targets).thenApply(accessContext -> {
            try {
                return handler.handle(identity, accessContext);
            } catch (Exception e) {
                throw Exceptions.asCompletionException(e);
            }
        });
    }

    public <C extends IdentityContext, T> DelegatedHandler<C, T> grant(String resource, GrantedHandler<C, T> handler) {
        return grant(ImmutableList.of(resource), handler);
    }

    /**
     * Wraps a public method of target for delegated access. The method is validated now, not on first request.
     *
     * @param resources  the resources to exchange the caller's token for
     * @param target     the object declaring the method
     * @param methodName name of a public method with an {@link IdentityContext} and an {@link AccessContext}
     *                   parameter; other parameters are supplied as extra invocation arguments
     * @return the wrapped handler
     * @throws io.delegator.auth.MissingIdentityContextException if the method has no identity parameter
     * @throws io.delegator.auth.MissingAccessContextException   if the method has no access context parameter
     */
    public DelegatedHandler<IdentityContext, Object> grant(List<String> resources, Object target, String methodName) {
        List<String> targets = ImmutableList.copyOf(Exceptions.checkNotNullOrEmpty(resources, "resources"));
        MethodHandlerBinding binding = MethodHandlerBinding.bind(target, methodName);
        log.debug("Bound {} for delegated access to {}.", binding, targets);
        return (identity, args) -> exchangeFor(identity, targets).thenApply(accessContext -> {
            try {
                return binding.invoke(identity, accessContext, args);
            } catch (Exception e) {
                throw Exceptions.asCompletionException(e);
            }
        });
    }

    /**
     * Exchanges the caller's token for each resource. Resources are exchanged concurrently; the outcome of each is
     * recorded in request order.
     *
     * @param identity  the caller
     * @param resources the resources
     * @return a future with the populated access context; it never fails
     */
    public CompletableFuture<AccessContext> exchangeFor(IdentityContext identity, List<String> resources) {
        AccessContext accessContext = new AccessContext();
        String subjectToken = identity == null ? null : identity.getBearerToken();
        if (Exceptions.isNullOrBlank(subjectToken)) {
            accessContext.setError(new ResourceError(AUTHENTICATION_REQUIRED_MESSAGE,
                    AccessErrorCode.AUTHENTICATION_REQUIRED));
            return CompletableFuture.completedFuture(accessContext);
        }

        String zoneId = identity.getZoneId();
        if (config.isMultiZone() && Exceptions.isNullOrBlank(zoneId)) {
            accessContext.setError(new ResourceError(MISSING_ZONE_ID_MESSAGE, AccessErrorCode.MISSING_ZONE_ID));
            return CompletableFuture.completedFuture(accessContext);
        }
        if (config.isMultiZone() && !isValidZoneId(zoneId)) {
            log.warn("Rejected request with a malformed zone id.");
            accessContext.setError(new ResourceError(INVALID_ZONE_ID_MESSAGE, AccessErrorCode.MISSING_ZONE_ID));
            return CompletableFuture.completedFuture(accessContext);
        }

        TokenExchangeClient client;
        try {
            client = getExchangeClient(zoneId);
        } catch (RuntimeException e) {
            log.warn("Unable to create exchange client for zone {}: {}", zoneId, LoggerHelpers.exceptionSummary(log, e));
            accessContext.setError(new ResourceError(SERVER_CONFIGURATION_MESSAGE,
                    AccessErrorCode.SERVER_CONFIGURATION, e));
            return CompletableFuture.completedFuture(accessContext);
        }

        AuthInfo authInfo = AuthInfo.builder()
                .zoneId(zoneId)
                .resourceClientId(resourceClientId())
                .accessToken(subjectToken)
                .resourceServerUrl(config.getResourceServerUrl())
                .build();
        List<CompletableFuture<Outcome>> outcomes = new ArrayList<>(resources.size());
        for (String resource : resources) {
            outcomes.add(exchange(client, subjectToken, resource, authInfo));
        }
        return CompletableFuture.allOf(outcomes.toArray(new CompletableFuture[0])).thenApply(v -> {
            for (CompletableFuture<Outcome> f : outcomes) {
                f.join().applyTo(accessContext);
            }
            log.debug("Delegated access for zone {}: {}.", zoneId, accessContext);
            return accessContext;
        });
    }

    private CompletableFuture<Outcome> exchange(TokenExchangeClient client, String subjectToken, String resource,
                                                AuthInfo authInfo) {
        CompletableFuture<TokenExchangeRequest> request;
        try {
            request = credentialSupplier.prepare(client, subjectToken, resource, authInfo);
        } catch (RuntimeException e) {
            request = CompletableFuture.failedFuture(e);
        }
        return request.thenCompose(client::exchangeToken).handle((token, ex) -> {
            if (ex == null && token != null) {
                return Outcome.success(resource, token);
            }
            Throwable cause = ex == null ? new IllegalStateException("Exchange produced no token") : Exceptions.unwrap(ex);
            log.warn("Token exchange for {} failed: {}", resource, LoggerHelpers.exceptionSummary(log, cause));
            return Outcome.failure(resource, new ResourceError(
                    String.format("Token exchange failed for %s: %s", resource, cause.getMessage()),
                    AccessErrorCode.EXCHANGE_TOKEN_FAILED, cause));
        });
    }

    private String resourceClientId() {
        return config.getResourceClientId() != null ? config.getResourceClientId() : config.getResourceServerUrl();
    }

    /**
     * Issuer URL serving the given zone.
     */
    public String issuerFor(String zoneId) {
        if (config.isMultiZone() && !Exceptions.isNullOrBlank(zoneId)) {
            return createZoneScopedUrl(zoneUrl, zoneId);
        }
        return zoneUrl;
    }

    @VisibleForTesting
    TokenExchangeClient getExchangeClient(String zoneId) {
        boolean zoned = config.isMultiZone() && !Exceptions.isNullOrBlank(zoneId);
        String key = zoned ? "zone:" + zoneId : DEFAULT_CLIENT_KEY;
        String authZone = zoned ? zoneId : config.getZoneId();
        return exchangeClients.computeIfAbsent(key, k -> {
            String issuer = issuerFor(zoneId);
            log.info("Creating exchange client for {} ({}).", k, issuer);
            return exchangeClientFactory.create(issuer, credentialSupplier.clientAuthentication(authZone));
        });
    }

    /**
     * @return the verifier for tokens of this service's own zone.
     */
    public TokenVerifier getTokenVerifier() {
        return getTokenVerifier(null);
    }

    /**
     * Returns the verifier for tokens issued to the given zone, creating it on first use.
     *
     * @param zoneId the zone; ignored outside multi-zone mode
     * @return the verifier
     */
    public TokenVerifier getTokenVerifier(String zoneId) {
        String issuer = issuerFor(zoneId);
        return verifiers.computeIfAbsent(issuer, i -> TokenVerifier.builder()
                .issuer(i)
                .jwksUri(i + OAuthConstants.WELL_KNOWN_JWKS_PATH)
                .requiredScopes(config.getRequiredScopes())
                .audience(config.getAudience())
                .jwksFetcher(jwksFetcher)
                .build());
    }

    /**
     * @return the JWKS document of the keys this service signs client assertions with; empty if it signs none.
     */
    public Map<String, Object> getJwks() {
        return credentialSupplier.getJwks();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static final class Outcome {
        private final String resource;
        private final TokenResponse token;
        private final ResourceError error;

        private Outcome(String resource, TokenResponse token, ResourceError error) {
            this.resource = resource;
            this.token = token;
            this.error = error;
        }

        static Outcome success(String resource, TokenResponse token) {
            return new Outcome(resource, token, null);
        }

        static Outcome failure(String resource, ResourceError error) {
            return new Outcome(resource, null, error);
        }

        void applyTo(AccessContext accessContext) {
            if (error == null) {
                accessContext.setToken(resource, token);
            } else {
                accessContext.setResourceError(resource, error);
            }
        }
    }
}
