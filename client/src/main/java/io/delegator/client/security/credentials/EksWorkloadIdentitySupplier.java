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
import com.google.common.hash.Hashing;
import io.delegator.auth.WorkloadIdentityConfigurationException;
import io.delegator.auth.WorkloadIdentityRuntimeException;
import io.delegator.client.oauth.OAuthConstants;
import io.delegator.client.oauth.TokenExchangeClient;
import io.delegator.client.oauth.TokenExchangeRequest;
import io.delegator.client.oauth.TokenResponse;
import io.delegator.client.security.auth.AuthInfo;
import io.delegator.client.security.cache.CachedToken;
import io.delegator.client.security.cache.InMemoryTokenCache;
import io.delegator.client.security.cache.TokenCache;
import io.delegator.common.LoggerHelpers;
import io.delegator.common.cache.SingleFlightCache;
import io.delegator.common.security.JwtUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates with the workload identity token that Amazon EKS Pod Identity projects into the container.
 * <p>
 * The platform token is exchanged once per token (keyed by its "jti") for an application credential issued by the
 * authorization server, and that credential is sent as the client assertion of every exchange. The token file is
 * re-read on each call because the platform rotates it.
 */
@Slf4j
public class EksWorkloadIdentitySupplier implements CredentialSupplier {

    public static final String DEFAULT_TOKEN_FILE_ENV_VARIABLE = "AWS_CONTAINER_AUTHORIZATION_TOKEN_FILE";

    private static final String INIT_FAILURE = "Failed to initialize EKS workload identity: ";
    private static final String RUNTIME_FAILURE = "Failed to read EKS workload identity token at runtime: ";

    @Getter
    private final Path tokenFile;
    private final SingleFlightCache<String, CachedToken> credentials;
    private final Supplier<Long> epochSeconds;

    /**
     * Reads the token file named by {@value #DEFAULT_TOKEN_FILE_ENV_VARIABLE}.
     */
    public EksWorkloadIdentitySupplier() {
        this(null, DEFAULT_TOKEN_FILE_ENV_VARIABLE, new InMemoryTokenCache());
    }

    /**
     * @param tokenFile     path of the token file; when null the path is read from envVariableName
     * @param envVariableName environment variable holding the token file path
     * @param tokenCache    cache for application credentials
     * @throws WorkloadIdentityConfigurationException if the token file cannot be located or read, or is empty
     */
    public EksWorkloadIdentitySupplier(Path tokenFile, String envVariableName, TokenCache tokenCache) {
        this(tokenFile, envVariableName, tokenCache, System::getenv, () -> System.currentTimeMillis() / 1000);
    }

    @VisibleForTesting
    EksWorkloadIdentitySupplier(Path tokenFile, String envVariableName, TokenCache tokenCache,
                                Function<String, String> environment, Supplier<Long> epochSeconds) {
        Preconditions.checkNotNull(tokenCache, "tokenCache");
        this.tokenFile = tokenFile != null ? tokenFile : resolveFromEnvironment(envVariableName, environment);
        this.credentials = new SingleFlightCache<>(tokenCache);
        this.epochSeconds = Preconditions.checkNotNull(epochSeconds, "epochSeconds");
        validateTokenFile();
    }

    private static Path resolveFromEnvironment(String envVariableName, Function<String, String> environment) {
        String name = envVariableName == null ? DEFAULT_TOKEN_FILE_ENV_VARIABLE : envVariableName;
        String value = environment.apply(name);
        if (value == null || value.trim().isEmpty()) {
            throw new WorkloadIdentityConfigurationException(INIT_FAILURE + "environment variable " + name
                    + " is not set");
        }
        return Paths.get(value.trim());
    }

    private void validateTokenFile() {
        if (!Files.exists(tokenFile)) {
            throw new WorkloadIdentityConfigurationException(INIT_FAILURE + "Token file not found: " + tokenFile);
        }
        String token;
        try {
            token = readFile();
        } catch (IOException e) {
            throw new WorkloadIdentityConfigurationException(INIT_FAILURE + "Unable to read token file " + tokenFile, e);
        }
        if (token.isEmpty()) {
            throw new WorkloadIdentityConfigurationException(INIT_FAILURE + "Token file is empty: " + tokenFile);
        }
        log.info("Using EKS workload identity token file {}.", tokenFile);
    }

    /**
     * Reads the current platform token.
     *
     * @return the trimmed token
     * @throws WorkloadIdentityRuntimeException if the file vanished, cannot be read, or is empty
     */
    public String readToken() throws WorkloadIdentityRuntimeException {
        String token;
        try {
            token = readFile();
        } catch (NoSuchFileException e) {
            throw new WorkloadIdentityRuntimeException(RUNTIME_FAILURE + "Token file not found: " + tokenFile, e);
        } catch (IOException e) {
            throw new WorkloadIdentityRuntimeException(RUNTIME_FAILURE + "Unable to read token file " + tokenFile, e);
        }
        if (token.isEmpty()) {
            throw new WorkloadIdentityRuntimeException(RUNTIME_FAILURE + "Token file is empty: " + tokenFile);
        }
        return token;
    }

    private String readFile() throws IOException {
        return new String(Files.readAllBytes(tokenFile), StandardCharsets.UTF_8).trim();
    }

    /**
     * Returns the application credential for the current platform token, exchanging it only when no valid credential
     * is cached. Concurrent callers share one exchange.
     *
     * @param client the exchange client of the zone being served
     * @return a future with the application credential
     */
    public CompletableFuture<String> getApplicationCredential(TokenExchangeClient client) {
        final String platformToken;
        try {
            platformToken = readToken();
        } catch (WorkloadIdentityRuntimeException e) {
            log.warn(e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        String cacheKey = cacheKey(client, platformToken);
        return credentials.getOrLoad(cacheKey, key -> federate(client, platformToken))
                .thenApply(CachedToken::getToken);
    }

    @VisibleForTesting
    static String cacheKey(TokenExchangeClient client, String platformToken) {
        String tokenId = JwtUtils.extractJwtId(platformToken);
        if (tokenId == null) {
            tokenId = Hashing.sha256().hashString(platformToken, StandardCharsets.UTF_8).toString();
        }
        return client.getIssuer() + "#" + tokenId;
    }

    private CompletableFuture<CachedToken> federate(TokenExchangeClient client, String platformToken) {
        long traceId = LoggerHelpers.traceEnterWithContext(log, client.getIssuer(), "federate");
        TokenExchangeRequest request = TokenExchangeRequest.builder()
                .subjectToken(platformToken)
                .subjectTokenType(OAuthConstants.TOKEN_TYPE_JWT)
                .build();
        return client.exchangeToken(request).thenApply(response -> {
            CachedToken credential = new CachedToken(response.getAccessToken(), expiryOf(response));
            LoggerHelpers.traceLeave(log, client.getIssuer(), "federate", traceId, credential);
            return credential;
        });
    }

    private long expiryOf(TokenResponse response) {
        Long exp = JwtUtils.extractExpirationTime(response.getAccessToken());
        if (exp != null) {
            return exp;
        }
        long now = epochSeconds.get();
        if (response.getExpiresIn() != null) {
            return now + response.getExpiresIn();
        }
        log.warn("Application credential from workload identity carries no expiry; it will not be reused.");
        return now;
    }

    @Override
    public CompletableFuture<TokenExchangeRequest> prepare(TokenExchangeClient client, String subjectToken,
                                                           String resource, AuthInfo authInfo) {
        return getApplicationCredential(client).thenApply(credential -> CredentialSupplier
                .baseRequest(subjectToken, resource)
                .clientAssertion(credential)
                .clientAssertionType(OAuthConstants.CLIENT_ASSERTION_TYPE_JWT_BEARER)
                .build());
    }
}
