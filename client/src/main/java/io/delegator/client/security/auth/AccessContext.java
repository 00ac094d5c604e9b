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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.delegator.auth.ResourceAccessException;
import io.delegator.client.oauth.TokenResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * The outcome of exchanging the caller's token for a set of resources: a token or an error per resource, plus an
 * optional global error that makes every resource inaccessible.
 * <p>
 * A resource never holds both a token and an error. Recording one removes the other.
 */
@ThreadSafe
public class AccessContext {

    private final Object lock = new Object();
    @GuardedBy("lock")
    private final Map<String, TokenResponse> accessTokens = new LinkedHashMap<>();
    @GuardedBy("lock")
    private final Map<String, ResourceError> resourceErrors = new LinkedHashMap<>();
    @GuardedBy("lock")
    private ResourceError error;

    public AccessContext() {
    }

    public AccessContext(Map<String, TokenResponse> accessTokens) {
        setBulkTokens(accessTokens);
    }

    public void setToken(String resource, TokenResponse token) {
        Preconditions.checkNotNull(resource, "resource");
        Preconditions.checkNotNull(token, "token");
        synchronized (lock) {
            accessTokens.put(resource, token);
            resourceErrors.remove(resource);
        }
    }

    public void setBulkTokens(Map<String, TokenResponse> tokens) {
        Preconditions.checkNotNull(tokens, "tokens");
        synchronized (lock) {
            tokens.forEach((resource, token) -> {
                accessTokens.put(resource, token);
                resourceErrors.remove(resource);
            });
        }
    }

    public void setResourceError(String resource, ResourceError resourceError) {
        Preconditions.checkNotNull(resource, "resource");
        Preconditions.checkNotNull(resourceError, "resourceError");
        synchronized (lock) {
            resourceErrors.put(resource, resourceError);
            accessTokens.remove(resource);
        }
    }

    /**
     * Sets the global error, which takes precedence over every resource's state.
     */
    public void setError(ResourceError globalError) {
        Preconditions.checkNotNull(globalError, "globalError");
        synchronized (lock) {
            this.error = globalError;
        }
    }

    public boolean hasResourceError(String resource) {
        synchronized (lock) {
            return resourceErrors.containsKey(resource);
        }
    }

    /**
     * @return true iff a global error is set.
     */
    public boolean hasError() {
        synchronized (lock) {
            return error != null;
        }
    }

    /**
     * @return true iff a global error or at least one resource error is set.
     */
    public boolean hasErrors() {
        synchronized (lock) {
            return error != null || !resourceErrors.isEmpty();
        }
    }

    public ResourceError getError() {
        synchronized (lock) {
            return error;
        }
    }

    public ResourceError getResourceError(String resource) {
        synchronized (lock) {
            return resourceErrors.get(resource);
        }
    }

    /**
     * @return a snapshot of all resource errors, in the order they were recorded.
     */
    public Map<String, ResourceError> getResourceErrors() {
        synchronized (lock) {
            return ImmutableMap.copyOf(resourceErrors);
        }
    }

    public AccessStatus getStatus() {
        synchronized (lock) {
            if (error != null) {
                return AccessStatus.ERROR;
            }
            return resourceErrors.isEmpty() ? AccessStatus.SUCCESS : AccessStatus.PARTIAL_ERROR;
        }
    }

    public List<String> getSuccessfulResources() {
        synchronized (lock) {
            return ImmutableList.copyOf(accessTokens.keySet());
        }
    }

    public List<String> getFailedResources() {
        synchronized (lock) {
            return ImmutableList.copyOf(resourceErrors.keySet());
        }
    }

    /**
     * Returns the token obtained for the resource.
     *
     * @param resource the resource
     * @return its token
     * @throws ResourceAccessException if a global error is set, the resource failed, or it was never granted
     */
    public TokenResponse access(String resource) {
        synchronized (lock) {
            if (error != null) {
                throw new ResourceAccessException(resource, "Access to " + resource + " is unavailable: "
                        + error.getMessage(), error.getCause());
            }
            ResourceError resourceError = resourceErrors.get(resource);
            if (resourceError != null) {
                throw new ResourceAccessException(resource, resourceError.getMessage(), resourceError.getCause());
            }
            TokenResponse token = accessTokens.get(resource);
            if (token == null) {
                throw new ResourceAccessException(resource, "Resource " + resource + " was not granted.");
            }
            return token;
        }
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "AccessContext(status=" + getStatus() + ", successful=" + accessTokens.keySet()
                    + ", failed=" + resourceErrors.keySet() + ")";
        }
    }
}
