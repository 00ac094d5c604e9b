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
package io.delegator.auth;

/**
 * Authorization server metadata could not be fetched or was unusable.
 */
public class MetadataDiscoveryException extends AuthException {
    private static final long serialVersionUID = 1L;

    public MetadataDiscoveryException(String message) {
        super(message, "metadata_discovery_failed");
    }

    public MetadataDiscoveryException(String message, Throwable cause) {
        super(message, "metadata_discovery_failed", cause);
    }
}
