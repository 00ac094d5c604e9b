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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Per-request details a credential supplier may need when preparing an exchange. All fields are optional; each
 * supplier documents which ones it requires.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
public class AuthInfo {

    public static final AuthInfo EMPTY = AuthInfo.builder().build();

    private final String zoneId;

    /**
     * The client id under which this service is registered with the authorization server.
     */
    private final String resourceClientId;

    private final String accessToken;

    private final String resourceServerUrl;

    @Override
    public String toString() {
        return "AuthInfo(zoneId=" + zoneId + ", resourceClientId=" + resourceClientId
                + ", resourceServerUrl=" + resourceServerUrl + ")";
    }
}
