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

/**
 * What the request-serving layer knows about the caller: the bearer token it authenticated with and, in multi-zone
 * deployments, the zone the request targets.
 */
public interface IdentityContext {

    /**
     * @return the caller's raw bearer token, or null if the request carried none.
     */
    String getBearerToken();

    /**
     * @return the zone (tenant) identifier of the request, or null if none was resolved.
     */
    String getZoneId();
}
