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
 * Machine-readable classification of a failure recorded in an {@link AccessContext}.
 */
public enum AccessErrorCode {
    EXCHANGE_TOKEN_FAILED("exchange_token_failed"),
    AUTHENTICATION_REQUIRED("authentication_required"),
    MISSING_ZONE_ID("missing_zone_id"),
    SERVER_CONFIGURATION("server_configuration"),
    UNEXPECTED_ERROR("unexpected_error");

    private final String code;

    AccessErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
