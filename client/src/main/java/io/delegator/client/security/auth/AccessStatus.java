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
 * Overall outcome of a delegated access.
 */
public enum AccessStatus {
    /**
     * No global error and no resource errors.
     */
    SUCCESS("success"),
    /**
     * No global error, at least one resource error.
     */
    PARTIAL_ERROR("partial_error"),
    /**
     * A global error is set; resource state is irrelevant.
     */
    ERROR("error");

    private final String value;

    AccessStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
