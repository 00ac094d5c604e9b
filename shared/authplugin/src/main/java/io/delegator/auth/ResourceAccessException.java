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
 * Thrown by a handler that asks for the token of a resource whose exchange did not succeed.
 */
public class ResourceAccessException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String resource;

    public ResourceAccessException(String resource, String message) {
        super(message);
        this.resource = resource;
    }

    public ResourceAccessException(String resource, String message, Throwable cause) {
        super(message, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
