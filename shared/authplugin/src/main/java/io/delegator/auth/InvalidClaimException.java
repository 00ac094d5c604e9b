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
 * The token is well formed and signed, but one of its claims does not satisfy the verifier's policy.
 */
public class InvalidClaimException extends TokenException {
    private static final long serialVersionUID = 1L;

    private final String claim;

    public InvalidClaimException(String claim, String message) {
        super(message);
        this.claim = claim;
    }

    public String getClaim() {
        return claim;
    }
}
