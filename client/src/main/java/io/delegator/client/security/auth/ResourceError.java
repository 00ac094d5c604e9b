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
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A failure recorded as data rather than thrown: either for one resource, or for the whole access.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ResourceError {
    private final String message;
    private final AccessErrorCode code;
    /**
     * The underlying failure, or null when the error was detected without one (e.g. a missing token).
     */
    private final Throwable cause;

    public ResourceError(String message, AccessErrorCode code, Throwable cause) {
        this.message = Preconditions.checkNotNull(message, "message");
        this.code = Preconditions.checkNotNull(code, "code");
        this.cause = cause;
    }

    public ResourceError(String message, AccessErrorCode code) {
        this(message, code, null);
    }

    /**
     * @return the cause's string form, or null if there is no cause.
     */
    public String getRawError() {
        return cause == null ? null : cause.toString();
    }
}
