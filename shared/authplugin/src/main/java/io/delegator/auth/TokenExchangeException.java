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
 * The authorization server rejected a token request, or answered with something that is not a token response.
 */
public class TokenExchangeException extends AuthException {
    private static final long serialVersionUID = 1L;

    public static final int NO_HTTP_STATUS = -1;

    private final int httpStatus;
    private final String errorDescription;

    public TokenExchangeException(String errorCode, String errorDescription, int httpStatus) {
        super(describe(errorCode, errorDescription, httpStatus), errorCode);
        this.httpStatus = httpStatus;
        this.errorDescription = errorDescription;
    }

    public TokenExchangeException(String errorCode, String errorDescription, Throwable cause) {
        super(describe(errorCode, errorDescription, NO_HTTP_STATUS), errorCode, cause);
        this.httpStatus = NO_HTTP_STATUS;
        this.errorDescription = errorDescription;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getErrorDescription() {
        return errorDescription;
    }

    private static String describe(String errorCode, String errorDescription, int httpStatus) {
        StringBuilder sb = new StringBuilder(errorCode);
        if (httpStatus != NO_HTTP_STATUS) {
            sb.append(" (HTTP ").append(httpStatus).append(')');
        }
        if (errorDescription != null && !errorDescription.isEmpty()) {
            sb.append(": ").append(errorDescription);
        }
        return sb.toString();
    }
}
