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
package io.delegator.client.oauth;

import io.delegator.test.common.AssertExtensions;
import java.util.Arrays;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;

public class TokenExchangeRequestTest {

    @Test
    public void testFormParametersOmitAbsentValuesAndKeepOrder() {
        TokenExchangeRequest request = TokenExchangeRequest.builder()
                .subjectToken("caller-token")
                .resource("https://api.example.com")
                .scope("read write")
                .build();
        Map<String, String> form = request.toFormParameters();
        assertEquals(Arrays.asList("grant_type", "subject_token", "subject_token_type", "resource", "scope"),
                Arrays.asList(form.keySet().toArray()));
        assertEquals(OAuthConstants.GRANT_TYPE_TOKEN_EXCHANGE, form.get("grant_type"));
        assertEquals(OAuthConstants.TOKEN_TYPE_ACCESS_TOKEN, form.get("subject_token_type"));
        assertNull(form.get("client_assertion"));
    }

    @Test
    public void testToBuilderAddsClientAssertion() {
        TokenExchangeRequest base = TokenExchangeRequest.builder().subjectToken("t").resource("r").build();
        TokenExchangeRequest withAssertion = base.toBuilder()
                .clientAssertion("assertion")
                .clientAssertionType(OAuthConstants.CLIENT_ASSERTION_TYPE_JWT_BEARER)
                .build();
        assertEquals("assertion", withAssertion.toFormParameters().get("client_assertion"));
        assertNull(base.getClientAssertion());
    }

    @Test
    public void testValidation() {
        AssertExtensions.assertThrows("Subject token is required.",
                () -> TokenExchangeRequest.builder().resource("r").build(),
                ex -> ex instanceof NullPointerException);
        AssertExtensions.assertThrows("Subject token must not be empty.",
                () -> TokenExchangeRequest.builder().subjectToken("").build(),
                ex -> ex instanceof IllegalArgumentException);
        AssertExtensions.assertThrows("Assertion type is required with an assertion.",
                () -> TokenExchangeRequest.builder().subjectToken("t").clientAssertion("a").build(),
                ex -> ex instanceof IllegalArgumentException);
        AssertExtensions.assertThrows("Actor token type is required with an actor token.",
                () -> TokenExchangeRequest.builder().subjectToken("t").actorToken("a").build(),
                ex -> ex instanceof IllegalArgumentException);
    }

    @Test
    public void testToStringHidesTokens() {
        TokenExchangeRequest request = TokenExchangeRequest.builder()
                .subjectToken("secret-subject")
                .clientAssertion("secret-assertion")
                .clientAssertionType(OAuthConstants.CLIENT_ASSERTION_TYPE_JWT_BEARER)
                .build();
        assertFalse(request.toString().contains("secret"));
    }
}
