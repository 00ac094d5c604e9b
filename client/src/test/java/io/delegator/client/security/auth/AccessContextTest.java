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

import com.google.common.collect.ImmutableMap;
import io.delegator.auth.ResourceAccessException;
import io.delegator.client.oauth.TokenResponse;
import io.delegator.test.common.AssertExtensions;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class AccessContextTest {

    private static TokenResponse token(String value) {
        return TokenResponse.builder().accessToken(value).expiresIn(3600L).build();
    }

    private static ResourceError failure(String resource) {
        return new ResourceError("Token exchange failed for " + resource + ": denied",
                AccessErrorCode.EXCHANGE_TOKEN_FAILED, new IOException("denied"));
    }

    @Test
    public void testAccessReturnsStoredToken() {
        AccessContext ctx = new AccessContext();
        TokenResponse a = token("token_A");
        ctx.setToken("A", a);
        assertSame(a, ctx.access("A"));
        assertEquals(AccessStatus.SUCCESS, ctx.getStatus());
        assertEquals("success", ctx.getStatus().getValue());
        assertFalse(ctx.hasErrors());
    }

    @Test
    public void testTokenAndErrorAreMutuallyExclusive() {
        AccessContext ctx = new AccessContext();
        ctx.setToken("A", token("t"));
        ctx.setResourceError("A", failure("A"));
        assertTrue(ctx.hasResourceError("A"));
        assertEquals(Collections.emptyList(), ctx.getSuccessfulResources());
        AssertExtensions.assertThrows("Failed resource must not be accessible.", () -> ctx.access("A"),
                ex -> ex instanceof ResourceAccessException && ((ResourceAccessException) ex).getResource().equals("A"));

        ctx.setToken("A", token("t2"));
        assertFalse(ctx.hasResourceError("A"));
        assertNull(ctx.getResourceError("A"));
        assertEquals("t2", ctx.access("A").getAccessToken());

        ctx.setResourceError("A", failure("A"));
        ctx.setBulkTokens(ImmutableMap.of("A", token("t3")));
        assertFalse(ctx.hasResourceError("A"));
        assertEquals("t3", ctx.access("A").getAccessToken());
    }

    @Test
    public void testPartialError() {
        AccessContext ctx = new AccessContext();
        ctx.setToken("A", token("token_A"));
        ctx.setResourceError("B", failure("B"));
        assertEquals(AccessStatus.PARTIAL_ERROR, ctx.getStatus());
        assertTrue(ctx.hasErrors());
        assertFalse(ctx.hasError());
        assertEquals(Collections.singletonList("A"), ctx.getSuccessfulResources());
        assertEquals(Collections.singletonList("B"), ctx.getFailedResources());
        assertEquals(AccessErrorCode.EXCHANGE_TOKEN_FAILED, ctx.getResourceErrors().get("B").getCode());
        assertEquals("java.io.IOException: denied", ctx.getResourceError("B").getRawError());
    }

    @Test
    public void testGlobalErrorOverridesResourceState() {
        AccessContext ctx = new AccessContext(ImmutableMap.of("A", token("token_A")));
        ctx.setError(new ResourceError("no token", AccessErrorCode.AUTHENTICATION_REQUIRED));
        assertEquals(AccessStatus.ERROR, ctx.getStatus());
        assertTrue(ctx.hasError());
        assertTrue(ctx.hasErrors());
        AssertExtensions.assertThrows("Global error blocks every resource.", () -> ctx.access("A"),
                ex -> ex instanceof ResourceAccessException);
    }

    @Test
    public void testAccessUngrantedResource() {
        AccessContext ctx = new AccessContext();
        AssertExtensions.assertThrows("Ungranted resource.", () -> ctx.access("C"),
                ex -> ex instanceof ResourceAccessException && ex.getMessage().contains("not granted"));
        assertEquals(AccessStatus.SUCCESS, ctx.getStatus());
    }

    @Test
    public void testResourceOrderIsPreserved() {
        AccessContext ctx = new AccessContext();
        ctx.setToken("z", token("1"));
        ctx.setToken("a", token("2"));
        ctx.setToken("m", token("3"));
        assertEquals(Arrays.asList("z", "a", "m"), ctx.getSuccessfulResources());
    }
}
