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
package io.delegator.common.security;

import io.delegator.test.common.JwtBody;
import io.delegator.test.common.JwtTestUtils;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class JwtUtilsTest {

    @Test
    public void testExtractExpirationTimeReturnsNullIfExpInBodyIsNotSet() {
        String token = JwtTestUtils.unsignedToken(JwtBody.builder().subject("1234567890").issuedAtTime(1516239022L).build());
        assertNull(JwtUtils.extractExpirationTime(token));
    }

    @Test
    public void testExtractExpirationTimeReturnsNullIfTokenIsNotInJwtFormat() {
        assertNull(JwtUtils.extractExpirationTime(null));
        assertNull(JwtUtils.extractExpirationTime(" "));
        assertNull(JwtUtils.extractExpirationTime("abc"));
        assertNull(JwtUtils.extractExpirationTime("abc.def"));
        assertNull(JwtUtils.extractExpirationTime("abc.def.ghi.jkl"));
        assertNull(JwtUtils.extractExpirationTime("header.%%%.signature"));
    }

    @Test
    public void testExpirationTimeFromRealToken() {
        // The body decodes to {"sub":"jdoe","aud":"segmentstore","iat":1569324678,"exp":1569324683}
        String token = String.format("%s.%s.%s",
                "eyJhbGciOiJIUzUxMiJ9",
                "eyJzdWIiOiJqZG9lIiwiYXVkIjoic2VnbWVudHN0b3JlIiwiaWF0IjoxNTY5MzI0Njc4LCJleHAiOjE1NjkzMjQ2ODN9",
                "EKvw5oVkIihOvSuKlxiX7q9_OAYz7m64wsFZjJTBkoqg4oidpFtdlsldXHToe30vrPnX45l8QAG4DoShSMdw");
        assertEquals(Long.valueOf(1569324683L), JwtUtils.extractExpirationTime(token));
    }

    @Test
    public void testExpirationTimeMustBeNumeric() {
        String body = Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"exp\":\"soon\"}".getBytes(StandardCharsets.UTF_8));
        assertNull(JwtUtils.extractExpirationTime("h." + body + ".s"));
    }

    @Test
    public void testExtractJwtIdAndClaims() {
        String token = JwtTestUtils.unsignedToken(JwtBody.builder().jwtId("token-1").subject("svc").build());
        assertEquals("token-1", JwtUtils.extractJwtId(token));
        assertEquals("svc", JwtUtils.extractStringClaim(token, "sub"));
        assertNull(JwtUtils.extractStringClaim(token, "aud"));
        assertNull(JwtUtils.extractJwtId(JwtTestUtils.dummyToken()));
    }

    @Test
    public void testParseExpirationTimeHandlesNullBody() {
        assertNull(JwtUtils.parseExpirationTime(null));
    }
}
