package com.taskline.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.security.SignatureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JwtTokenServiceTest {

    private static final String SECRET = "taskline-test-secret-must-be-at-least-32-bytes-long";
    private static final int EXPIRATION_SECONDS = 600;

    private JwtTokenService service;

    @BeforeEach
    void setUp() {
        service = new JwtTokenService(SECRET, EXPIRATION_SECONDS);
    }

    @Nested
    @DisplayName("generateToken")
    class GenerateTokenTests {

        @Test
        @DisplayName("token subject is the user id")
        void subjectIsUser() {
            Claims claims = service.validateToken(service.generateToken("alice"));

            assertEquals("alice", claims.getSubject());
            assertNotNull(claims.getIssuedAt());
            assertEquals(EXPIRATION_SECONDS * 1000L,
                    claims.getExpiration().getTime() - claims.getIssuedAt().getTime(), 1000L);
        }

        @Test
        @DisplayName("exposes the configured lifetime")
        void expiration() {
            assertEquals(EXPIRATION_SECONDS, service.getExpirationSeconds());
        }
    }

    @Nested
    @DisplayName("validateToken")
    class ValidateTokenTests {

        @Test
        @DisplayName("throws on expired token")
        void throwsOnExpiredToken() {
            JwtTokenService shortLived = new JwtTokenService(SECRET, 0);
            String token = shortLived.generateToken("alice");

            assertThrows(ExpiredJwtException.class, () -> service.validateToken(token));
        }

        @Test
        @DisplayName("throws on a token signed with another secret")
        void throwsOnInvalidSignature() {
            String token = service.generateToken("alice");
            JwtTokenService other = new JwtTokenService("a-completely-different-secret-key-at-least-32-bytes", 600);

            assertThrows(SignatureException.class, () -> other.validateToken(token));
        }

        @Test
        @DisplayName("throws on garbage")
        void throwsOnGarbage() {
            assertThrows(JwtException.class, () -> service.validateToken("not.a.jwt"));
        }
    }
}
