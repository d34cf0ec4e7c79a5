package com.taskline.core.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Issues and verifies the bearer tokens API clients and stream consumers
 * present. The token subject is the user id every task is scoped to.
 */
@Service
public class JwtTokenService {

    private final SecretKey signingKey;
    private final int expirationSeconds;

    public JwtTokenService(
            @Value("${taskline.auth.jwt-secret}") String secret,
            @Value("${taskline.auth.token-expiration-seconds:3600}") int expirationSeconds) {
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.expirationSeconds = expirationSeconds;
    }

    public String generateToken(String userId) {
        Date now = new Date();
        Date expiration = new Date(now.getTime() + expirationSeconds * 1000L);

        return Jwts.builder()
                .subject(userId)
                .issuedAt(now)
                .expiration(expiration)
                .signWith(signingKey)
                .compact();
    }

    public Claims validateToken(String token) {
        return Jwts.parser()
                .verifyWith(signingKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    public int getExpirationSeconds() {
        return expirationSeconds;
    }
}
