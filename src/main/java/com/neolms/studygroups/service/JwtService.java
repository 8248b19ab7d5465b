package com.neolms.studygroups.service;

import com.neolms.studygroups.model.Viewer;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Validates the bearer tokens issued by the LMS login service.
 *
 * The subject is the user id; the optional "name" and "picture" claims carry the
 * display name and avatar shown on member lists.
 */
@Service
public class JwtService {

    static final String NAME_CLAIM = "name";
    static final String PICTURE_CLAIM = "picture";

    /**
     * HMAC secret shared with the login service. The default only exists so local runs and
     * tests can start; deployed environments override it.
     */
    @Value("${jwt.secret:default_secret_for_local_development_only_12345}")
    private String secretKey;

    @Value("${jwt.expiration-ms:1800000}")
    private long expirationMs;

    private SecretKey key;

    public JwtService() {
    }

    JwtService(String secretKey, long expirationMs) {
        this.secretKey = secretKey;
        this.expirationMs = expirationMs;
        init();
    }

    @PostConstruct
    public void init() {
        if (secretKey.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was " + secretKey.length() + ")");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Issue a token for a viewer. Used by local tooling and tests; production tokens come
     * from the login service.
     */
    public String generateToken(Viewer viewer) {
        var builder = Jwts.builder()
                .subject(viewer.getUserId())
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + expirationMs));
        if (viewer.getAvatarUrl() != null) {
            builder.claim(PICTURE_CLAIM, viewer.getAvatarUrl());
        }
        return builder
                .claim(NAME_CLAIM, viewer.getDisplayName())
                .signWith(key)
                .compact();
    }

    public String extractUserId(String token) {
        return extractClaims(token).getSubject();
    }

    public Viewer extractViewer(String token) {
        Claims claims = extractClaims(token);
        return new Viewer(claims.getSubject(),
                claims.get(NAME_CLAIM, String.class),
                claims.get(PICTURE_CLAIM, String.class));
    }

    public boolean isTokenValid(String token) {
        try {
            Claims claims = extractClaims(token);
            return claims.getSubject() != null && !claims.getExpiration().before(new Date());
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims extractClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
