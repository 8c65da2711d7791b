package com.matcast.server.security;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

/**
 * Issues and verifies HS256 identity tokens.
 *
 * <h3>Features</h3>
 * <ul>
 *   <li><b>Key rotation:</b> tokens signed with {@code matcast.jwt.previous-secret}
 *       are still accepted while it is set.</li>
 *   <li><b>Key ID:</b> each token carries a {@code kid} header naming its key.</li>
 * </ul>
 *
 * Token claims:
 *   sub  = user id
 *   name = display name
 *   role = "referee" for referees; any other value is a viewer-only identity
 *   jti  = unique token id
 *   iat / exp
 */
@Component
public class JwtUtil {

    private static final Logger log = LoggerFactory.getLogger(JwtUtil.class);
    private static final String CURRENT_KID = "current";

    public static final String CLAIM_NAME = "name";
    public static final String CLAIM_ROLE = "role";

    private final SecretKey currentKey;
    private final SecretKey previousKey;  // null if no rotation in progress
    private final long expirationMs;

    public JwtUtil(
            @Value("${matcast.jwt.secret}") String secret,
            @Value("${matcast.jwt.previous-secret:}") String previousSecret,
            @Value("${matcast.jwt.expiration-ms:86400000}") long expirationMs) {
        this.currentKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.previousKey = (previousSecret != null && !previousSecret.isBlank())
                ? Keys.hmacShaKeyFor(previousSecret.getBytes(StandardCharsets.UTF_8))
                : null;
        this.expirationMs = expirationMs;

        if (this.previousKey != null) {
            log.info("[JWT] Key rotation active, accepting tokens signed with current and previous keys");
        }
    }

    // ==================== TOKEN GENERATION ====================

    public String generateToken(String userId, String name, String role) {
        Date now = new Date();
        Date expiry = new Date(now.getTime() + expirationMs);

        return Jwts.builder()
                .header().keyId(CURRENT_KID).and()
                .subject(userId)
                .claim(CLAIM_NAME, name)
                .claim(CLAIM_ROLE, role)
                .id(UUID.randomUUID().toString())
                .issuedAt(now)
                .expiration(expiry)
                .signWith(currentKey, Jwts.SIG.HS256)
                .compact();
    }

    // ==================== TOKEN PARSING ====================

    /**
     * Parse and verify. Tries the current key, then the previous one.
     *
     * @throws JwtException invalid or expired under both keys
     */
    public Claims parseToken(String token) {
        try {
            return Jwts.parser()
                    .verifyWith(currentKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException e) {
            if (previousKey == null) throw e;
        }

        return Jwts.parser()
                .verifyWith(previousKey)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * @throws JwtException invalid token, or no subject
     */
    public HubIdentity toIdentity(String token) {
        Claims claims = parseToken(token);
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new JwtException("Token has no subject");
        }
        return new HubIdentity(subject, claims.get(CLAIM_NAME, String.class), claims.get(CLAIM_ROLE, String.class));
    }
}
