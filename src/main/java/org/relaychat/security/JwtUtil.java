package org.relaychat.security;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.Key;
import java.util.Base64;
import java.util.Date;

/**
 * Jetons JWT signés HS256. Le sujet est l'identifiant de l'utilisateur.
 * Le secret est fourni par la propriété "jwt.secret" (clé encodée en base64, 32 octets minimum).
 */
@Component
public class JwtUtil {

    private Key key;

    @Value("${jwt.secret:}")
    private String jwtSecretBase64;

    @Value("${jwt.expiration-ms:86400000}")
    private long jwtExpirationMs;

    @PostConstruct
    public void init() {
        if (jwtSecretBase64 == null || jwtSecretBase64.isBlank()) {
            throw new IllegalStateException("jwt.secret must be set (base64).");
        }
        this.key = Keys.hmacShaKeyFor(Base64.getDecoder().decode(jwtSecretBase64));
    }

    public String generateToken(Long userId) {
        Date now = new Date();
        return Jwts.builder()
                .setSubject(String.valueOf(userId))
                .setIssuedAt(now)
                .setExpiration(new Date(now.getTime() + jwtExpirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    public Long extractUserId(String token) {
        String subject = Jwts.parserBuilder().setSigningKey(key).build()
                .parseClaimsJws(token).getBody().getSubject();
        return Long.valueOf(subject);
    }

    public boolean validateToken(String token) {
        try {
            String subject = Jwts.parserBuilder().setSigningKey(key).build()
                    .parseClaimsJws(token).getBody().getSubject();
            Long.parseLong(subject);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }
}
