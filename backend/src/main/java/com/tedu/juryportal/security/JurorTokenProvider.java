package com.tedu.juryportal.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Encodes {@code (jurorId, secret)} into a compact JWS and back. Tokens carry
 * no expiry and no random id, so the same pair always yields the same token;
 * validity is decided by comparing the embedded secret with the stored one.
 */
@Slf4j
@Component
public class JurorTokenProvider {

    static final String SECRET_CLAIM = "secret";
    static final String TYPE_CLAIM = "type";
    static final String JUROR_TYPE = "JUROR";

    private final SecretKey signingKey;

    public JurorTokenProvider(@Value("${jury.token.signing-key}") String signingKey) {
        this.signingKey = Keys.hmacShaKeyFor(signingKey.getBytes(StandardCharsets.UTF_8));
    }

    public String mint(String jurorId, String secret) {
        return Jwts.builder()
                .setSubject(jurorId)
                .claim(SECRET_CLAIM, secret)
                .claim(TYPE_CLAIM, JUROR_TYPE)
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Decodes a token without consulting the credential store.
     *
     * @return the embedded claims, or empty when the token is malformed,
     *         tampered with, or not a juror token
     */
    public Optional<TokenClaims> decode(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();

            if (!JUROR_TYPE.equals(claims.get(TYPE_CLAIM, String.class))) {
                log.debug("Rejected token with type={}", claims.get(TYPE_CLAIM));
                return Optional.empty();
            }
            String jurorId = claims.getSubject();
            String secret = claims.get(SECRET_CLAIM, String.class);
            if (!StringUtils.hasText(jurorId) || !StringUtils.hasText(secret)) {
                return Optional.empty();
            }
            return Optional.of(new TokenClaims(jurorId, secret));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Invalid juror token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public record TokenClaims(String jurorId, String secret) {
    }
}
