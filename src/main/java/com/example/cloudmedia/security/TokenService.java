package com.example.cloudmedia.security;

import com.example.cloudmedia.config.AuthProperties;
import com.example.cloudmedia.exception.TokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;

@Component
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String EMAIL_CLAIM = "email";

    private final Clock clock;
    private final SecretKey key;
    private final MacAlgorithm algorithm;
    private final Duration validity;

    public TokenService(AuthProperties properties, Clock clock) {
        Assert.hasText(properties.getJwtSecret(), "app.auth.jwt-secret must be set");
        this.clock = clock;
        this.algorithm = resolveAlgorithm(properties.getJwtAlgorithm());
        byte[] secret = properties.getJwtSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length * 8 < algorithm.getKeyBitLength()) {
            throw new IllegalArgumentException("app.auth.jwt-secret is " + secret.length * 8 + " bits, "
                + algorithm.getId() + " needs at least " + algorithm.getKeyBitLength());
        }
        this.key = Keys.hmacShaKeyFor(secret);
        this.validity = Duration.ofMinutes(properties.getJwtExpireMinutes());
    }

    public String issue(TokenClaims claims) {
        Instant now = clock.instant();
        return Jwts.builder()
            .subject(claims.subjectId())
            .claim(EMAIL_CLAIM, claims.email())
            .issuedAt(Date.from(now))
            .expiration(Date.from(now.plus(validity)))
            .signWith(key, algorithm)
            .compact();
    }

    public TokenClaims verify(String token) {
        try {
            Jws<Claims> jws = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token);

            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                log.warn("Rejecting token signed with {}", jws.getHeader().getAlgorithm());
                throw new TokenException(TokenException.Reason.INVALID, "Invalid authentication token");
            }
            Claims claims = jws.getPayload();
            if (!StringUtils.hasText(claims.getSubject())) {
                log.warn("Rejecting token without subject");
                throw new TokenException(TokenException.Reason.INVALID, "Invalid authentication token");
            }
            return new TokenClaims(claims.getSubject(), claims.get(EMAIL_CLAIM, String.class));
        } catch (ExpiredJwtException ex) {
            log.debug("Token expired: {}", ex.getMessage());
            throw new TokenException(TokenException.Reason.EXPIRED, "Token has expired");
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("Token rejected: {}", ex.getMessage());
            throw new TokenException(TokenException.Reason.INVALID, "Invalid authentication token");
        }
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        String id = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        switch (id) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalArgumentException("Unsupported JWT algorithm: " + name);
        }
    }
}
