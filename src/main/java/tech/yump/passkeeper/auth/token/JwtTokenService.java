package tech.yump.passkeeper.auth.token;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.passkeeper.config.PassKeeperProperties;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * HS256 JWT implementation of {@link TokenService}. Signature comparison is done by jjwt in constant time.
 */
@Slf4j
@Service
public class JwtTokenService implements TokenService {

    static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;
    private final Duration tokenTtl;
    private final Clock clock;

    @Autowired
    public JwtTokenService(PassKeeperProperties properties, Clock clock) {
        this(properties.security().signKey(), properties.security().tokenTtl(), clock);
    }

    JwtTokenService(String signKey, Duration tokenTtl, Clock clock) {
        // Keys.hmacShaKeyFor rejects keys shorter than 256 bits, so misconfiguration fails at startup
        this.signingKey = Keys.hmacShaKeyFor(signKey.getBytes(StandardCharsets.UTF_8));
        this.tokenTtl = tokenTtl;
        this.clock = clock;
        log.info("JwtTokenService initialized. Token TTL: {}", tokenTtl);
    }

    @Override
    public String generate(String subject, String role) {
        if (!StringUtils.hasText(subject) || !StringUtils.hasText(role)) {
            throw new IllegalArgumentException("Token subject and role must not be blank.");
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(tokenTtl);

        String token = Jwts.builder()
                .subject(subject)
                .claim(ROLE_CLAIM, role)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey, Jwts.SIG.HS256)
                .compact();
        log.debug("Issued token for subject '{}' with role '{}', expires at {}", subject, role, expiresAt);
        return token;
    }

    @Override
    public TokenClaims verify(String token) {
        if (!StringUtils.hasText(token)) {
            throw new TokenInvalidException("Token is empty.");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String role = claims.get(ROLE_CLAIM, String.class);
            if (!StringUtils.hasText(subject) || !StringUtils.hasText(role)) {
                log.warn("Token rejected: signature valid but subject or role claim is missing.");
                throw new TokenInvalidException("Token is missing required claims.");
            }
            Date issuedAt = claims.getIssuedAt();
            Date expiration = claims.getExpiration();
            if (expiration == null) {
                log.warn("Token rejected: signature valid but expiration claim is missing.");
                throw new TokenInvalidException("Token is missing required claims.");
            }
            return new TokenClaims(
                    subject,
                    role,
                    issuedAt != null ? issuedAt.toInstant() : null,
                    expiration.toInstant());

        } catch (ExpiredJwtException e) {
            log.debug("Token rejected: expired at {}", e.getClaims().getExpiration());
            throw new TokenExpiredException("Token has expired.", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Token rejected: {}", e.getMessage());
            throw new TokenInvalidException("Token is invalid.", e);
        }
    }
}
