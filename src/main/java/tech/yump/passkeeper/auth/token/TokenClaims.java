package tech.yump.passkeeper.auth.token;

import java.time.Instant;

/**
 * Verified identity carried by an access token.
 *
 * @param subject   the owner id
 * @param role      the role used for access decisions
 * @param issuedAt  issuance time
 * @param expiresAt time after which the token is rejected
 */
public record TokenClaims(
        String subject,
        String role,
        Instant issuedAt,
        Instant expiresAt
) {
}
