package tech.yump.passkeeper.auth.token;

/**
 * Issues and verifies signed, time-bounded identity tokens.
 */
public interface TokenService {

    /**
     * Issues a token for the subject, valid from now until now + TTL.
     *
     * @param subject the owner id carried by the token
     * @param role    the role carried by the token
     * @return the compact serialized token
     */
    String generate(String subject, String role);

    /**
     * Verifies the token signature and lifetime.
     *
     * @param token the compact serialized token
     * @return the verified claims
     * @throws TokenInvalidException if the token is malformed, forged or lacks required claims
     * @throws TokenExpiredException if the token signature is valid but it has expired
     */
    TokenClaims verify(String token);
}
