package io.apipipeline.server.spi;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Issued credentials.
 *
 * @param token access token
 * @param refreshToken refresh token, or {@code null} if the provider issues none
 * @param expiresAt access token expiry
 */
public record TokenPair(String token, String refreshToken, Instant expiresAt) {

    public TokenPair {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public Optional<String> refreshTokenValue() {
        return Optional.ofNullable(refreshToken);
    }
}
