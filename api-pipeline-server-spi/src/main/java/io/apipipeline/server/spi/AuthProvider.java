package io.apipipeline.server.spi;

import io.apipipeline.core.ApiException;

/**
 * Token verification and issuance SPI.
 *
 * <p>Role and permission evaluation is not part of this contract; it runs on the returned
 * {@link ApiUser}.
 */
public interface AuthProvider {

    /**
     * Verify a bearer token and resolve the user it represents.
     *
     * @throws ApiException.InvalidToken if the token is malformed, forged or lacks a subject
     * @throws ApiException.TokenExpired if the token is past its expiry
     */
    ApiUser verifyToken(String token);

    /**
     * Issue a token (and optionally a refresh token) for the user.
     *
     * @throws ApiException.BadRequest if the user has no id
     */
    TokenPair generateToken(ApiUser user);

    /**
     * Exchange a refresh token for a new token pair.
     *
     * @throws ApiException.BadRequest if the provider does not support refresh
     */
    default TokenPair refreshToken(String refreshToken) {
        throw new ApiException.BadRequest("Token refresh not supported by this provider");
    }
}
