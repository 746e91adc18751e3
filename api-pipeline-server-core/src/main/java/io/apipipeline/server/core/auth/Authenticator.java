package io.apipipeline.server.core.auth;

import io.apipipeline.core.ApiException;
import io.apipipeline.core.Headers;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.spi.AdapterRegistry;
import io.apipipeline.server.spi.ApiUser;
import io.apipipeline.server.spi.AuthProvider;
import io.apipipeline.server.spi.TokenPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Authentication stage and token issuance front for the registered {@link AuthProvider}s.
 */
public final class Authenticator {

    private static final Logger log = LoggerFactory.getLogger(Authenticator.class);

    public static final String AUTH_COOKIE = "auth_token";
    public static final String REFRESH_COOKIE = "refresh_token";

    private static final String BEARER = "Bearer ";

    private final AdapterRegistry<AuthProvider> providers;

    public Authenticator(AdapterRegistry<AuthProvider> providers) {
        this.providers = Objects.requireNonNull(providers, "providers");
    }

    /**
     * Bearer token from the {@code Authorization} header, else the {@code auth_token} cookie.
     */
    public static Optional<String> extractToken(ServerRequest request) {
        Optional<String> header = request.firstHeader(Headers.AUTHORIZATION);
        if (header.isPresent() && header.get().startsWith(BEARER)) {
            String token = header.get().substring(BEARER.length()).trim();
            if (!token.isEmpty()) return Optional.of(token);
        }
        return request.cookie(AUTH_COOKIE).filter(t -> !t.isEmpty());
    }

    /**
     * Refresh token from the {@code X-Refresh-Token} header, else the {@code refresh_token} cookie.
     */
    public static Optional<String> extractRefreshToken(ServerRequest request) {
        Optional<String> header = request.firstHeader(Headers.X_REFRESH_TOKEN).filter(t -> !t.isBlank());
        if (header.isPresent()) return header;
        return request.cookie(REFRESH_COOKIE).filter(t -> !t.isEmpty());
    }

    /**
     * Verifies the request's token, enforces roles and permissions and attaches the user.
     *
     * <p>In optional mode a missing or rejected token yields an empty result; access rule
     * failures and provider misconfiguration still propagate.
     *
     * @throws ApiException.AuthenticationRequired when required and the token is missing or rejected
     * @throws ApiException.Forbidden when roles or permissions are insufficient
     */
    public Optional<ApiUser> authenticate(ServerRequest request, AuthOptions options) {
        AuthProvider provider = providers.resolve(options.provider());

        Optional<String> token = extractToken(request);
        if (token.isEmpty()) {
            if (options.isRequired()) throw new ApiException.AuthenticationRequired();
            return Optional.empty();
        }

        ApiUser user;
        try {
            user = verify(provider, token.get());
        } catch (ApiException.AuthenticationRequired e) {
            if (options.isRequired()) throw e;
            log.debug("Ignoring rejected token on optional auth: {}", e.getMessage());
            return Optional.empty();
        }

        AccessRules.enforce(user, options);
        if (request.user().isEmpty()) request.attachUser(user);
        return Optional.of(user);
    }

    public TokenPair generateToken(ApiUser user, String providerName) {
        Objects.requireNonNull(user, "user");
        return providers.resolve(providerName).generateToken(user);
    }

    public TokenPair refreshToken(String refreshToken, String providerName) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new ApiException.AuthenticationRequired("Refresh token required");
        }
        return providers.resolve(providerName).refreshToken(refreshToken);
    }

    private static ApiUser verify(AuthProvider provider, String token) {
        try {
            ApiUser user = provider.verifyToken(token);
            if (user == null) throw new ApiException.AuthenticationRequired("Authentication failed");
            return user;
        } catch (ApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ApiException.AuthenticationRequired("Authentication failed", e);
        }
    }
}
