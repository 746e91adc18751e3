package io.apipipeline.server.core.auth;

import io.apipipeline.core.ApiException;
import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.TestRequests;
import io.apipipeline.server.spi.AdapterRegistry;
import io.apipipeline.server.spi.ApiUser;
import io.apipipeline.server.spi.AuthProvider;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuthenticatorTest {

    private static final ApiUser ALICE = new ApiUser("alice", Set.of("admin"), Set.of("users:read"));
    private static final ApiUser BOB = new ApiUser("bob", Set.of("viewer"), Set.of());

    private final FakeAuthProvider provider = new FakeAuthProvider().with("t-alice", ALICE).with("t-bob", BOB);
    private final Authenticator authenticator =
            new Authenticator(AdapterRegistry.<AuthProvider>of("Authentication provider", "fake", provider));

    private static ServerRequest withHeader(String name, String value) {
        return TestRequests.request(HttpMethod.GET, "/me", TestRequests.headers(name, value), null);
    }

    @Test
    void extractsBearerTokenBeforeCookie() {
        ServerRequest request = TestRequests.request(HttpMethod.GET, "/",
                TestRequests.headers("Authorization", "Bearer abc", "Cookie", "auth_token=xyz"), null);

        assertThat(Authenticator.extractToken(request)).contains("abc");
    }

    @Test
    void fallsBackToAuthCookie() {
        assertThat(Authenticator.extractToken(withHeader("Cookie", "theme=dark; auth_token=xyz"))).contains("xyz");
        assertThat(Authenticator.extractToken(withHeader("Authorization", "Basic dXNlcg=="))).isEmpty();
    }

    @Test
    void extractsRefreshTokenFromHeaderOrCookie() {
        assertThat(Authenticator.extractRefreshToken(withHeader("X-Refresh-Token", "r1"))).contains("r1");
        assertThat(Authenticator.extractRefreshToken(withHeader("Cookie", "refresh_token=r2"))).contains("r2");
        assertThat(Authenticator.extractRefreshToken(TestRequests.get("/"))).isEmpty();
    }

    @Test
    void requiredWithoutTokenIsUnauthorized() {
        assertThatThrownBy(() -> authenticator.authenticate(TestRequests.get("/me"), AuthOptions.required().build()))
                .isInstanceOfSatisfying(ApiException.AuthenticationRequired.class, e -> {
                    assertThat(e.status()).isEqualTo(401);
                    assertThat(e.getMessage()).isEqualTo("Authentication required");
                });
    }

    @Test
    void validTokenAttachesUser() {
        ServerRequest request = withHeader("Authorization", "Bearer t-alice");

        Optional<ApiUser> user = authenticator.authenticate(request, AuthOptions.required().build());

        assertThat(user).contains(ALICE);
        assertThat(request.user()).contains(ALICE);
    }

    @Test
    void providerErrorsPropagateWhenRequired() {
        assertThatThrownBy(() -> authenticator.authenticate(withHeader("Authorization", "Bearer expired"),
                AuthOptions.required().build()))
                .isInstanceOf(ApiException.TokenExpired.class)
                .hasMessage("Token expired");
    }

    @Test
    void unexpectedProviderFailureBecomesAuthenticationFailed() {
        assertThatThrownBy(() -> authenticator.authenticate(withHeader("Authorization", "Bearer boom"),
                AuthOptions.required().build()))
                .isInstanceOfSatisfying(ApiException.AuthenticationRequired.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Authentication failed");
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });
    }

    @Test
    void optionalModeLeavesRequestAnonymous() {
        AuthOptions optional = AuthOptions.optional().build();
        ServerRequest missing = TestRequests.get("/me");
        ServerRequest invalid = withHeader("Authorization", "Bearer nope");

        assertThat(authenticator.authenticate(missing, optional)).isEmpty();
        assertThat(authenticator.authenticate(invalid, optional)).isEmpty();
        assertThat(invalid.user()).isEmpty();
        assertThat(authenticator.authenticate(withHeader("Authorization", "Bearer t-bob"), optional)).contains(BOB);
    }

    @Test
    void insufficientRolesAreForbiddenEvenWhenOptional() {
        AuthOptions options = AuthOptions.optional().roles("admin").build();

        assertThatThrownBy(() -> authenticator.authenticate(withHeader("Authorization", "Bearer t-bob"), options))
                .isInstanceOfSatisfying(ApiException.Forbidden.class, e -> {
                    assertThat(e.status()).isEqualTo(403);
                    assertThat(e.getMessage()).isEqualTo("Insufficient permissions");
                });
    }

    @Test
    void unknownProviderIsMisconfiguration() {
        AuthOptions options = AuthOptions.required().provider("oauth").build();

        assertThatThrownBy(() -> authenticator.authenticate(withHeader("Authorization", "Bearer t-alice"), options))
                .isInstanceOf(ApiException.AdapterMisconfigured.class)
                .hasMessage("Authentication provider 'oauth' not registered");
    }

    @Test
    void refreshNotSupportedByDefault() {
        assertThatThrownBy(() -> authenticator.refreshToken("r1", null))
                .isInstanceOfSatisfying(ApiException.BadRequest.class, e -> {
                    assertThat(e.status()).isEqualTo(400);
                    assertThat(e.getMessage()).isEqualTo("Token refresh not supported by this provider");
                });
        assertThatThrownBy(() -> authenticator.refreshToken(" ", null))
                .isInstanceOf(ApiException.AuthenticationRequired.class)
                .hasMessage("Refresh token required");
    }

    @Test
    void generatesTokenThroughDefaultProvider() {
        assertThat(authenticator.generateToken(ALICE, null).token()).isEqualTo("token-alice");
    }
}
