package io.apipipeline.server.core;

import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.spi.ApiUser;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerRequestTest {

    @Test
    void userCanBeAttachedOnce() {
        ServerRequest request = TestRequests.get("/me");
        request.attachUser(ApiUser.of("u1"));

        assertThat(request.user()).map(ApiUser::id).contains("u1");
        assertThatThrownBy(() -> request.attachUser(ApiUser.of("u2")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(request.user()).map(ApiUser::id).contains("u1");
    }

    @Test
    void requestIdCanBeAssignedOnce() {
        ServerRequest request = TestRequests.get("/me");
        request.assignRequestId("abc");

        assertThatThrownBy(() -> request.assignRequestId("def")).isInstanceOf(IllegalStateException.class);
        assertThat(request.requestId()).contains("abc");
    }

    @Test
    void missingClientAddressIsUnknown() {
        ServerRequest request = new ServerRequest(HttpMethod.GET, URI.create("http://localhost"), Map.of(), null);

        assertThat(request.clientAddress()).isEqualTo(ServerRequest.UNKNOWN_CLIENT);
        assertThat(request.path()).isEqualTo("/");
    }

    @Test
    void headersAndCookiesAreCaseInsensitiveByName() {
        ServerRequest request = TestRequests.request(HttpMethod.GET, "/x?a=1",
                TestRequests.headers("cookie", "auth_token=t1; theme=dark", "X-Custom", "v"), null);

        assertThat(request.firstHeader("x-custom")).contains("v");
        assertThat(request.cookie("theme")).contains("dark");
        assertThat(request.query()).containsEntry("a", "1");
    }
}
