package io.apipipeline.server.core.decorate;

import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.ResponseBody;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;
import io.apipipeline.server.core.TestRequests;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CorsPolicyTest {

    private static ServerRequest from(String origin) {
        return TestRequests.request(HttpMethod.OPTIONS, "/items", TestRequests.headers("Origin", origin), null);
    }

    @Test
    void defaultPreflight() {
        ServerResponse response = CorsPolicy.preflight(from("https://app.example"), CorsOptions.defaults());

        assertThat(response.status()).isEqualTo(204);
        assertThat(response.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(response.firstHeader(CorsPolicy.ALLOW_ORIGIN)).contains("*");
        assertThat(response.firstHeader(CorsPolicy.ALLOW_METHODS)).contains("GET,POST,PUT,DELETE,OPTIONS");
        assertThat(response.firstHeader(CorsPolicy.ALLOW_HEADERS)).contains("Content-Type, Authorization");
        assertThat(response.firstHeader(CorsPolicy.ALLOW_CREDENTIALS)).isEmpty();
        assertThat(response.firstHeader("Vary")).isEmpty();
    }

    @Test
    void credentialsEchoOrigin() {
        CorsOptions options = CorsOptions.builder().credentials(true).maxAge(Duration.ofMinutes(10)).build();

        ServerResponse response = CorsPolicy.preflight(from("https://app.example"), options);

        assertThat(response.firstHeader(CorsPolicy.ALLOW_ORIGIN)).contains("https://app.example");
        assertThat(response.firstHeader(CorsPolicy.ALLOW_CREDENTIALS)).contains("true");
        assertThat(response.firstHeader(CorsPolicy.MAX_AGE)).contains("600");
        assertThat(response.firstHeader("Vary")).contains("Origin");
    }

    @Test
    void explicitListOnlyDecoratesListedOrigins() {
        CorsOptions options = CorsOptions.builder()
                .origins("https://a.example", "https://b.example")
                .exposedHeaders("X-Request-ID")
                .build();

        ServerResponse allowed = new ServerResponse(200, new ResponseBody.Empty());
        ServerResponse denied = new ServerResponse(200, new ResponseBody.Empty());

        assertThat(CorsPolicy.apply(from("https://b.example"), allowed, options)).isTrue();
        assertThat(CorsPolicy.apply(from("https://evil.example"), denied, options)).isFalse();

        assertThat(allowed.firstHeader(CorsPolicy.ALLOW_ORIGIN)).contains("https://b.example");
        assertThat(allowed.firstHeader(CorsPolicy.EXPOSE_HEADERS)).contains("X-Request-ID");
        assertThat(denied.headers()).isEmpty();
    }

    @Test
    void missingOriginWithExplicitListIsNotDecorated() {
        CorsOptions options = CorsOptions.builder().origins("https://a.example").build();

        ServerResponse response = CorsPolicy.preflight(TestRequests.get("/items"), options);

        assertThat(response.firstHeader(CorsPolicy.ALLOW_ORIGIN)).isEmpty();
    }
}
