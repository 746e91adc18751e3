package io.apipipeline.server.core.ratelimit;

import io.apipipeline.core.ApiException;
import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.MutableClock;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.TestRequests;
import io.apipipeline.server.spi.AdapterRegistry;
import io.apipipeline.server.spi.ApiUser;
import io.apipipeline.server.spi.RateLimitAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final MemoryRateLimitAdapter adapter = new MemoryRateLimitAdapter(MutableClock.atEpochMillis(0), null);
    private final RateLimiter rateLimiter = new RateLimiter(AdapterRegistry.<RateLimitAdapter>of("Rate limit adapter", "memory", adapter));

    @AfterEach
    void close() {
        adapter.close();
    }

    @Test
    void defaultKeyUsesNameAndClientAddress() {
        RateLimitOptions options = RateLimitOptions.builder(10, 60).build();

        assertThat(RateLimiter.key(TestRequests.get("/a?b=c"), options)).isEqualTo("default|ip:10.0.0.1");
    }

    @Test
    void varyOptionsExtendKey() {
        ServerRequest request = TestRequests.get("/users/1?page=2");
        request.attachUser(ApiUser.of("u1"));
        RateLimitOptions options = RateLimitOptions.builder(10, 60)
                .name("users")
                .varyByUser(true)
                .varyByRoute(true)
                .varyByMethod(true)
                .build();

        assertThat(RateLimiter.key(request, options))
                .isEqualTo("users|ip:10.0.0.1|user:u1|route:/users/1|method:GET");
    }

    @Test
    void keyGeneratorReplacesDerivedKey() {
        RateLimitOptions options = RateLimitOptions.builder(10, 60)
                .keyGenerator(r -> "api-key:" + r.firstHeader("X-Api-Key").orElse("none"))
                .build();
        ServerRequest request = TestRequests.request(HttpMethod.GET, "/", TestRequests.headers("X-Api-Key", "k1"), null);

        assertThat(RateLimiter.key(request, options)).isEqualTo("api-key:k1");
    }

    @Test
    void exceedingLimitThrowsWithMetadata() {
        RateLimitOptions options = RateLimitOptions.builder(2, 30).message("Slow down").statusCode(503).build();
        ServerRequest request = TestRequests.get("/x");

        rateLimiter.check(request, options);
        rateLimiter.check(request, options);

        assertThatThrownBy(() -> rateLimiter.check(request, options))
                .isInstanceOfSatisfying(ApiException.RateLimited.class, e -> {
                    assertThat(e.getMessage()).isEqualTo("Slow down");
                    assertThat(e.status()).isEqualTo(503);
                    assertThat(e.metadata()).containsAllEntriesOf(Map.of(
                            "limit", 2, "remaining", 0, "reset", 30L, "retryAfter", 30L));
                    assertThat(e.retryAfterSeconds()).isEqualTo(30);
                });
    }

    @Test
    void unknownAdapterIsMisconfiguration() {
        RateLimitOptions options = RateLimitOptions.builder(2, 30).adapter("redis").build();

        assertThatThrownBy(() -> rateLimiter.check(TestRequests.get("/x"), options))
                .isInstanceOf(ApiException.AdapterMisconfigured.class);
    }

    @Test
    void optionsValidateLimits() {
        assertThatThrownBy(() -> RateLimitOptions.builder(0, 60).build()).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RateLimitOptions.builder(1, 0).build()).isInstanceOf(IllegalArgumentException.class);
    }
}
