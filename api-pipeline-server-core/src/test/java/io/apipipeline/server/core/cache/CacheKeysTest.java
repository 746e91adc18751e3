package io.apipipeline.server.core.cache;

import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.TestRequests;
import io.apipipeline.server.spi.ApiUser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    void defaultKeyIsMethodAndUrl() {
        String key = CacheKeys.key(TestRequests.get("/users?page=2"), CacheOptions.defaults());

        assertThat(key).isEqualTo("GET|http://localhost/users?page=2");
    }

    @Test
    void queryIsSortedIntoKey() {
        CacheOptions options = CacheOptions.builder().includeQuery(true).build();

        String key = CacheKeys.key(TestRequests.get("/users?z=1&a=2"), options);

        assertThat(key).endsWith("|query:a=2&z=1");
    }

    @Test
    void presentHeadersAndUserAreAppended() {
        ServerRequest request = TestRequests.request(HttpMethod.GET, "/users",
                TestRequests.headers("Accept-Language", "de"), null);
        request.attachUser(ApiUser.of("u1"));
        CacheOptions options = CacheOptions.builder()
                .includeHeaders("Accept-Language", "X-Missing")
                .varyByUser(true)
                .build();

        assertThat(CacheKeys.key(request, options))
                .isEqualTo("GET|http://localhost/users|headers:Accept-Language=de|user:u1");
    }

    @Test
    void keyFunctionIsUsedWithoutFixedKey() {
        CacheOptions options = CacheOptions.builder().keyFunction(r -> "custom:" + r.path()).build();

        assertThat(CacheKeys.key(TestRequests.get("/a"), options)).isEqualTo("custom:/a");
    }

    @Test
    void fixedKeyWinsOverKeyFunction() {
        CacheOptions options = CacheOptions.builder().key("constant").keyFunction(r -> "fn").build();

        assertThat(CacheKeys.key(TestRequests.get("/a"), options)).isEqualTo("constant");
    }
}
