package io.apipipeline.server.core.router;

import io.apipipeline.core.HttpMethod;
import io.apipipeline.server.core.ResponseBody;
import io.apipipeline.server.core.ServerRequest;
import io.apipipeline.server.core.ServerResponse;
import io.apipipeline.server.core.TestRequests;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RouterTest {

    @Test
    void firstRegisteredMatchWins() {
        Endpoint me = named("me");
        Endpoint byId = named("byId");
        Router router = new Router()
                .get("/users/me", me)
                .get("/users/:id", byId);

        assertThat(router.dispatch(HttpMethod.GET, "/users/me"))
                .hasValueSatisfying(m -> assertThat(m.route().endpoint()).isSameAs(me));
        assertThat(router.dispatch(HttpMethod.GET, "/users/42")).hasValueSatisfying(m -> {
            assertThat(m.route().endpoint()).isSameAs(byId);
            assertThat(m.params()).containsEntry("id", "42");
        });
    }

    @Test
    void methodMismatchIsNoMatch() {
        Router router = new Router().post("/users", named("create"));

        assertThat(router.dispatch(HttpMethod.GET, "/users")).isEmpty();
        assertThat(router.dispatch("post", "/users")).isPresent();
    }

    @Test
    void allMatchesEveryMethod() {
        Router router = new Router().all("/proxy/**", named("proxy"));

        for (HttpMethod method : HttpMethod.values()) {
            assertThat(router.dispatch(method, "/proxy/a/b")).isPresent();
        }
    }

    @Test
    void handleInvokesEndpointWithParams() {
        Router router = new Router().get("/users/:id", (req, params) ->
                new ServerResponse(200, new ResponseBody.Empty()).header("X-Id", params.get("id")));

        ServerResponse response = router.handle(TestRequests.get("/users/7?x=1"));

        assertThat(response.status()).isEqualTo(200);
        assertThat(response.firstHeader("X-Id")).contains("7");
    }

    @Test
    void handleFallsBackWhenNothingMatches() {
        Router router = new Router().get("/users", named("list"));

        ServerResponse custom = router.handle(TestRequests.get("/orders"),
                req -> new ServerResponse(418, new ResponseBody.Empty()));
        ServerResponse defaults = router.handle(TestRequests.get("/orders"));

        assertThat(custom.status()).isEqualTo(418);
        assertThat(defaults.status()).isEqualTo(404);
    }

    @Test
    void rejectsUnknownMethod() {
        assertThatThrownBy(() -> new Router().register("BREW", "/coffee", named("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentRegistrationAndDispatchDoNotInterfere() throws Exception {
        Router router = new Router().get("/stable", named("stable"));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> readers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                readers.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 1_000; n++) {
                        if (router.dispatch(HttpMethod.GET, "/stable").isEmpty()) return false;
                    }
                    return true;
                }));
            }
            Future<?> writer = pool.submit(() -> {
                start.await();
                for (int n = 0; n < 200; n++) router.get("/dynamic/" + n, named("d" + n));
                return null;
            });
            start.countDown();
            writer.get(5, TimeUnit.SECONDS);
            for (Future<Boolean> reader : readers) assertThat(reader.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
        assertThat(router.routes()).hasSize(201);
    }

    private static Endpoint named(String name) {
        return new Endpoint() {
            @Override
            public ServerResponse handle(ServerRequest request, Map<String, String> params) {
                return new ServerResponse(200, new ResponseBody.Empty()).header("X-Endpoint", name);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
