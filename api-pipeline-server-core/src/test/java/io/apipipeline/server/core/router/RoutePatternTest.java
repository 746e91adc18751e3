package io.apipipeline.server.core.router;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoutePatternTest {

    @Test
    void namedParametersCaptureOneSegment() {
        RoutePattern pattern = RoutePattern.compile("/users/:id/posts/:postId");

        assertThat(pattern.paramNames()).containsExactly("id", "postId");
        assertThat(pattern.match("/users/42/posts/7")).hasValueSatisfying(params -> {
            assertThat(params).containsEntry("id", "42");
            assertThat(params).containsEntry("postId", "7");
        });
        assertThat(pattern.match("/users/42/posts")).isEmpty();
        assertThat(pattern.match("/users/4/2/posts/7")).isEmpty();
    }

    @Test
    void trailingSlashIsOptional() {
        RoutePattern pattern = RoutePattern.compile("/users");

        assertThat(pattern.match("/users")).isPresent();
        assertThat(pattern.match("/users/")).isPresent();
        assertThat(pattern.match("/users/1")).isEmpty();
    }

    @Test
    void rootTemplateMatchesRootOnly() {
        RoutePattern pattern = RoutePattern.compile("/");

        assertThat(pattern.match("/")).isPresent();
        assertThat(pattern.match("")).isPresent();
        assertThat(pattern.match("/a")).isEmpty();
    }

    @Test
    void singleWildcardsAreNumberedInOrder() {
        RoutePattern pattern = RoutePattern.compile("/files/*/versions/*");

        assertThat(pattern.paramNames()).containsExactly("*0", "*1");
        assertThat(pattern.match("/files/report/versions/3")).hasValueSatisfying(params -> {
            assertThat(params).containsEntry("*0", "report");
            assertThat(params).containsEntry("*1", "3");
        });
    }

    @Test
    void doubleWildcardCapturesRemainderWithSlashes() {
        RoutePattern pattern = RoutePattern.compile("/static/**");

        assertThat(pattern.match("/static/css/site/main.css"))
                .hasValueSatisfying(params -> assertThat(params).containsEntry("**", "css/site/main.css"));
    }

    @Test
    void literalSegmentsAreNotRegex() {
        RoutePattern pattern = RoutePattern.compile("/v1.0/items");

        assertThat(pattern.match("/v1.0/items")).isPresent();
        assertThat(pattern.match("/v1x0/items")).isEmpty();
    }

    @Test
    void capturedValuesArePercentDecoded() {
        RoutePattern pattern = RoutePattern.compile("/tags/:name");

        assertThat(pattern.match("/tags/hello%20world"))
                .hasValueSatisfying(params -> assertThat(params).containsEntry("name", "hello world"));
        assertThat(pattern.match("/tags/a+b"))
                .hasValueSatisfying(params -> assertThat(params).containsEntry("name", "a+b"));
    }

    @Test
    void rejectsInvalidTemplates() {
        assertThatThrownBy(() -> RoutePattern.compile("users")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RoutePattern.compile("/a/:id/b/:id"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
        assertThatThrownBy(() -> RoutePattern.compile("/a/:9x")).isInstanceOf(IllegalArgumentException.class);
    }
}
