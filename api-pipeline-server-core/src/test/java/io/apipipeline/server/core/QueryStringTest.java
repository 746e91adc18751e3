package io.apipipeline.server.core;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryStringTest {

    @Test
    void parseDecodesKeysAndValues() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/users?name=J%C3%BCrgen&sort=asc+desc"));
        assertThat(parsed).containsEntry("name", "Jürgen");
        assertThat(parsed).containsEntry("sort", "asc desc");
    }

    @Test
    void parseHandlesMissingValueAsEmpty() {
        Map<String, String> parsed = QueryString.parse(URI.create("http://localhost/users?active"));
        assertThat(parsed).containsEntry("active", "");
    }

    @Test
    void parseWithoutQueryIsEmpty() {
        assertThat(QueryString.parse(URI.create("http://localhost/users"))).isEmpty();
    }

    @Test
    void lastRepeatedKeyWins() {
        assertThat(QueryString.parse(URI.create("http://localhost/x?page=1&page=2"))).containsEntry("page", "2");
    }

    @Test
    void sortedOrdersByKey() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("b", "2");
        params.put("a", "1");
        params.put("c", "3");

        assertThat(QueryString.sorted(params)).isEqualTo("a=1&b=2&c=3");
    }
}
