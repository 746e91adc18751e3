package io.apipipeline.server.core;

import io.apipipeline.core.HttpMethod;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request builders shared by tests.
 */
public final class TestRequests {

    private TestRequests() {}

    public static ServerRequest get(String pathAndQuery) {
        return request(HttpMethod.GET, pathAndQuery, Map.of(), null);
    }

    public static ServerRequest request(HttpMethod method, String pathAndQuery, Map<String, List<String>> headers, String body) {
        return new ServerRequest(method, URI.create("http://localhost" + pathAndQuery), headers,
                body == null ? null : new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)), "10.0.0.1");
    }

    public static Map<String, List<String>> headers(String... kv) {
        Map<String, List<String>> h = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            h.put(kv[i], List.of(kv[i + 1]));
        }
        return h;
    }

    public static String bodyText(ServerResponse response) {
        if (response.body() instanceof ResponseBody.Bytes b) return b.utf8();
        return "";
    }
}
