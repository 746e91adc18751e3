package io.apipipeline.server.core;

import java.nio.charset.StandardCharsets;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {

        public String utf8() {
            return new String(bytes, StandardCharsets.UTF_8);
        }
    }
}
