package io.apipipeline.server.core;

import io.apipipeline.json.spi.JsonCodec;
import io.apipipeline.json.spi.JsonCodecProvider;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    public static JsonCodec discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    /**
     * @throws IllegalStateException if no {@link JsonCodecProvider} is on the class path
     */
    public static JsonCodec discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No JsonCodecProvider found; add api-pipeline-json-jackson or supply a codec");
        }
        return it.next().codec();
    }
}
