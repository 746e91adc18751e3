package io.apipipeline.json.spi;

/**
 * {@link java.util.ServiceLoader} hook for JSON codec implementations.
 */
public interface JsonCodecProvider {

    /**
     * Creates the codec exposed by this provider.
     */
    JsonCodec codec();
}
