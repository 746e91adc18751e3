package io.apipipeline.json.spi;

/**
 * A payload a {@link JsonCodec} could not encode or decode. The cause is the codec library's
 * own exception.
 *
 * <p>The pipeline renders an encoding failure as a plain 500 and validates an undecodable
 * request body as an empty object.
 */
public final class JsonException extends Exception {

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
