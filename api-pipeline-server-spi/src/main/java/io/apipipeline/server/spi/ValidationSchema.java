package io.apipipeline.server.spi;

/**
 * Schema validator contract.
 *
 * <p>Implementations return the (possibly coerced or defaulted) value together with every
 * violation found; they do not throw for invalid input.
 *
 * @param <T> validated value type
 */
@FunctionalInterface
public interface ValidationSchema<T> {

    ValidationResult<T> validate(Object data);
}
