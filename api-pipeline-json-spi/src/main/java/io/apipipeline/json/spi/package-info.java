/**
 * JSON codec SPI.
 *
 * <p>The server core depends only on this package; a concrete codec (for example the Jackson
 * module) is selected explicitly or discovered through {@link java.util.ServiceLoader}.
 */
package io.apipipeline.json.spi;
