/**
 * Server-side SPI for the endpoint pipeline.
 *
 * <p>The SPI is blocking and minimal: cache and rate limit adapters, auth providers, schema
 * validators and health probes. Reference implementations live in the server core module;
 * production deployments can plug in shared stores by registering their own adapters in an
 * {@link io.apipipeline.server.spi.AdapterRegistry}.
 */
package io.apipipeline.server.spi;
