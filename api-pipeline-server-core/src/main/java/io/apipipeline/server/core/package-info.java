/**
 * Framework-neutral request pipeline: request/response model, router, endpoint pipeline and the
 * in-memory reference adapters.
 *
 * <p>Framework integrations map their native request onto {@link io.apipipeline.server.core.ServerRequest},
 * route it through {@link io.apipipeline.server.core.router.Router} and write the returned
 * {@link io.apipipeline.server.core.ServerResponse} back.
 */
package io.apipipeline.server.core;
