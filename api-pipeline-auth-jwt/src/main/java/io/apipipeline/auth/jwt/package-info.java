/**
 * HMAC-signed JSON Web Token support for the pipeline's authentication stage.
 */
package io.apipipeline.auth.jwt;
