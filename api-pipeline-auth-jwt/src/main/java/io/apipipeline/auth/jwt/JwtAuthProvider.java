package io.apipipeline.auth.jwt;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import io.apipipeline.core.ApiException;
import io.apipipeline.server.spi.ApiUser;
import io.apipipeline.server.spi.AuthProvider;
import io.apipipeline.server.spi.TokenPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.ParseException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * HS256 {@link AuthProvider}.
 *
 * <p>Access tokens carry {@code sub}, {@code roles}, {@code permissions}, {@code email},
 * {@code name}, {@code metadata}, {@code iss}, {@code aud}, {@code iat} and {@code exp}.
 * Refresh tokens carry only the subject and a random {@code jti} and are signed with the
 * refresh secret, so neither kind verifies as the other.
 *
 * <p>Refreshing looks the subject up through the configured function; without one the new
 * token is issued for a user with the subject as id and no roles.
 */
public final class JwtAuthProvider implements AuthProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthProvider.class);

    static final String ROLES = "roles";
    static final String PERMISSIONS = "permissions";
    static final String EMAIL = "email";
    static final String NAME = "name";
    static final String METADATA = "metadata";

    private final JwtAuthConfig config;
    private final Function<String, Optional<ApiUser>> userLookup;
    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final JWSSigner refreshSigner;
    private final JWSVerifier refreshVerifier;

    public JwtAuthProvider(JwtAuthConfig config) {
        this(config, id -> Optional.of(ApiUser.of(id)));
    }

    /**
     * @param userLookup resolves the user of a refresh token's subject; empty rejects the refresh
     */
    public JwtAuthProvider(JwtAuthConfig config, Function<String, Optional<ApiUser>> userLookup) {
        this.config = Objects.requireNonNull(config, "config");
        this.userLookup = Objects.requireNonNull(userLookup, "userLookup");
        try {
            this.signer = new MACSigner(config.secret());
            this.verifier = new MACVerifier(config.secret());
            this.refreshSigner = new MACSigner(config.refreshSecret());
            this.refreshVerifier = new MACVerifier(config.refreshSecret());
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Unusable JWT secret: " + e.getMessage(), e);
        }
    }

    @Override
    public ApiUser verifyToken(String token) {
        JWTClaimsSet claims = verify(token, verifier, "Token expired", "Invalid token");
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) throw new ApiException.InvalidToken("Invalid token format");
        try {
            return new ApiUser(
                    subject,
                    stringSet(claims.getStringListClaim(ROLES)),
                    stringSet(claims.getStringListClaim(PERMISSIONS)),
                    claims.getStringClaim(EMAIL),
                    claims.getStringClaim(NAME),
                    claims.getJSONObjectClaim(METADATA));
        } catch (ParseException e) {
            log.debug("Malformed user claims: {}", e.getMessage());
            throw new ApiException.InvalidToken("Invalid token format");
        }
    }

    @Override
    public TokenPair generateToken(ApiUser user) {
        if (user == null || user.id() == null || user.id().isBlank()) {
            throw new ApiException.BadRequest("User ID is required");
        }
        Instant now = config.clock().instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(config.tokenExpiration());

        JWTClaimsSet access = new JWTClaimsSet.Builder()
                .subject(user.id())
                .claim(ROLES, new ArrayList<>(user.roles()))
                .claim(PERMISSIONS, new ArrayList<>(user.permissions()))
                .claim(EMAIL, user.email())
                .claim(NAME, user.name())
                .claim(METADATA, user.metadata())
                .issuer(config.issuer())
                .audience(config.audience())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(expiresAt))
                .build();

        JWTClaimsSet refresh = new JWTClaimsSet.Builder()
                .subject(user.id())
                .jwtID(UUID.randomUUID().toString())
                .issuer(config.issuer())
                .audience(config.audience())
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(config.refreshExpiration())))
                .build();

        return new TokenPair(sign(access, signer), sign(refresh, refreshSigner), expiresAt);
    }

    @Override
    public TokenPair refreshToken(String refreshToken) {
        JWTClaimsSet claims = verify(refreshToken, refreshVerifier, "Refresh token expired", "Invalid refresh token");
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) throw new ApiException.InvalidToken("Invalid refresh token");

        ApiUser user = userLookup.apply(subject).orElseThrow(() -> {
            log.debug("Refresh token subject {} no longer resolves to a user", subject);
            return new ApiException.InvalidToken("Invalid refresh token");
        });
        return generateToken(user);
    }

    private JWTClaimsSet verify(String token, JWSVerifier keyVerifier, String expiredMessage, String invalidMessage) {
        if (token == null || token.isBlank()) throw new ApiException.InvalidToken(invalidMessage);
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
                throw new ApiException.InvalidToken(invalidMessage);
            }
            if (!jwt.verify(keyVerifier)) throw new ApiException.InvalidToken(invalidMessage);
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException | JOSEException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw new ApiException.InvalidToken(invalidMessage);
        }

        if (!config.issuer().equals(claims.getIssuer())) throw new ApiException.InvalidToken(invalidMessage);
        List<String> audience = claims.getAudience();
        if (audience == null || !audience.contains(config.audience())) throw new ApiException.InvalidToken(invalidMessage);

        Date exp = claims.getExpirationTime();
        if (exp == null || exp.toInstant().isBefore(config.clock().instant())) {
            throw new ApiException.TokenExpired(expiredMessage);
        }
        return claims;
    }

    private static String sign(JWTClaimsSet claims, JWSSigner signer) {
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new ApiException.Internal("Token signing failed", e);
        }
        return jwt.serialize();
    }

    private static HashSet<String> stringSet(List<String> values) {
        return values == null ? new HashSet<>() : new HashSet<>(values);
    }
}
