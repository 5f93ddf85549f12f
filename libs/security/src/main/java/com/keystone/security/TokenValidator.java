package com.keystone.security;

import com.keystone.observability.SecurityMetrics;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWT;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates RS256 bearer tokens issued by the configured identity provider.
 *
 * <p>Checks run in a fixed order and each one is terminal:
 *
 * <ol>
 *   <li>the compact serialization and header parse
 *   <li>{@code alg} is exactly RS256 (never configurable per request)
 *   <li>the {@code kid} resolves to an RSA key in the {@link KeyRing}
 *   <li>the signature verifies against that key
 *   <li>{@code exp}, {@code nbf}, {@code iat}, {@code aud} and {@code iss} are acceptable
 * </ol>
 *
 * <p>Expiry is reported as {@link AuthTokenExpiredException}; every other failure is an
 * {@link AuthTokenInvalidException}. There are no retries.
 */
public final class TokenValidator {

    private static final Logger log = LoggerFactory.getLogger(TokenValidator.class);

    public static final Duration DEFAULT_CLOCK_TOLERANCE = Duration.ofSeconds(30);

    private final KeyRing keyRing;
    private final String audience;
    private final String issuer;
    private final Duration clockTolerance;
    private final Clock clock;
    private final SecurityMetrics metrics;

    public TokenValidator(
            KeyRing keyRing,
            String audience,
            String issuer,
            Duration clockTolerance,
            Clock clock,
            SecurityMetrics metrics) {
        if (keyRing == null) {
            throw new IllegalArgumentException("keyRing must not be null");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be null or blank");
        }
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be null or blank");
        }
        this.keyRing = keyRing;
        this.audience = audience;
        this.issuer = issuer;
        this.clockTolerance = clockTolerance == null ? DEFAULT_CLOCK_TOLERANCE : clockTolerance;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = metrics == null ? SecurityMetrics.noop() : metrics;
    }

    /** Validates against the configured audience, issuer and clock tolerance. */
    public JWTClaimsSet validate(String token) {
        return validate(token, audience, issuer, clockTolerance);
    }

    /**
     * Validates a compact JWT and returns its claims.
     *
     * @throws AuthTokenExpiredException       if the token expired beyond the tolerance
     * @throws AuthTokenInvalidException       for every other verification failure
     * @throws KeyProviderUnavailableException if no signing keys could ever be loaded
     */
    public JWTClaimsSet validate(
            String token, String expectedAudience, String expectedIssuer, Duration tolerance) {
        try {
            JWTClaimsSet claims = doValidate(token, expectedAudience, expectedIssuer, tolerance);
            metrics.tokenValidation("valid");
            return claims;
        } catch (AuthTokenExpiredException e) {
            metrics.tokenValidation("expired");
            log.info("Rejected expired token (exp={})", e.expiredAt());
            throw e;
        } catch (AuthTokenInvalidException e) {
            metrics.tokenValidation("invalid");
            log.warn("Rejected invalid token: {}", e.getMessage());
            throw e;
        } catch (KeyProviderUnavailableException e) {
            metrics.tokenValidation("key_unavailable");
            throw e;
        }
    }

    private JWTClaimsSet doValidate(
            String token, String expectedAudience, String expectedIssuer, Duration tolerance) {
        if (token == null || token.isBlank()) {
            throw new AuthTokenInvalidException("Token is empty");
        }

        JWT jwt;
        try {
            jwt = JWTParser.parse(token);
        } catch (ParseException e) {
            throw new AuthTokenInvalidException("Malformed token", e);
        }

        if (!JWSAlgorithm.RS256.equals(jwt.getHeader().getAlgorithm())) {
            throw new AuthTokenInvalidException(
                    "Algorithm %s is not allowed".formatted(jwt.getHeader().getAlgorithm()));
        }
        if (!(jwt instanceof SignedJWT signed)) {
            throw new AuthTokenInvalidException("Token is not signed");
        }

        JWSHeader header = signed.getHeader();
        String kid = header.getKeyID();
        if (kid == null || kid.isBlank()) {
            throw new AuthTokenInvalidException("Token header has no key id");
        }
        JWK key = keyRing.getKey(kid)
                .orElseThrow(() -> new AuthTokenInvalidException("No signing key for kid " + kid));
        if (!(key instanceof RSAKey rsaKey)) {
            throw new AuthTokenInvalidException("Signing key " + kid + " is not an RSA key");
        }

        try {
            if (!signed.verify(new RSASSAVerifier(rsaKey))) {
                throw new AuthTokenInvalidException("Signature verification failed");
            }
        } catch (JOSEException e) {
            throw new AuthTokenInvalidException("Signature verification failed", e);
        }

        JWTClaimsSet claims;
        try {
            claims = signed.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new AuthTokenInvalidException("Malformed token claims", e);
        }

        verifyClaims(claims, expectedAudience, expectedIssuer, tolerance);
        return claims;
    }

    private void verifyClaims(
            JWTClaimsSet claims, String expectedAudience, String expectedIssuer, Duration tolerance) {
        Instant now = clock.instant();
        Duration skew = tolerance == null ? Duration.ZERO : tolerance;

        Date exp = claims.getExpirationTime();
        if (exp == null) {
            throw new AuthTokenInvalidException("Token has no expiry");
        }
        if (exp.toInstant().plus(skew).isBefore(now)) {
            throw new AuthTokenExpiredException(exp.toInstant());
        }

        Date nbf = claims.getNotBeforeTime();
        if (nbf != null && nbf.toInstant().minus(skew).isAfter(now)) {
            throw new AuthTokenInvalidException("Token is not valid yet");
        }

        Date iat = claims.getIssueTime();
        if (iat != null && iat.toInstant().minus(skew).isAfter(now)) {
            throw new AuthTokenInvalidException("Token was issued in the future");
        }

        List<String> aud = claims.getAudience();
        if (aud == null || !aud.contains(expectedAudience)) {
            throw new AuthTokenInvalidException("Invalid audience");
        }

        if (!expectedIssuer.equals(claims.getIssuer())) {
            throw new AuthTokenInvalidException("Invalid issuer");
        }
    }
}
