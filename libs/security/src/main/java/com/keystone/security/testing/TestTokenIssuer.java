package com.keystone.security.testing;

import com.keystone.security.KeySetFetcher;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Mints RS256 tokens signed by a freshly generated key, and exposes the matching public key set.
 */
public final class TestTokenIssuer {

    public static final String AUDIENCE = "https://api.keystone.test";
    public static final String ISSUER = "https://keystone-test.eu.auth0.com/";
    public static final String NAMESPACE = AUDIENCE;

    private final RSAKey signingKey;

    public TestTokenIssuer(String kid) {
        try {
            this.signingKey = new RSAKeyGenerator(2048).keyID(kid).generate();
        } catch (JOSEException e) {
            throw new IllegalStateException("Could not generate RSA test key", e);
        }
    }

    public String kid() {
        return signingKey.getKeyID();
    }

    public JWKSet publicKeySet() {
        return new JWKSet(signingKey.toPublicJWK());
    }

    /** A fetcher that always returns this issuer's public key set. */
    public KeySetFetcher fetcher() {
        return this::publicKeySet;
    }

    /** Claims valid for one hour from {@code now} with the test audience and issuer. */
    public JWTClaimsSet.Builder claims(String subject, Instant now) {
        return new JWTClaimsSet.Builder()
                .subject(subject)
                .audience(AUDIENCE)
                .issuer(ISSUER)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(Duration.ofHours(1))));
    }

    public String sign(JWTClaimsSet claims) {
        return sign(claims, new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(kid()).build());
    }

    public String sign(JWTClaimsSet claims, JWSHeader header) {
        SignedJWT jwt = new SignedJWT(header, claims);
        try {
            jwt.sign(new RSASSASigner(signingKey));
        } catch (JOSEException e) {
            throw new IllegalStateException("Could not sign test token", e);
        }
        return jwt.serialize();
    }

    /** A valid token for {@code subject} in {@code orgId} with the given permissions. */
    public String token(String subject, String orgId, String... permissions) {
        return token(subject, orgId, List.of("member"), permissions);
    }

    /** As {@link #token(String, String, String...)} with namespaced roles. */
    public String token(String subject, String orgId, List<String> roles, String... permissions) {
        return sign(claims(subject, Instant.now())
                .claim("org_id", orgId)
                .claim("permissions", List.of(permissions))
                .claim(NAMESPACE + "/roles", roles)
                .build());
    }
}
