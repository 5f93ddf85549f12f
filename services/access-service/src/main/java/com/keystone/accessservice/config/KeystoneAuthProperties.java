package com.keystone.accessservice.config;

import com.keystone.security.KeyRing;
import com.keystone.security.TenantScope;
import com.keystone.security.TokenValidator;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Identity provider settings, bound from {@code keystone.auth.*}.
 *
 * <pre>
 * keystone:
 *   auth:
 *     domain: tenant.eu.auth0.com
 *     audience: https://api.example.com
 *     clock-tolerance: 30s
 *     jwks-cache-ttl: 1h
 * </pre>
 *
 * @param domain           identity provider domain; the key set is served from
 *                         {@code https://{domain}/.well-known/jwks.json}. Required.
 * @param audience         expected {@code aud} claim. Required.
 * @param issuer           expected {@code iss} claim (default {@code https://{domain}/})
 * @param namespace        prefix of custom claims (default the audience)
 * @param clockTolerance   allowed skew for {@code exp}, {@code nbf} and {@code iat}
 * @param jwksCacheTtl     how long a fetched key set is trusted before a refresh
 * @param jwksFetchTimeout connect and read timeout of one key set fetch
 * @param overrideHeader   header carrying an administrator's organization override
 */
@ConfigurationProperties(prefix = "keystone.auth")
@Validated
public record KeystoneAuthProperties(
        @NotBlank String domain,
        @NotBlank String audience,
        String issuer,
        String namespace,
        Duration clockTolerance,
        Duration jwksCacheTtl,
        Duration jwksFetchTimeout,
        String overrideHeader) {

    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(10);

    public KeystoneAuthProperties {
        if ((issuer == null || issuer.isBlank()) && domain != null) {
            issuer = "https://" + domain + "/";
        }
        if (namespace == null || namespace.isBlank()) {
            namespace = audience;
        }
        if (clockTolerance == null) {
            clockTolerance = TokenValidator.DEFAULT_CLOCK_TOLERANCE;
        }
        if (jwksCacheTtl == null) {
            jwksCacheTtl = KeyRing.DEFAULT_TTL;
        }
        if (jwksFetchTimeout == null) {
            jwksFetchTimeout = DEFAULT_FETCH_TIMEOUT;
        }
        if (overrideHeader == null || overrideHeader.isBlank()) {
            overrideHeader = TenantScope.DEFAULT_OVERRIDE_HEADER;
        }
    }

    public String jwksUrl() {
        return "https://" + domain + "/.well-known/jwks.json";
    }
}
