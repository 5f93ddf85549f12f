package com.keystone.accessservice.config;

import com.keystone.observability.SecurityMetrics;
import com.keystone.observability.SpanHelper;
import com.keystone.security.AccessController;
import com.keystone.security.IdentityExtractor;
import com.keystone.security.KeyRing;
import com.keystone.security.KeySetFetcher;
import com.keystone.security.RemoteKeySetFetcher;
import com.keystone.security.TokenValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.net.MalformedURLException;
import java.net.URI;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Token validation, identity extraction and authorization components.
 *
 * <p>The {@link KeyRing} is the only process-wide mutable state; it is created once here and shared
 * by every request through {@link TokenValidator}.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    static final String INSTRUMENTATION_NAME = "com.keystone.access-service";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry registry, KeystoneServiceProperties service) {
        return new SecurityMetrics(registry, service.name());
    }

    @Bean
    public Tracer tracer() {
        return GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);
    }

    @Bean
    public SpanHelper spanHelper(Tracer tracer) {
        return new SpanHelper(tracer);
    }

    @Bean
    public KeySetFetcher keySetFetcher(KeystoneAuthProperties auth) {
        try {
            log.info("JWKS endpoint: {}", auth.jwksUrl());
            return new RemoteKeySetFetcher(URI.create(auth.jwksUrl()).toURL(), auth.jwksFetchTimeout());
        } catch (MalformedURLException e) {
            throw new IllegalStateException("Invalid identity provider domain: " + auth.domain(), e);
        }
    }

    @Bean
    public KeyRing keyRing(KeySetFetcher fetcher, KeystoneAuthProperties auth, Clock clock, SecurityMetrics metrics) {
        return new KeyRing(fetcher, auth.jwksCacheTtl(), clock, metrics);
    }

    @Bean
    public TokenValidator tokenValidator(
            KeyRing keyRing, KeystoneAuthProperties auth, Clock clock, SecurityMetrics metrics) {
        return new TokenValidator(keyRing, auth.audience(), auth.issuer(), auth.clockTolerance(), clock, metrics);
    }

    @Bean
    public IdentityExtractor identityExtractor(KeystoneAuthProperties auth) {
        return new IdentityExtractor(auth.namespace());
    }

    @Bean
    public AccessController accessController(SecurityMetrics metrics) {
        return new AccessController(metrics);
    }
}
