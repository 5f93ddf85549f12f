package com.keystone.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

/**
 * Micrometer counters for the trust and access path.
 *
 * <p>Every meter carries a {@code service} tag. Meter names are stable and documented here because
 * dashboards and alerts are built on them:
 *
 * <ul>
 *   <li>{@code keystone.auth.token.validations} tagged {@code outcome} (valid, invalid, expired,
 *       key_unavailable)
 *   <li>{@code keystone.auth.jwks.refreshes} tagged {@code outcome} (success, failure)
 *   <li>{@code keystone.access.denials} tagged {@code reason}
 *   <li>{@code keystone.audit.appends} tagged {@code category}
 *   <li>{@code keystone.audit.chain.broken_links}
 * </ul>
 */
public final class SecurityMetrics {

    public static final String TAG_SERVICE = "service";

    static final String TOKEN_VALIDATIONS = "keystone.auth.token.validations";
    static final String JWKS_REFRESHES = "keystone.auth.jwks.refreshes";
    static final String ACCESS_DENIALS = "keystone.access.denials";
    static final String AUDIT_APPENDS = "keystone.audit.appends";
    static final String BROKEN_LINKS = "keystone.audit.chain.broken_links";

    private final MeterRegistry registry;
    private final String serviceName;

    public SecurityMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Metrics that record nothing; for components constructed outside a wired service. */
    public static SecurityMetrics noop() {
        return new SecurityMetrics(new CompositeMeterRegistry(), "keystone");
    }

    public void tokenValidation(String outcome) {
        counter(TOKEN_VALIDATIONS, "Bearer token validation attempts", "outcome", outcome).increment();
    }

    public void keySetRefresh(boolean success) {
        counter(JWKS_REFRESHES, "JWKS refresh attempts", "outcome", success ? "success" : "failure")
                .increment();
    }

    public void accessDenied(String reason) {
        counter(ACCESS_DENIALS, "Authorization denials", "reason", reason).increment();
    }

    public void auditAppended(String category) {
        counter(AUDIT_APPENDS, "Audit records appended", "category", category == null ? "none" : category)
                .increment();
    }

    public void brokenChainLinks(int count) {
        if (count > 0) {
            counter(BROKEN_LINKS, "Broken audit chain links detected by verification").increment(count);
        }
    }

    public MeterRegistry registry() {
        return registry;
    }

    private Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(Tags.of(TAG_SERVICE, serviceName).and(tags))
                .register(registry);
    }
}
