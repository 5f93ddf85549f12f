package com.keystone.security;

import com.keystone.observability.SecurityMetrics;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RBAC and ABAC decision engine.
 *
 * <p>The {@code check*} and {@link #evaluate} methods are pure decisions and never throw. The
 * {@code require*} and {@link #authorize} wrappers turn a denial into a {@link ForbiddenException}.
 *
 * <p>A system administrator passes every check here without the underlying predicate being
 * evaluated. Acting on another organization is separate and still needs an explicit override
 * (see {@link TenantScope}).
 */
public final class AccessController {

    private static final Logger log = LoggerFactory.getLogger(AccessController.class);

    private final SecurityMetrics metrics;

    public AccessController(SecurityMetrics metrics) {
        this.metrics = metrics == null ? SecurityMetrics.noop() : metrics;
    }

    public AccessController() {
        this(SecurityMetrics.noop());
    }

    public AccessDecision checkPermissions(Principal principal, Collection<String> required, boolean requireAll) {
        if (principal.isSystemAdmin()) {
            return AccessDecision.bypass();
        }
        if (required.isEmpty()) {
            return AccessDecision.grant();
        }
        Set<String> missing = new LinkedHashSet<>(required);
        missing.removeAll(principal.permissions());
        boolean ok = requireAll ? missing.isEmpty() : required.stream().anyMatch(principal.permissions()::contains);
        return ok ? AccessDecision.grant() : AccessDecision.missingPermissions(missing);
    }

    public AccessDecision checkRoles(Principal principal, Collection<String> required, boolean requireAll) {
        if (principal.isSystemAdmin()) {
            return AccessDecision.bypass();
        }
        if (required.isEmpty()) {
            return AccessDecision.grant();
        }
        Set<String> missing = new LinkedHashSet<>(required);
        missing.removeAll(principal.roles());
        boolean ok = requireAll ? missing.isEmpty() : required.stream().anyMatch(principal.roles()::contains);
        return ok ? AccessDecision.grant() : AccessDecision.missingRoles(missing);
    }

    /** All policies must pass. */
    public AccessDecision checkPolicies(
            Principal principal, Object resource, AccessContext context, List<AbacPolicy> policies) {
        if (principal.isSystemAdmin()) {
            return AccessDecision.bypass();
        }
        AccessContext ctx = context == null ? AccessContext.empty() : context;
        for (AbacPolicy policy : policies) {
            if (!policy.test(principal, resource, ctx)) {
                return AccessDecision.deny(DenialReason.POLICY_DENIED);
            }
        }
        return AccessDecision.grant();
    }

    /**
     * Evaluates a composite requirement: permissions, then roles, then (only when {@code resource}
     * is non-null) attribute policies.
     */
    public AccessDecision evaluate(
            Principal principal, AccessRequirement requirement, Object resource, AccessContext context) {
        if (principal.isSystemAdmin()) {
            return AccessDecision.bypass();
        }
        AccessDecision decision =
                checkPermissions(principal, requirement.permissions(), requirement.requireAllPermissions());
        if (decision.granted()) {
            decision = checkRoles(principal, requirement.roles(), requirement.requireAllRoles());
        }
        if (decision.granted() && resource != null && !requirement.policies().isEmpty()) {
            decision = checkPolicies(principal, resource, context, requirement.policies());
        }
        return decision;
    }

    public void requirePermissions(Principal principal, String... permissions) {
        enforce(principal, checkPermissions(principal, Arrays.asList(permissions), true));
    }

    public void requireAnyPermission(Principal principal, String... permissions) {
        enforce(principal, checkPermissions(principal, Arrays.asList(permissions), false));
    }

    public void requireRoles(Principal principal, String... roles) {
        enforce(principal, checkRoles(principal, Arrays.asList(roles), true));
    }

    public void requireAnyRole(Principal principal, String... roles) {
        enforce(principal, checkRoles(principal, Arrays.asList(roles), false));
    }

    public void authorize(Principal principal, AccessRequirement requirement, Object resource, AccessContext context) {
        enforce(principal, evaluate(principal, requirement, resource, context));
    }

    /**
     * Records and logs {@code decision}, then throws if it is a denial.
     *
     * @throws ForbiddenException if access was denied
     */
    public void enforce(Principal principal, AccessDecision decision) {
        if (decision.granted()) {
            if (decision.adminBypass()) {
                log.debug("Access granted to {} via system admin bypass", principal.subjectId());
            }
            return;
        }
        metrics.accessDenied(decision.reason().tag());
        log.warn("Access denied for {}: reason={}, missingPermissions={}, missingRoles={}",
                principal.subjectId(), decision.reason().tag(),
                decision.missingPermissions(), decision.missingRoles());
        decision.orElseThrow();
    }
}
