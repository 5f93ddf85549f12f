package com.keystone.security;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Attribute-based access predicate over principal, resource and request context.
 *
 * <p>Policies never throw and never apply the system-administrator bypass themselves; that is the
 * job of {@link AccessController}.
 */
@FunctionalInterface
public interface AbacPolicy {

    boolean test(Principal principal, Object resource, AccessContext context);

    /**
     * Passes when the resource has no organization, or its organization equals the request's
     * effective organization (the principal's own when no context is resolved).
     */
    static AbacPolicy sameOrganization() {
        return (principal, resource, context) -> {
            if (!(resource instanceof OrganizationScoped scoped)) {
                return true;
            }
            Optional<String> resourceOrg = scoped.organization();
            if (resourceOrg.isEmpty()) {
                return true;
            }
            String effective = context != null && context.orgContext() != null
                    ? context.orgContext().orgId()
                    : principal.organizationId();
            return resourceOrg.get().equals(effective);
        };
    }

    /** Passes only when the resource records an owner equal to the principal's subject. */
    static AbacPolicy ownedBy() {
        return (principal, resource, context) -> resource instanceof OwnedResource owned
                && owned.effectiveOwner().map(principal.subjectId()::equals).orElse(false);
    }

    /**
     * Passes when the principal's application metadata (or, if absent there, user metadata) holds
     * {@code name} equal to {@code value}.
     */
    static AbacPolicy hasAttribute(String name, Object value) {
        return (principal, resource, context) -> {
            Object actual = principal.appMetadata().get(name);
            if (actual == null) {
                actual = principal.userMetadata().get(name);
            }
            return Objects.equals(actual, value);
        };
    }

    static AbacPolicy all(AbacPolicy... policies) {
        List<AbacPolicy> list = List.of(policies);
        return (principal, resource, context) ->
                list.stream().allMatch(p -> p.test(principal, resource, context));
    }

    static AbacPolicy any(AbacPolicy... policies) {
        List<AbacPolicy> list = List.of(policies);
        return (principal, resource, context) ->
                list.stream().anyMatch(p -> p.test(principal, resource, context));
    }
}
