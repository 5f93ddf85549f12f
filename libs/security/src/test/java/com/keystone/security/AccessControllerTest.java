package com.keystone.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.observability.SecurityMetrics;
import com.keystone.security.testing.TestPrincipalFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AccessController")
class AccessControllerTest {

    private SimpleMeterRegistry registry;
    private AccessController controller;

    private final Principal reader = TestPrincipalFactory.member("u1", "org-1", Permissions.READ_TEAMS);
    private final Principal admin = TestPrincipalFactory.systemAdmin("root", "org-0");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        controller = new AccessController(new SecurityMetrics(registry, "test"));
    }

    @Nested
    @DisplayName("permissions")
    class PermissionChecks {

        @Test
        @DisplayName("should grant when all required permissions are held")
        void shouldGrantAll() {
            assertThat(controller.checkPermissions(reader, List.of(Permissions.READ_TEAMS), true).granted()).isTrue();
        }

        @Test
        @DisplayName("should report exactly the missing permissions")
        void shouldReportMissing() {
            AccessDecision decision = controller.checkPermissions(
                    reader, List.of(Permissions.READ_TEAMS, Permissions.WRITE_TEAMS), true);

            assertThat(decision.denied()).isTrue();
            assertThat(decision.reason()).isEqualTo(DenialReason.MISSING_PERMISSIONS);
            assertThat(decision.missingPermissions()).containsExactly(Permissions.WRITE_TEAMS);
        }

        @Test
        @DisplayName("should grant any-of when one permission is held")
        void shouldGrantAny() {
            assertThat(controller.checkPermissions(
                            reader, List.of(Permissions.WRITE_TEAMS, Permissions.READ_TEAMS), false)
                    .granted())
                    .isTrue();
            assertThat(controller.checkPermissions(
                            reader, List.of(Permissions.WRITE_TEAMS, Permissions.DELETE_TEAMS), false)
                    .granted())
                    .isFalse();
        }

        @Test
        @DisplayName("any-of should deny when a repeated requirement is not held")
        void shouldDenyRepeatedAnyOf() {
            AccessDecision decision = controller.checkPermissions(
                    reader, List.of(Permissions.WRITE_TEAMS, Permissions.WRITE_TEAMS), false);

            assertThat(decision.denied()).isTrue();
            assertThat(decision.missingPermissions()).containsExactly(Permissions.WRITE_TEAMS);
            assertThatThrownBy(() -> controller.requireAnyPermission(
                            reader, Permissions.WRITE_TEAMS, Permissions.WRITE_TEAMS))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("system admin should pass disjoint requirements")
        void adminShouldBypass() {
            AccessDecision decision = controller.checkPermissions(
                    admin, List.of(Permissions.DELETE_ORGANIZATIONS, Permissions.EXPORT_AUDIT_LOGS), true);

            assertThat(decision.granted()).isTrue();
            assertThat(decision.adminBypass()).isTrue();
            controller.requirePermissions(admin, Permissions.SYSTEM_ADMIN);
        }
    }

    @Nested
    @DisplayName("roles")
    class RoleChecks {

        @Test
        @DisplayName("should require all or any roles")
        void shouldCheckRoles() {
            assertThat(controller.checkRoles(reader, List.of("member", "org_admin"), true).missingRoles())
                    .containsExactly("org_admin");
            assertThat(controller.checkRoles(reader, List.of("member", "org_admin"), false).granted()).isTrue();
        }

        @Test
        @DisplayName("any-of roles should deny when a repeated role is not held")
        void shouldDenyRepeatedAnyRole() {
            assertThat(controller.checkRoles(reader, List.of("org_admin", "org_admin"), false).denied()).isTrue();
            assertThat(controller.checkRoles(reader, List.of("org_admin", "member", "member"), false).granted())
                    .isTrue();
        }

        @Test
        @DisplayName("requireRoles should throw with missing roles")
        void shouldThrowForMissingRole() {
            assertThatThrownBy(() -> controller.requireRoles(reader, "org_admin"))
                    .isInstanceOf(ForbiddenException.class)
                    .satisfies(e -> assertThat(((ForbiddenException) e).missingRoles()).containsExactly("org_admin"));
        }
    }

    @Nested
    @DisplayName("attribute policies")
    class Policies {

        @Test
        @DisplayName("sameOrganization should pass global resources and matching orgs only")
        void sameOrganization() {
            AbacPolicy policy = AbacPolicy.sameOrganization();

            assertThat(policy.test(reader, new Doc(null, null), AccessContext.empty())).isTrue();
            assertThat(policy.test(reader, new Doc("org-1", null), AccessContext.empty())).isTrue();
            assertThat(policy.test(reader, new Doc("org-2", null), AccessContext.empty())).isFalse();
            assertThat(policy.test(reader, new Doc("org-2", null), AccessContext.of(OrgContext.of("org-2"))))
                    .isTrue();
            assertThat(policy.test(reader, "no capability", AccessContext.empty())).isTrue();
        }

        @Test
        @DisplayName("ownedBy should never assume ownership")
        void ownedBy() {
            AbacPolicy policy = AbacPolicy.ownedBy();

            assertThat(policy.test(reader, new Doc("org-1", "u1"), AccessContext.empty())).isTrue();
            assertThat(policy.test(reader, new Doc("org-1", "u2"), AccessContext.empty())).isFalse();
            assertThat(policy.test(reader, new Doc("org-1", null), AccessContext.empty())).isFalse();
            assertThat(policy.test(admin, new Doc("org-1", null), AccessContext.empty())).isFalse();
            assertThat(policy.test(reader, "no capability", AccessContext.empty())).isFalse();
        }

        @Test
        @DisplayName("ownedBy should honour user, owner, creator priority")
        void ownedByPriority() {
            OwnedResource resource = new OwnedResource() {
                @Override
                public Optional<String> ownerId() {
                    return Optional.of("u2");
                }

                @Override
                public Optional<String> createdBy() {
                    return Optional.of("u1");
                }
            };

            assertThat(AbacPolicy.ownedBy().test(reader, resource, AccessContext.empty())).isFalse();
        }

        @Test
        @DisplayName("hasAttribute should read app metadata before user metadata")
        void hasAttribute() {
            Principal principal = TestPrincipalFactory.withMetadata(
                    "u3", "org-1", Map.of("department", "security"), Map.of("department", "sales", "tier", "gold"));

            assertThat(AbacPolicy.hasAttribute("department", "security").test(principal, null, null)).isTrue();
            assertThat(AbacPolicy.hasAttribute("department", "sales").test(principal, null, null)).isFalse();
            assertThat(AbacPolicy.hasAttribute("tier", "gold").test(principal, null, null)).isTrue();
        }

        @Test
        @DisplayName("combinators should compose conjunctively and disjunctively")
        void combinators() {
            Doc foreignOwned = new Doc("org-2", "u1");
            AccessContext ctx = AccessContext.empty();

            assertThat(AbacPolicy.all(AbacPolicy.sameOrganization(), AbacPolicy.ownedBy()).test(reader, foreignOwned, ctx))
                    .isFalse();
            assertThat(AbacPolicy.any(AbacPolicy.sameOrganization(), AbacPolicy.ownedBy()).test(reader, foreignOwned, ctx))
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("composite requirement")
    class Composite {

        private final AccessRequirement requirement =
                AccessRequirement.allOf(Permissions.READ_TEAMS).withPolicies(AbacPolicy.sameOrganization());

        @Test
        @DisplayName("should skip policies when no resource is supplied")
        void shouldSkipPoliciesWithoutResource() {
            assertThat(controller.evaluate(reader, requirement, null, AccessContext.empty()).granted()).isTrue();
        }

        @Test
        @DisplayName("should deny by policy for a foreign resource")
        void shouldDenyByPolicy() {
            AccessDecision decision = controller.evaluate(reader, requirement, new Doc("org-2", null), AccessContext.empty());

            assertThat(decision.reason()).isEqualTo(DenialReason.POLICY_DENIED);
        }

        @Test
        @DisplayName("should let system admin through without evaluating policies")
        void adminBypassesPolicies() {
            AbacPolicy exploding = (p, r, c) -> {
                throw new AssertionError("policy must not be evaluated");
            };

            AccessDecision decision = controller.evaluate(
                    admin, AccessRequirement.allOf().withPolicies(exploding), new Doc("org-9", null), null);

            assertThat(decision.adminBypass()).isTrue();
        }

        @Test
        @DisplayName("authorize should throw and count the denial")
        void authorizeShouldThrow() {
            assertThatThrownBy(() -> controller.authorize(
                            reader, AccessRequirement.anyOf(Permissions.WRITE_TEAMS), null, null))
                    .isInstanceOf(ForbiddenException.class)
                    .satisfies(e -> assertThat(((ForbiddenException) e).missingPermissions())
                            .containsExactly(Permissions.WRITE_TEAMS));

            assertThat(registry.get("keystone.access.denials").tag("reason", "missing_permissions").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should require roles with any-of semantics")
        void shouldCombineRoles() {
            AccessRequirement roleRequirement =
                    new AccessRequirement(Set.of(), true, Set.of(), true, List.of()).withRoles(false, "member", "owner");

            assertThat(controller.evaluate(reader, roleRequirement, null, null).granted()).isTrue();
        }
    }

    private record Doc(String org, String owner) implements OrganizationScoped, OwnedResource {

        @Override
        public Optional<String> organization() {
            return Optional.ofNullable(org);
        }

        @Override
        public Optional<String> ownerId() {
            return Optional.ofNullable(owner);
        }
    }
}
