package com.keystone.accessservice.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.audit.AuditEventType;
import com.keystone.audit.AuditLedger;
import com.keystone.audit.AuditQuery;
import com.keystone.audit.testing.InMemoryAuditStore;
import com.keystone.security.AccessController;
import com.keystone.security.ForbiddenException;
import com.keystone.security.OrgFilter;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.Permissions;
import com.keystone.security.Principal;
import com.keystone.security.TenantScope;
import com.keystone.security.testing.TestPrincipalFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PermissionGuard")
class PermissionGuardTest {

    private final InMemoryAuditStore auditStore = new InMemoryAuditStore();
    private final PermissionGuard guard = new PermissionGuard(new AccessController(), new AuditLedger(auditStore));

    private static OrgScopedQuery scopedFor(Principal principal) {
        return TenantScope.scopedQuery(principal, TenantScope.resolve(principal, null));
    }

    @Test
    @DisplayName("lets a caller holding every permission through without auditing")
    void granted() {
        var scoped = scopedFor(TestPrincipalFactory.member("u1", "org-1", Permissions.READ_TEAMS));

        assertThatCode(() -> guard.require(scoped, "team", Permissions.READ_TEAMS)).doesNotThrowAnyException();
        assertThat(auditStore.size()).isZero();
    }

    @Test
    @DisplayName("audits and rejects a caller missing a permission")
    void denied() {
        var scoped = scopedFor(TestPrincipalFactory.member("u1", "org-1", Permissions.READ_TEAMS));

        assertThatThrownBy(() -> guard.require(scoped, "team", Permissions.READ_TEAMS, Permissions.WRITE_TEAMS))
                .isInstanceOfSatisfying(ForbiddenException.class, ex ->
                        assertThat(ex.missingPermissions()).containsExactly(Permissions.WRITE_TEAMS));

        assertThat(auditStore.find(AuditQuery.scoped(OrgFilter.organization("org-1", false)), 0, 10))
                .singleElement()
                .satisfies(record -> {
                    assertThat(record.eventType()).isEqualTo(AuditEventType.ACCESS_DENIED);
                    assertThat(record.actor().id()).isEqualTo("u1");
                    assertThat(record.target().type()).isEqualTo("team");
                    assertThat(record.description()).isEqualTo("Missing permissions [write:teams]");
                });
    }

    @Test
    @DisplayName("lets a system administrator through without explicit permissions")
    void adminBypass() {
        var scoped = scopedFor(TestPrincipalFactory.systemAdmin("admin-1", "org-1"));

        assertThatCode(() -> guard.require(scoped, "audit_log", Permissions.READ_AUDIT_LOGS))
                .doesNotThrowAnyException();
        assertThat(auditStore.size()).isZero();
    }
}
