package com.keystone.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.security.Principal;
import com.keystone.security.testing.TestPrincipalFactory;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEvent")
class AuditEventTest {

    private final Principal alice = TestPrincipalFactory.member("auth0|alice", "org-1");

    @Test
    @DisplayName("should default severity, outcome, actor and target")
    void defaults() {
        AuditEvent event = AuditEvent.of(AuditEventType.ORG_UPDATED, null, "org-1", null);

        assertThat(event.severity()).isEqualTo(AuditSeverity.INFO);
        assertThat(event.outcome()).isEqualTo(AuditOutcome.SUCCESS);
        assertThat(event.actor()).isEqualTo(AuditActor.NONE);
        assertThat(event.target()).isEqualTo(AuditTarget.NONE);
        assertThat(event.metadata()).isEmpty();
    }

    @Test
    @DisplayName("failed authentication should be a warning with failure outcome")
    void failedAuthentication() {
        AuditEvent event = AuditEvent.authentication(AuditEventType.AUTH_LOGIN_FAILED, alice, false, "1.2.3.4", "ua");

        assertThat(event.severity()).isEqualTo(AuditSeverity.WARNING);
        assertThat(event.outcome()).isEqualTo(AuditOutcome.FAILURE);
        assertThat(event.actor().ip()).isEqualTo("1.2.3.4");
        assertThat(event.target()).isEqualTo(AuditTarget.user("auth0|alice", "auth0|alice@example.com"));
        assertThat(event.organizationId()).isEqualTo("org-1");
    }

    @Test
    @DisplayName("admin override should land in the target organization")
    void adminOverride() {
        Principal root = TestPrincipalFactory.systemAdmin("auth0|root", "org-0");

        AuditEvent event = AuditEvent.adminOverride(root, "org-0", "org-42", "GET", "/api/v1/teams");

        assertThat(event.organizationId()).isEqualTo("org-42");
        assertThat(event.severity()).isEqualTo(AuditSeverity.NOTICE);
        assertThat(event.metadata()).containsEntry("original_organization_id", "org-0")
                .containsEntry("path", "/api/v1/teams");
    }

    @Test
    @DisplayName("should require an event type")
    void requiresType() {
        assertThatThrownBy(() -> AuditEvent.of(null, null, null, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("event types should expose category and parse from value")
    void eventTypes() {
        assertThat(AuditEventType.TEAM_MEMBER_ADDED.category()).isEqualTo("team");
        assertThat(AuditEventType.fromValue("auth.mfa.enrolled")).isEqualTo(AuditEventType.AUTH_MFA_ENROLLED);
        assertThat(AuditEventType.inCategories(Set.of("access")))
                .containsExactlyInAnyOrder(AuditEventType.ACCESS_DENIED, AuditEventType.ACCESS_GRANTED);
        assertThatThrownBy(() -> AuditEventType.fromValue("auth.unknown")).isInstanceOf(IllegalArgumentException.class);
    }
}
