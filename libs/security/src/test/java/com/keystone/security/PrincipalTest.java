package com.keystone.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.security.testing.TestPrincipalFactory;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Principal")
class PrincipalTest {

    @Test
    @DisplayName("should recognise both admin roles")
    void shouldRecogniseAdminRoles() {
        assertThat(TestPrincipalFactory.create("u", null, Set.of(), Set.of("super_admin")).isSystemAdmin()).isTrue();
        assertThat(TestPrincipalFactory.systemAdmin("u", null).isSystemAdmin()).isTrue();
        assertThat(TestPrincipalFactory.member("u", "org-1").isSystemAdmin()).isFalse();
    }

    @Test
    @DisplayName("should evaluate permission helpers as plain set membership")
    void shouldCheckPermissions() {
        Principal principal = TestPrincipalFactory.member("u", "org-1", "read:teams", "write:teams");

        assertThat(principal.hasPermission("read:teams")).isTrue();
        assertThat(principal.hasAnyPermission("delete:teams", "write:teams")).isTrue();
        assertThat(principal.hasAllPermissions("read:teams", "delete:teams")).isFalse();
        assertThat(principal.hasRole("member")).isTrue();
    }

    @Test
    @DisplayName("toString should not leak the raw token")
    void toStringShouldHideToken() {
        Principal principal = TestPrincipalFactory.member("u", "org-1");

        assertThat(principal.toString()).doesNotContain(TestPrincipalFactory.DEFAULT_TOKEN);
    }

    @Test
    @DisplayName("validator should require verified email when asked")
    void validatorShouldCheckEmail() {
        Principal unverified = TestPrincipalFactory.withMetadata("u", "org-1", null, null);

        assertThat(PrincipalValidator.validate(unverified).valid()).isTrue();
        assertThat(PrincipalValidator.validate(unverified, true).errors()).containsExactly("email must be verified");
    }
}
