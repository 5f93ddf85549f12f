package com.keystone.security;

import java.util.Optional;

/**
 * Capability of a resource that may belong to an organization. Resources returning empty are
 * global and visible to every tenant.
 */
public interface OrganizationScoped {

    Optional<String> organization();
}
