package com.keystone.security;

import java.util.Map;

/**
 * Request-level inputs to attribute policies besides the principal and the resource.
 *
 * @param orgContext resolved organization of the request (nullable)
 * @param attributes free-form request attributes
 */
public record AccessContext(OrgContext orgContext, Map<String, Object> attributes) {

    public AccessContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static AccessContext of(OrgContext orgContext) {
        return new AccessContext(orgContext, Map.of());
    }

    public static AccessContext empty() {
        return new AccessContext(null, Map.of());
    }
}
