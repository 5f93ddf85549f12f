package com.keystone.security;

import com.nimbusds.jwt.JWTClaimsSet;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Maps validated token claims to a {@link Principal}.
 *
 * <p>Standard claims ({@code email}, {@code name}, {@code org_id}, {@code permissions}, ...) are read
 * from the top level first and fall back to {@code "{namespace}/{claim}"}. Roles and metadata only
 * exist as namespaced custom claims. A value counts as present when it is non-null and not an empty
 * string or list.
 *
 * <p>{@code permissions} and {@code roles} must be JSON arrays; any other value is read as empty.
 * A missing {@code sub} yields an empty subject, which {@link PrincipalValidator} rejects.
 */
public final class IdentityExtractor {

    private final String namespace;

    /**
     * @param namespace custom claim prefix, e.g. {@code https://api.example.com}
     */
    public IdentityExtractor(String namespace) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be null or blank");
        }
        this.namespace = namespace.endsWith("/") ? namespace.substring(0, namespace.length() - 1) : namespace;
    }

    public Principal extract(JWTClaimsSet claims, String token) {
        Map<String, Object> all = claims.getClaims();

        String subject = claims.getSubject();
        boolean emailVerified = isTrue(all.get("email_verified")) || isTrue(all.get(ns("email_verified")));

        return new Principal(
                subject == null ? "" : subject,
                string(all, "email"),
                emailVerified,
                string(all, "name"),
                string(all, "nickname"),
                string(all, "picture"),
                string(all, "org_id"),
                permissions(all),
                stringSet(all.get(ns("roles"))),
                map(all.get(ns("app_metadata"))),
                map(all.get(ns("user_metadata"))),
                token);
    }

    /** The fully qualified name of a namespaced claim. */
    public String ns(String claim) {
        return namespace + "/" + claim;
    }

    private Set<String> permissions(Map<String, Object> claims) {
        Set<String> top = stringSet(claims.get("permissions"));
        return top.isEmpty() ? stringSet(claims.get(ns("permissions"))) : top;
    }

    private String string(Map<String, Object> claims, String name) {
        Object value = preferred(claims, name);
        return value == null ? null : value.toString();
    }

    private Object preferred(Map<String, Object> claims, String name) {
        Object top = claims.get(name);
        return isPresent(top) ? top : claims.get(ns(name));
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        return true;
    }

    private static boolean isTrue(Object value) {
        return value instanceof Boolean b && b;
    }

    private static Set<String> stringSet(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return Set.of();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object item : items) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }

    private static Map<String, Object> map(Object value) {
        if (!(value instanceof Map<?, ?> source)) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
