package com.keystone.security;

import java.util.Optional;

/**
 * Capability of a resource that records who owns it. Ownership is resolved in the order
 * {@link #userId()}, {@link #ownerId()}, {@link #createdBy()}; the first present value wins.
 */
public interface OwnedResource {

    default Optional<String> userId() {
        return Optional.empty();
    }

    default Optional<String> ownerId() {
        return Optional.empty();
    }

    default Optional<String> createdBy() {
        return Optional.empty();
    }

    /** The effective owner, or empty if the resource records none. */
    default Optional<String> effectiveOwner() {
        return userId().or(this::ownerId).or(this::createdBy);
    }
}
