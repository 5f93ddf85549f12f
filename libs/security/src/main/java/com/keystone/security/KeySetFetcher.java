package com.keystone.security;

import com.nimbusds.jose.jwk.JWKSet;
import java.io.IOException;

/** Source of the identity provider's published signing key set. */
@FunctionalInterface
public interface KeySetFetcher {

    /**
     * Fetches the complete current key set.
     *
     * @throws IOException if the key set cannot be retrieved or parsed
     */
    JWKSet fetch() throws IOException;
}
