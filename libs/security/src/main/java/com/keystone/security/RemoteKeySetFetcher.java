package com.keystone.security;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.nimbusds.jose.util.Resource;
import java.io.IOException;
import java.net.URL;
import java.text.ParseException;
import java.time.Duration;

/**
 * Fetches a JWKS document over HTTP with connect and read timeouts bounded independently of the
 * request that triggered the fetch.
 */
public final class RemoteKeySetFetcher implements KeySetFetcher {

    private static final int SIZE_LIMIT_BYTES = 256 * 1024;

    private final URL jwksUrl;
    private final DefaultResourceRetriever retriever;

    public RemoteKeySetFetcher(URL jwksUrl, Duration timeout) {
        if (jwksUrl == null) {
            throw new IllegalArgumentException("jwksUrl must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        int millis = Math.toIntExact(timeout.toMillis());
        this.jwksUrl = jwksUrl;
        this.retriever = new DefaultResourceRetriever(millis, millis, SIZE_LIMIT_BYTES);
    }

    @Override
    public JWKSet fetch() throws IOException {
        Resource resource = retriever.retrieveResource(jwksUrl);
        try {
            return JWKSet.parse(resource.getContent());
        } catch (ParseException e) {
            throw new IOException("Malformed key set document from " + jwksUrl, e);
        }
    }

    public URL jwksUrl() {
        return jwksUrl;
    }
}
