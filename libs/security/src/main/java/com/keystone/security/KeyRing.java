package com.keystone.security;

import com.keystone.observability.SecurityMetrics;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of the identity provider's signing keys, indexed by key id.
 *
 * <p>A lookup refreshes the whole key set when the cache is older than the TTL or does not know the
 * requested key id. Keys rotate as a set, so a refresh replaces the entire map rather than merging.
 *
 * <p>When a refresh fails the previous keys keep being served and a warning is logged. Only a
 * failure with nothing cached is fatal ({@link KeyProviderUnavailableException}).
 *
 * <p>Thread-safe. The published snapshot is replaced atomically; the refresh lock only prevents
 * concurrent callers from fetching the same key set twice.
 */
public final class KeyRing {

    private static final Logger log = LoggerFactory.getLogger(KeyRing.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

    private final KeySetFetcher fetcher;
    private final Duration ttl;
    private final Clock clock;
    private final SecurityMetrics metrics;
    private final ReentrantLock refreshLock = new ReentrantLock();

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public KeyRing(KeySetFetcher fetcher, Duration ttl, Clock clock, SecurityMetrics metrics) {
        if (fetcher == null) {
            throw new IllegalArgumentException("fetcher must not be null");
        }
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be null or negative");
        }
        this.fetcher = fetcher;
        this.ttl = ttl;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.metrics = metrics == null ? SecurityMetrics.noop() : metrics;
    }

    public KeyRing(KeySetFetcher fetcher) {
        this(fetcher, DEFAULT_TTL, Clock.systemUTC(), SecurityMetrics.noop());
    }

    /**
     * Returns the key for {@code kid}, refreshing the key set first if needed.
     *
     * @return the key, or empty if the provider does not publish it
     * @throws KeyProviderUnavailableException if a refresh fails and no keys are cached
     */
    public Optional<JWK> getKey(String kid) {
        if (kid == null || kid.isEmpty()) {
            return Optional.empty();
        }
        Snapshot observed = snapshot;
        if (!needsRefresh(observed, kid)) {
            return Optional.of(observed.keys().get(kid));
        }

        refreshLock.lock();
        try {
            Snapshot current = snapshot;
            // another caller refreshed while we waited: use its result
            if (current == observed) {
                current = refresh(current);
            }
            return Optional.ofNullable(current.keys().get(kid));
        } finally {
            refreshLock.unlock();
        }
    }

    /** Number of keys currently cached. */
    public int size() {
        return snapshot.keys().size();
    }

    /** Time of the last successful refresh, or empty if none has succeeded. */
    public Optional<Instant> lastRefreshed() {
        return Optional.ofNullable(snapshot.fetchedAt());
    }

    private boolean needsRefresh(Snapshot s, String kid) {
        if (s.fetchedAt() == null) {
            return true;
        }
        Duration age = Duration.between(s.fetchedAt(), clock.instant());
        return age.compareTo(ttl) > 0 || !s.keys().containsKey(kid);
    }

    private Snapshot refresh(Snapshot previous) {
        JWKSet keySet;
        try {
            keySet = fetcher.fetch();
        } catch (IOException | RuntimeException e) {
            metrics.keySetRefresh(false);
            if (previous.keys().isEmpty()) {
                log.error("JWKS refresh failed with no cached keys: {}", e.getMessage());
                throw new KeyProviderUnavailableException("Signing keys are unavailable", e);
            }
            log.warn("JWKS refresh failed, serving {} cached keys: {}", previous.keys().size(), e.getMessage());
            return previous;
        }

        Map<String, JWK> keys = new HashMap<>();
        for (JWK key : keySet.getKeys()) {
            if (key.getKeyID() != null) {
                keys.put(key.getKeyID(), key);
            }
        }
        Snapshot next = new Snapshot(Map.copyOf(keys), clock.instant());
        snapshot = next;
        metrics.keySetRefresh(true);
        log.info("JWKS refreshed: {} keys", keys.size());
        return next;
    }

    private record Snapshot(Map<String, JWK> keys, Instant fetchedAt) {
        static final Snapshot EMPTY = new Snapshot(Map.of(), null);
    }
}
