package com.keystone.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.observability.SecurityMetrics;
import com.keystone.security.testing.TestTokenIssuer;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("KeyRing")
class KeyRingTest {

    private static final TestTokenIssuer KEY_ONE = new TestTokenIssuer("kid1");
    private static final TestTokenIssuer KEY_TWO = new TestTokenIssuer("kid2");

    private MutableClock clock;
    private CountingFetcher fetcher;
    private SimpleMeterRegistry registry;
    private KeyRing keyRing;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-15T10:00:00Z"));
        fetcher = new CountingFetcher();
        fetcher.respondWith(keySet(KEY_ONE, KEY_TWO));
        registry = new SimpleMeterRegistry();
        keyRing = new KeyRing(fetcher, Duration.ofHours(1), clock, new SecurityMetrics(registry, "test"));
    }

    @Nested
    @DisplayName("caching")
    class Caching {

        @Test
        @DisplayName("should serve every key of one fetch without refetching within TTL")
        void shouldServeFromCache() {
            assertThat(keyRing.getKey("kid1")).isPresent();
            assertThat(keyRing.getKey("kid2")).isPresent();
            assertThat(keyRing.getKey("kid1")).isPresent();

            assertThat(fetcher.calls()).isEqualTo(1);
            assertThat(keyRing.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("should refresh exactly once after TTL elapses")
        void shouldRefreshAfterTtl() {
            keyRing.getKey("kid1");
            clock.advance(Duration.ofHours(1).plusSeconds(1));

            keyRing.getKey("kid1");
            keyRing.getKey("kid2");

            assertThat(fetcher.calls()).isEqualTo(2);
        }

        @Test
        @DisplayName("should refresh on unknown kid and replace the whole set")
        void shouldRefreshOnUnknownKid() {
            keyRing.getKey("kid1");
            TestTokenIssuer rotated = new TestTokenIssuer("kid3");
            fetcher.respondWith(keySet(rotated));

            assertThat(keyRing.getKey("kid3")).isPresent();
            assertThat(fetcher.calls()).isEqualTo(2);
            // kid1 was rotated out; looking it up triggers another refresh and still misses
            assertThat(keyRing.getKey("kid1")).isEmpty();
            assertThat(keyRing.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should return empty for null kid without fetching")
        void shouldIgnoreNullKid() {
            assertThat(keyRing.getKey(null)).isEmpty();
            assertThat(fetcher.calls()).isZero();
        }
    }

    @Nested
    @DisplayName("refresh failures")
    class RefreshFailures {

        @Test
        @DisplayName("should keep serving stale keys when refresh fails")
        void shouldServeStaleKeys() {
            keyRing.getKey("kid1");
            clock.advance(Duration.ofHours(2));
            fetcher.failWith(new IOException("connect timed out"));

            assertThat(keyRing.getKey("kid1")).map(JWK::getKeyID).contains("kid1");
            assertThat(registry.get("keystone.auth.jwks.refreshes").tag("outcome", "failure").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fail hard when nothing is cached")
        void shouldFailWhenCold() {
            fetcher.failWith(new IOException("connection refused"));

            assertThatThrownBy(() -> keyRing.getKey("kid1"))
                    .isInstanceOf(KeyProviderUnavailableException.class)
                    .satisfies(e -> assertThat(((KeystoneException) e).errorCode())
                            .isEqualTo(ErrorCode.KEY_PROVIDER_UNAVAILABLE));
        }

        @Test
        @DisplayName("should recover once the provider is back")
        void shouldRecover() {
            fetcher.failWith(new IOException("down"));
            assertThatThrownBy(() -> keyRing.getKey("kid1")).isInstanceOf(KeyProviderUnavailableException.class);

            fetcher.respondWith(keySet(KEY_ONE));

            assertThat(keyRing.getKey("kid1")).isPresent();
            assertThat(keyRing.lastRefreshed()).contains(clock.instant());
        }
    }

    @Test
    @DisplayName("should reject negative TTL")
    void shouldRejectNegativeTtl() {
        assertThatThrownBy(() -> new KeyRing(fetcher, Duration.ofSeconds(-1), clock, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ttl");
    }

    private static JWKSet keySet(TestTokenIssuer... issuers) {
        List<JWK> keys = new ArrayList<>();
        for (TestTokenIssuer issuer : issuers) {
            keys.addAll(issuer.publicKeySet().getKeys());
        }
        return new JWKSet(keys);
    }

    private static final class CountingFetcher implements KeySetFetcher {

        private final AtomicInteger calls = new AtomicInteger();
        private JWKSet response;
        private IOException failure;

        void respondWith(JWKSet keySet) {
            this.response = keySet;
            this.failure = null;
        }

        void failWith(IOException e) {
            this.failure = e;
        }

        int calls() {
            return calls.get();
        }

        @Override
        public JWKSet fetch() throws IOException {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return response;
        }
    }
}
