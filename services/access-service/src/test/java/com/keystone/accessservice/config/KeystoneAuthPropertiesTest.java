package com.keystone.accessservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KeystoneAuthProperties")
class KeystoneAuthPropertiesTest {

    @Test
    @DisplayName("derives issuer, namespace and timing defaults from domain and audience")
    void appliesDefaults() {
        var props = new KeystoneAuthProperties(
                "tenant.eu.auth0.com", "https://api.example.com", null, null, null, null, null, null);

        assertThat(props.issuer()).isEqualTo("https://tenant.eu.auth0.com/");
        assertThat(props.namespace()).isEqualTo("https://api.example.com");
        assertThat(props.clockTolerance()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.jwksCacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(props.jwksFetchTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.overrideHeader()).isEqualTo("X-Organization-Override");
    }

    @Test
    @DisplayName("keeps explicitly configured values")
    void keepsExplicitValues() {
        var props = new KeystoneAuthProperties("tenant.eu.auth0.com", "https://api.example.com",
                "https://issuer.example.com/", "https://claims.example.com", Duration.ofSeconds(5),
                Duration.ofMinutes(10), Duration.ofSeconds(2), "X-Tenant");

        assertThat(props.issuer()).isEqualTo("https://issuer.example.com/");
        assertThat(props.namespace()).isEqualTo("https://claims.example.com");
        assertThat(props.clockTolerance()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.jwksCacheTtl()).isEqualTo(Duration.ofMinutes(10));
        assertThat(props.jwksFetchTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.overrideHeader()).isEqualTo("X-Tenant");
    }

    @Test
    @DisplayName("serves the key set from the well-known path of the domain")
    void jwksUrl() {
        var props = new KeystoneAuthProperties(
                "tenant.eu.auth0.com", "https://api.example.com", null, null, null, null, null, null);

        assertThat(props.jwksUrl()).isEqualTo("https://tenant.eu.auth0.com/.well-known/jwks.json");
    }
}
