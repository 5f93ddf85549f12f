package com.keystone.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SensitiveDataRedactor")
class SensitiveDataRedactorTest {

    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();

    @Nested
    @DisplayName("isSensitive")
    class IsSensitive {

        @Test
        @DisplayName("should match default patterns ignoring case and separators")
        void shouldMatchDefaults() {
            assertThat(redactor.isSensitive("password")).isTrue();
            assertThat(redactor.isSensitive("Authorization")).isTrue();
            assertThat(redactor.isSensitive("X-Api-Key")).isTrue();
            assertThat(redactor.isSensitive("refresh_token")).isTrue();
            assertThat(redactor.isSensitive("client_secret")).isTrue();
        }

        @Test
        @DisplayName("should not match ordinary keys")
        void shouldNotMatchOrdinaryKeys() {
            assertThat(redactor.isSensitive("name")).isFalse();
            assertThat(redactor.isSensitive("email")).isFalse();
            assertThat(redactor.isSensitive(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("redact")
    class Redact {

        @Test
        @DisplayName("should redact nested maps and lists without touching the input")
        void shouldRedactNested() {
            Map<String, Object> input = Map.of(
                    "name", "Platform",
                    "settings", Map.of("apiKey", "abc", "region", "eu"),
                    "members", List.of(Map.of("id", "u1", "password", "hunter2")));

            Map<String, Object> result = redactor.redact(input);

            assertThat(result).containsEntry("name", "Platform");
            assertThat(result.get("settings"))
                    .isEqualTo(Map.of("apiKey", SensitiveDataRedactor.REDACTED, "region", "eu"));
            assertThat(result.get("members"))
                    .isEqualTo(List.of(Map.of("id", "u1", "password", SensitiveDataRedactor.REDACTED)));
            assertThat(((Map<?, ?>) input.get("settings")).get("apiKey")).isEqualTo("abc");
        }

        @Test
        @DisplayName("should return empty map for null input")
        void shouldHandleNull() {
            assertThat(redactor.redact(null)).isEmpty();
        }

        @Test
        @DisplayName("should honour custom patterns")
        void shouldUseCustomPatterns() {
            SensitiveDataRedactor custom = new SensitiveDataRedactor(Set.of("ssn"));

            assertThat(custom.redact(Map.of("ssn", "123", "password", "x")))
                    .containsEntry("ssn", SensitiveDataRedactor.REDACTED)
                    .containsEntry("password", "x");
        }

        @Test
        @DisplayName("should reject empty pattern set")
        void shouldRejectEmptyPatterns() {
            assertThatThrownBy(() -> new SensitiveDataRedactor(Set.of()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
