package com.keystone.database;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keystone.audit.AuditEventType;
import com.keystone.database.audit.AuditStorageCodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StorageCodes")
class StorageCodesTest {

    enum Color {
        RED,
        GREEN
    }

    @Nested
    @DisplayName("Building")
    class Building {

        @Test
        @DisplayName("should reject a mapping that leaves a constant unmapped")
        void shouldRequireEveryConstant() {
            assertThatThrownBy(() -> StorageCodes.builder(Color.class, 1).map(Color.RED, "red").build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Color.GREEN");
        }

        @Test
        @DisplayName("should reject a code used twice")
        void shouldRejectDuplicateCode() {
            assertThatThrownBy(() -> StorageCodes.builder(Color.class, 1)
                    .map(Color.RED, "c")
                    .map(Color.GREEN, "c"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'c'");
        }

        @Test
        @DisplayName("should reject mapping a constant twice")
        void shouldRejectDuplicateConstant() {
            assertThatThrownBy(() -> StorageCodes.builder(Color.class, 1)
                    .map(Color.RED, "red")
                    .map(Color.RED, "rouge"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        private final StorageCodes<Color> codes = StorageCodes.builder(Color.class, 2)
                .map(Color.RED, "red")
                .map(Color.GREEN, "green")
                .alias("verde", Color.GREEN)
                .build();

        @Test
        @DisplayName("should encode and decode mapped constants")
        void shouldMapBothWays() {
            assertThat(codes.encode(Color.GREEN)).isEqualTo("green");
            assertThat(codes.decode("red")).isEqualTo(Color.RED);
            assertThat(codes.encode(null)).isNull();
            assertThat(codes.decode(null)).isNull();
        }

        @Test
        @DisplayName("should decode retired aliases but never encode them")
        void shouldDecodeAliases() {
            assertThat(codes.decode("verde")).isEqualTo(Color.GREEN);
            assertThat(codes.encode(Color.GREEN)).isEqualTo("green");
        }

        @Test
        @DisplayName("should fail on unknown stored codes naming the mapping version")
        void shouldFailOnUnknownCode() {
            assertThatThrownBy(() -> codes.decode("blue"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("blue")
                    .hasMessageContaining("v2");
        }
    }

    @Test
    @DisplayName("audit event codes should match the published event type values")
    void auditEventCodesMatchPublishedValues() {
        for (AuditEventType type : AuditEventType.values()) {
            assertThat(AuditStorageCodes.EVENT_TYPES.encode(type)).isEqualTo(type.value());
        }
    }
}
