package com.keystone.database.migration;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Schema migration settings, bound from {@code keystone.flyway}.
 *
 * <pre>{@code
 * keystone:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration
 *     baseline-on-migrate: true
 * }</pre>
 *
 * @param enabled           whether migrations run at startup
 * @param locations         comma-separated Flyway locations
 * @param baselineOnMigrate baseline a non-empty schema that has no history table
 */
@Validated
@ConfigurationProperties(prefix = "keystone.flyway")
public record FlywayConfigProperties(boolean enabled, @NotBlank String locations, boolean baselineOnMigrate) {

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration";

    public FlywayConfigProperties {
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
    }

    public static FlywayConfigProperties defaults() {
        return new FlywayConfigProperties(true, DEFAULT_LOCATIONS, true);
    }
}
