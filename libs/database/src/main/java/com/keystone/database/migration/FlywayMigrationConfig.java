package com.keystone.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Runs the Keystone schema migrations against the application's {@link DataSource}.
 *
 * <p>Applications importing this configuration exclude Spring Boot's
 * {@code FlywayAutoConfiguration} so the schema is migrated exactly once:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = FlywayAutoConfiguration.class)
 * }</pre>
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(prefix = "keystone.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayMigrationConfig {

    public static final String KEYSTONE_FLYWAY_BEAN = "keystoneFlyway";

    @Bean(name = KEYSTONE_FLYWAY_BEAN, initMethod = "migrate")
    public Flyway keystoneFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return createFlyway(dataSource, properties);
    }

    @Bean
    public MigrationService migrationService(Flyway keystoneFlyway) {
        return new MigrationService(keystoneFlyway);
    }

    /** Flyway for {@code dataSource}; clean is always disabled. */
    public static Flyway createFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().split("\\s*,\\s*"))
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
