package com.keystone.accessservice;

import com.keystone.accessservice.config.KeystoneAuthProperties;
import com.keystone.accessservice.config.KeystoneServiceProperties;
import com.keystone.database.migration.FlywayMigrationConfig;
import com.keystone.database.migration.MigrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Keystone access service: authenticated, tenant-scoped REST API over teams, the audit trail and
 * compliance reporting.
 *
 * <ul>
 *   <li>bearer tokens validated against the identity provider's JWKS
 *   <li>organization isolation with audited administrator overrides
 *   <li>hash-chained audit ledger on PostgreSQL, schema managed by Flyway
 *   <li>RFC 7807 error responses carrying the correlation id
 * </ul>
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties({KeystoneServiceProperties.class, KeystoneAuthProperties.class})
@Import(FlywayMigrationConfig.class)
public class AccessServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AccessServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AccessServiceApplication.class, args);
        log.info("Keystone access service started successfully");
    }

    @Bean
    ApplicationRunner schemaStatusReporter(ObjectProvider<MigrationService> migrations) {
        return args -> migrations.ifAvailable(service -> {
            MigrationService.SchemaStatus status = service.status();
            log.info("Database schema at version {} ({} applied, {} pending)",
                    status.currentVersion(), status.appliedMigrations(), status.pendingMigrations());
        });
    }
}
