package com.keystone.accessservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.audit.AuditLedger;
import com.keystone.audit.AuditStore;
import com.keystone.compliance.ComplianceScorer;
import com.keystone.compliance.ControlCatalog;
import com.keystone.compliance.UserDirectory;
import com.keystone.database.audit.JdbcAuditStore;
import com.keystone.database.user.JdbcUserDirectory;
import com.keystone.observability.SecurityMetrics;
import com.keystone.observability.SensitiveDataRedactor;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/** Audit ledger on the JDBC store, and the compliance scorer reading from it. */
@Configuration
public class AuditConfig {

    @Bean
    public AuditStore auditStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager, ObjectMapper mapper) {
        return new JdbcAuditStore(jdbc, transactionManager, mapper);
    }

    @Bean
    public AuditLedger auditLedger(AuditStore store, SecurityMetrics metrics, Clock clock) {
        return new AuditLedger(store, new SensitiveDataRedactor(), metrics, clock);
    }

    @Bean
    public ControlCatalog controlCatalog(ObjectMapper mapper) {
        return ControlCatalog.load(ControlCatalog.DEFAULT_RESOURCE, mapper);
    }

    @Bean
    public UserDirectory userDirectory(JdbcTemplate jdbc) {
        return new JdbcUserDirectory(jdbc);
    }

    @Bean
    public ComplianceScorer complianceScorer(
            AuditLedger ledger, ControlCatalog catalog, UserDirectory users, Clock clock) {
        return new ComplianceScorer(ledger, catalog, users, clock);
    }
}
