/**
 * Relational persistence for the Keystone platform.
 *
 * <p>Schema changes are Flyway migrations under {@code classpath:db/migration}. Stores are plain
 * {@link org.springframework.jdbc.core.JdbcTemplate} implementations of the SPIs declared by the
 * domain libraries:
 *
 * <ul>
 *   <li>{@link com.keystone.database.audit.JdbcAuditStore} for {@link com.keystone.audit.AuditStore}
 *   <li>{@link com.keystone.database.user.JdbcUserDirectory} for
 *       {@link com.keystone.compliance.UserDirectory}
 * </ul>
 *
 * <p>Enum values never reach a column directly; they pass through a versioned
 * {@link com.keystone.database.StorageCodes} table.
 */
package com.keystone.database;
