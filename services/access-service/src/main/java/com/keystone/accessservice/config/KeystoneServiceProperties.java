package com.keystone.accessservice.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity and web settings, bound from {@code keystone.service.*}:
 *
 * <pre>
 * keystone:
 *   service:
 *     name: access-service
 *     environment: production
 *     cors-origins: https://admin.example.com
 * </pre>
 *
 * @param name        service name used for logging and metric tags. Required.
 * @param environment deployment environment (development, staging, production)
 * @param corsOrigins origins allowed to call {@code /api/**} from a browser
 */
@ConfigurationProperties(prefix = "keystone.service")
@Validated
public record KeystoneServiceProperties(@NotBlank String name, String environment, List<String> corsOrigins) {

    public static final List<String> DEFAULT_CORS_ORIGINS = List.of("http://localhost:3000", "http://localhost:4200");

    public KeystoneServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        corsOrigins = corsOrigins == null || corsOrigins.isEmpty() ? DEFAULT_CORS_ORIGINS : List.copyOf(corsOrigins);
    }
}
