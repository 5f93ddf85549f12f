package com.keystone.accessservice.config;

import com.keystone.accessservice.infrastructure.web.CorrelationIdFilter;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS for the admin front end. Origins come from {@code keystone.service.cors-origins}. */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final KeystoneServiceProperties properties;
    private final KeystoneAuthProperties auth;

    public WebConfig(KeystoneServiceProperties properties, KeystoneAuthProperties auth) {
        this.properties = properties;
        this.auth = auth;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER, auth.overrideHeader())
                .allowCredentials(true)
                .maxAge(3600);
    }
}
