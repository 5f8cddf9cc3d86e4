package com.oraclex.relay.config;

import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the origins the dashboard may call from. The environment variable wins over
 * {@code oraclex.cors.allowed-origins}; an empty result means every origin is allowed.
 */
@Component
public class AllowedOriginResolver {

    static final String ALLOWED_ORIGINS_ENV = "ORACLEX_ALLOWED_ORIGINS";

    private final CorsProperties corsProperties;
    private final Environment environment;

    public AllowedOriginResolver(CorsProperties corsProperties, Environment environment) {
        this.corsProperties = corsProperties;
        this.environment = environment;
    }

    public List<String> resolveCorsAllowedOrigins() {
        List<String> envOrigins = parseOrigins(environment.getProperty(ALLOWED_ORIGINS_ENV));
        if (!envOrigins.isEmpty()) {
            return envOrigins;
        }
        return parseOrigins(corsProperties.getAllowedOrigins());
    }

    public boolean allowsAnyOrigin() {
        return resolveCorsAllowedOrigins().isEmpty();
    }

    private List<String> parseOrigins(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        return parseOrigins(List.of(raw.split(",")));
    }

    private List<String> parseOrigins(List<String> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        return raw.stream()
                .map(String::trim)
                .filter(value -> !value.isBlank())
                .toList();
    }
}
