package com.oraclex.relay.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final CorsProperties corsProperties;
    private final AllowedOriginResolver allowedOriginResolver;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        CorsRegistration cors = registry.addMapping("/**")
                .allowedMethods(corsProperties.getAllowedMethods().toArray(new String[0]))
                .allowedHeaders("*")
                .exposedHeaders(RequestLoggingFilter.REQUEST_ID_HEADER, RequestLoggingFilter.CORRELATION_ID_HEADER)
                .maxAge(3600);

        List<String> origins = allowedOriginResolver.resolveCorsAllowedOrigins();
        if (origins.isEmpty()) {
            cors.allowedOriginPatterns("*");
        } else {
            cors.allowedOrigins(origins.toArray(new String[0]));
        }
    }
}
