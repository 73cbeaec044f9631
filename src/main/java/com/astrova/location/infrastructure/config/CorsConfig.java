package com.astrova.location.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.List;

/**
 * CORS configuration for the browser autocomplete and chart forms.
 */
@Configuration
public class CorsConfig {

    @Bean
    public CorsFilter corsFilter(@Value("${app.cors.allowed-origins:*}") List<String> allowedOrigins) {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();

        // Patterns rather than origins so "*" stays legal without credentials
        config.setAllowedOriginPatterns(allowedOrigins);
        config.setAllowCredentials(false);
        config.setAllowedHeaders(List.of("*"));

        // Read-only API
        config.setAllowedMethods(List.of("GET", "OPTIONS"));

        config.setMaxAge(3600L);

        source.registerCorsConfiguration("/locations/**", config);

        return new CorsFilter(source);
    }
}
