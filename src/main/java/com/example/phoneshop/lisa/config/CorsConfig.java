package com.example.phoneshop.lisa.config;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/** Cross-origin access for the chat UI; origins come from {@code cors.allowed-origins}. */
@Configuration
public class CorsConfig implements WebFluxConfigurer {

    private final List<String> configuredOrigins;

    public CorsConfig(@Value("${cors.allowed-origins:}") String rawOrigins) {
        this.configuredOrigins = parseOrigins(rawOrigins);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (configuredOrigins.isEmpty()) {
            return;
        }
        registry.addMapping("/**")
                .allowedOriginPatterns(configuredOrigins.toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);
    }

    private List<String> parseOrigins(String rawOrigins) {
        if (!StringUtils.hasText(rawOrigins)) {
            return List.of();
        }

        return Arrays.stream(rawOrigins.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .collect(Collectors.toList());
    }
}
