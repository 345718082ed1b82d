package dev.pagegraph.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "pagegraph.web")
public record WebProperties(List<String> allowedOrigins) {
    public WebProperties {
        if (allowedOrigins == null || allowedOrigins.isEmpty()) allowedOrigins = List.of("*");
    }
}
