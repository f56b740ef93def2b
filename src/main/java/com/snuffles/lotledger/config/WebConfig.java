package com.snuffles.lotledger.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final LedgerProperties ledgerProperties;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
            .allowedOrigins(ledgerProperties.getCors().getAllowedOrigins().toArray(String[]::new))
            .allowedMethods("GET", "POST", "PUT", "OPTIONS")
            .allowedHeaders("*")
            .allowCredentials(true);
    }
}
