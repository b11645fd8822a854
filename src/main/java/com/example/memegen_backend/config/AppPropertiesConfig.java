package com.example.memegen_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties and exposes the immutable
 * {@link RenderSettings} snapshot used by the resolution pipeline.
 */
@Configuration
@EnableConfigurationProperties(MemeProperties.class)
public class AppPropertiesConfig {

    @Bean
    public RenderSettings renderSettings(MemeProperties properties) {
        return properties.toRenderSettings();
    }
}
