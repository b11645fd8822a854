package com.example.memegen_backend.config;

import com.example.memegen_backend.service.Interfaces.StorageService;
import com.example.memegen_backend.service.Interfaces.TemplateService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator templateCatalogHealth(TemplateService templates) {
        return () -> {
            int count = templates.all().size();
            if (count > 0) return Health.up().withDetail("templates", count).build();
            return Health.down().withDetail("templates", "empty").build();
        };
    }

    @Bean
    public HealthIndicator storageHealth(StorageService storage) {
        return () -> {
            if (Files.isWritable(storage.rootOut())) {
                return Health.up().withDetail("out", storage.rootOut().toString()).build();
            }
            return Health.down().withDetail("out", "not writable").build();
        };
    }
}
