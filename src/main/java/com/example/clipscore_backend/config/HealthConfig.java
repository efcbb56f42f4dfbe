package com.example.clipscore_backend.config;

import com.example.clipscore_backend.scoring.profile.CategoryProfile;
import com.example.clipscore_backend.scoring.profile.CategoryProfileRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator scoringProfilesHealth(CategoryProfileRegistry registry) {
        return () -> {
            var ids = registry.profiles().stream().map(CategoryProfile::id).toList();
            if (ids.isEmpty()) {
                return Health.down().withDetail("profiles", "none").build();
            }
            return Health.up().withDetail("profiles", ids).build();
        };
    }

    @Bean
    public HealthIndicator youtubeHealth(YouTubeProperties properties) {
        // no network call here: quota is spent per request
        return () -> properties.hasApiKey()
                ? Health.up().withDetail("youtube", "api key configured").build()
                : Health.unknown().withDetail("youtube", "api key missing").build();
    }
}
