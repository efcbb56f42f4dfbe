package com.example.clipscore_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({YouTubeProperties.class, AnalysisProperties.class})
public class AppPropertiesConfig {
}
