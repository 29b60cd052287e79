package com.example.highlight_planner.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({SelectionProperties.class, ScoringProperties.class, SplitterProperties.class,
        SemanticClientProperties.class, ArtifactProperties.class})
public class AppPropertiesConfig {
}
