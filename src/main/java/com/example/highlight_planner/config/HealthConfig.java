package com.example.highlight_planner.config;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator semanticAssessorHealth(
            @Qualifier("semanticWebClient") ObjectProvider<WebClient> semanticWebClient) {
        return () -> {
            WebClient client = semanticWebClient.getIfAvailable();
            if (client == null) {
                return Health.up().withDetail("semantic", "not configured, keyword fallback").build();
            }
            try {
                // HEAD / must answer 2xx
                client.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("semantic", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("semantic", "unreachable").build();
            }
        };
    }
}
