package com.example.highlight_planner.config;

import com.example.highlight_planner.engine.HttpSemanticAssessor;
import com.example.highlight_planner.engine.Interfaces.SemanticAssessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Wires the HTTP semantic assessor when {@code highlight.semantic.base-url} is set.
 */
@Configuration
@ConditionalOnProperty(prefix = "highlight.semantic", name = "base-url")
public class SemanticClientConfig {

    @Bean
    @Qualifier("semanticWebClient")
    public WebClient semanticWebClient(WebClient.Builder builder, SemanticClientProperties properties) {
        HttpClient http = HttpClient.create()
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs())
                .responseTimeout(Duration.ofSeconds(properties.getResponseTimeoutSec()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();

        WebClient.Builder configured = builder
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .defaultHeader(HttpHeaders.ACCEPT, "application/json");
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        return configured.build();
    }

    @Bean
    public SemanticAssessor httpSemanticAssessor(@Qualifier("semanticWebClient") WebClient semanticWebClient,
                                                 ObjectMapper objectMapper,
                                                 SemanticClientProperties properties) {
        return new HttpSemanticAssessor(semanticWebClient, objectMapper, properties);
    }
}
