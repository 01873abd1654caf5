package com.netcourier.enrichment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    private final PipelineProperties properties;
    private final int maxInMemoryBytes;

    public WebClientConfig(PipelineProperties properties,
                           @Value("${pipeline.http.max-in-memory-bytes:16777216}") int maxInMemoryBytes) {
        this.properties = properties;
        this.maxInMemoryBytes = maxInMemoryBytes;
    }

    @Bean
    public WebClient languageDetectionWebClient() {
        return stageClient(properties.getStages().getLanguageDetection());
    }

    @Bean
    public WebClient structuringWebClient() {
        return stageClient(properties.getStages().getStructuring());
    }

    @Bean
    public WebClient annotationWebClient() {
        return stageClient(properties.getStages().getAnnotation());
    }

    @Bean
    public WebClient enrichmentWebClient() {
        return stageClient(properties.getStages().getEnrichment());
    }

    @Bean
    public WebClient embeddingWebClient() {
        return stageClient(properties.getStages().getEmbedding());
    }

    @Bean
    public WebClient qdrantWebClient() {
        return stageClient(properties.getStages().getVectorStore());
    }

    @Bean
    public WebClient llmWebClient(@Value("${chat.llm.base-url:http://localhost:11434}") String baseUrl,
                                  @Value("${chat.llm.api-key:}") String apiKey,
                                  @Value("${chat.llm.timeout-seconds:300}") long timeoutSeconds) {
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(baseUrl)
                .exchangeStrategies(exchangeStrategies());
        if (timeoutSeconds > 0) {
            HttpClient httpClient = HttpClient.create()
                    .responseTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.clientConnector(new ReactorClientHttpConnector(httpClient));
        }
        if (apiKey != null && !apiKey.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        builder.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        builder.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return builder.build();
    }

    private WebClient stageClient(PipelineProperties.Endpoint endpoint) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(endpoint.getTimeout());
        return WebClient.builder()
                .baseUrl(endpoint.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(exchangeStrategies())
                .build();
    }

    private ExchangeStrategies exchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemoryBytes))
                .build();
    }
}
