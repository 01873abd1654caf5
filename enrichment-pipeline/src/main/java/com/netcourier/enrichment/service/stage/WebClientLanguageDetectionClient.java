package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.PipelineStage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Locale;
import java.util.Set;

@Component
public class WebClientLanguageDetectionClient implements LanguageDetectionClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientLanguageDetectionClient.class);
    private static final Set<String> UNDETERMINED = Set.of("", "und", "unknown", "none");

    private final StageClient stageClient;
    private final StageEndpoint endpoint;
    private final PipelineProperties properties;

    public WebClientLanguageDetectionClient(WebClient languageDetectionWebClient,
                                            PipelineProperties properties,
                                            MeterRegistry meterRegistry) {
        this.stageClient = new StageClient(languageDetectionWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.endpoint = StageEndpoint.post(PipelineStage.LANGUAGE_DETECTION, properties.getStages().getLanguageDetection().getPath());
        this.properties = properties;
    }

    @Override
    public StageResponse<String> detect(String text, Deadline deadline) {
        if (text == null || text.isBlank()) {
            log.info("No text available for language detection, assuming '{}'", properties.getDefaultLanguage());
            return StageResponse.of(properties.getDefaultLanguage());
        }
        StageResponse<DetectResponse> response = stageClient.call(endpoint, new DetectRequest(text), DetectResponse.class,
                properties.getStages().getLanguageDetection().getTimeout(), deadline);
        DetectResponse body = response.body();
        String language = body == null || body.language() == null ? "" : body.language().strip().toLowerCase(Locale.ROOT);
        if (UNDETERMINED.contains(language)) {
            log.info("Language detection was undetermined (status {}), assuming '{}'",
                    body == null ? null : body.status(), properties.getDefaultLanguage());
            return new StageResponse<>(properties.getDefaultLanguage(), response.attempts());
        }
        return new StageResponse<>(language, response.attempts());
    }

    private record DetectRequest(String text) {}

    private record DetectResponse(String language, String status) {}
}
