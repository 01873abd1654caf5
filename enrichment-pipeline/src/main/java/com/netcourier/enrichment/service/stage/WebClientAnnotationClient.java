package com.netcourier.enrichment.service.stage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.Annotation;
import com.netcourier.enrichment.model.PipelineStage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

@Component
public class WebClientAnnotationClient implements AnnotationClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientAnnotationClient.class);

    private final StageClient stageClient;
    private final StageEndpoint endpoint;
    private final PipelineProperties properties;

    public WebClientAnnotationClient(WebClient annotationWebClient,
                                     PipelineProperties properties,
                                     MeterRegistry meterRegistry) {
        this.stageClient = new StageClient(annotationWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.endpoint = StageEndpoint.post(PipelineStage.ANNOTATION, properties.getStages().getAnnotation().getPath());
        this.properties = properties;
    }

    @Override
    public StageResponse<Annotation> annotate(String text, String language, Deadline deadline) {
        String model = properties.getAnnotation().getModels().get(language);
        if (model == null) {
            log.debug("No annotation model configured for '{}', leaving the choice to the stage", language);
        }
        StageResponse<AnnotateResponse> response = stageClient.call(endpoint, new AnnotateRequest(text, language, model),
                AnnotateResponse.class, properties.getStages().getAnnotation().getTimeout(), deadline);
        AnnotateResponse body = response.body();
        if (body == null) {
            return new StageResponse<>(new Annotation(List.of(), List.of(), language), response.attempts());
        }
        String processed = body.processedLanguage() == null ? language : body.processedLanguage();
        return new StageResponse<>(new Annotation(body.entities(), body.lemmas(), processed), response.attempts());
    }

    private record AnnotateRequest(String text, String language, String model) {}

    private record AnnotateResponse(List<Annotation.AnnotatedEntity> entities,
                                    List<Annotation.Lemma> lemmas,
                                    @JsonProperty("processed_language") String processedLanguage) {}
}
