package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientEnrichmentClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void returnsRawGeneratedText() {
        EnrichmentClient client = client(HttpStatus.OK, "{\"raw_output\": \"```json\\n{\\\"questions\\\": []}\\n```\"}");

        StageResponse<String> response = client.generate(PipelineStage.ENRICHMENT, EnrichmentPrompt.QUESTIONS,
                "Write questions", "Payment is due.", Deadline.after(Duration.ofSeconds(10)));

        assertThat(response.body()).isEqualTo("```json\n{\"questions\": []}\n```");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/enrich-text/");
    }

    @Test
    void reportsFailuresUnderTheCallingStage() {
        EnrichmentClient client = client(HttpStatus.UNPROCESSABLE_ENTITY, "{}");

        assertThatThrownBy(() -> client.generate(PipelineStage.CHUNKING, EnrichmentPrompt.SEMANTIC_CHUNKING,
                "Split", "Payment is due.", Deadline.after(Duration.ofSeconds(10))))
                .isInstanceOfSatisfying(StageException.class, ex -> {
                    assertThat(ex.stage()).isEqualTo(PipelineStage.CHUNKING);
                    assertThat(ex.code()).isEqualTo(ErrorCode.STAGE_REJECTED);
                });
    }

    private EnrichmentClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WebClientEnrichmentClient(webClient, new PipelineProperties(), new SimpleMeterRegistry());
    }
}
