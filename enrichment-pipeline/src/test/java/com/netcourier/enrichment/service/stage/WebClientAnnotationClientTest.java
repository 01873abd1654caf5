package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.Annotation;
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

class WebClientAnnotationClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void mapsEntitiesAndLemmas() {
        AnnotationClient client = client("{\"entities\": [{\"text\": \"Berlin\", \"label\": \"LOC\"}], "
                + "\"lemmas\": [{\"token\": \"invoices\", \"lemma\": \"invoice\"}], \"processed_language\": \"en\"}");

        StageResponse<Annotation> response = client.annotate("Invoices from Berlin.", "en", Deadline.after(Duration.ofSeconds(10)));

        assertThat(response.body().entities()).containsExactly(new Annotation.AnnotatedEntity("Berlin", "LOC"));
        assertThat(response.body().lemmas()).containsExactly(new Annotation.Lemma("invoices", "invoice"));
        assertThat(response.body().processedLanguage()).isEqualTo("en");
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/process/");
    }

    @Test
    void keepsRequestedLanguageWhenStageDoesNotReportOne() {
        AnnotationClient client = client("{\"entities\": [], \"lemmas\": []}");

        StageResponse<Annotation> response = client.annotate("Rechnungen aus Berlin.", "fr", Deadline.after(Duration.ofSeconds(10)));

        assertThat(response.body().processedLanguage()).isEqualTo("fr");
        assertThat(response.body().entities()).isEmpty();
    }

    private AnnotationClient client(String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WebClientAnnotationClient(webClient, new PipelineProperties(), new SimpleMeterRegistry());
    }
}
