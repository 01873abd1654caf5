package com.netcourier.enrichment.service.store;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.stage.Deadline;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QdrantStoreWriterTest {

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private boolean collectionExists;
    private boolean failUpserts;
    private QdrantStoreWriter storeWriter;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(this::respond)
                .build();
        PipelineProperties properties = new PipelineProperties();
        properties.getRetry().setMaxAttempts(1);
        properties.getRetry().setInitialBackoff(Duration.ZERO);
        storeWriter = new QdrantStoreWriter(webClient, properties, new SimpleMeterRegistry());
    }

    @Test
    void createsMissingCollectionOnce() {
        storeWriter.ensureCollection("rag", 3, deadline());
        storeWriter.ensureCollection("rag", 3, deadline());

        assertThat(calls).containsExactly("GET /collections/rag/exists", "PUT /collections/rag");
    }

    @Test
    void leavesExistingCollectionAlone() {
        collectionExists = true;

        storeWriter.ensureCollection("rag", 3, deadline());

        assertThat(calls).containsExactly("GET /collections/rag/exists");
    }

    @Test
    void upsertsOnePointAndWaitsForIt() {
        storeWriter.upsert("rag", "chunk-1", List.of(0.1, 0.2, 0.3), Map.of("text", "Payment is due."), deadline());

        assertThat(calls).containsExactly("PUT /collections/rag/points?wait=true");
    }

    @Test
    void reportsFailedUpsertAsStoreFailure() {
        failUpserts = true;

        assertThatThrownBy(() -> storeWriter.upsert("rag", "chunk-1", List.of(0.1), Map.of(), deadline()))
                .isInstanceOfSatisfying(PipelineException.class, ex -> assertThat(ex.code()).isEqualTo(ErrorCode.STORE_FAILED));
    }

    @Test
    void deletedCollectionIsCheckedAgain() {
        collectionExists = true;
        storeWriter.ensureCollection("rag", 3, deadline());

        storeWriter.deleteCollection("rag");
        storeWriter.ensureCollection("rag", 3, deadline());

        assertThat(calls).containsExactly(
                "GET /collections/rag/exists",
                "DELETE /collections/rag",
                "GET /collections/rag/exists");
    }

    private Mono<ClientResponse> respond(ClientRequest request) {
        String query = request.url().getQuery() == null ? "" : "?" + request.url().getQuery();
        calls.add(request.method().name() + " " + request.url().getPath() + query);
        if (HttpMethod.GET.equals(request.method())) {
            return json(HttpStatus.OK, "{\"result\": {\"exists\": " + collectionExists + "}, \"status\": \"ok\"}");
        }
        if (failUpserts && request.url().getPath().endsWith("/points")) {
            return json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"status\": {\"error\": \"storage unavailable\"}}");
        }
        return json(HttpStatus.OK, "{\"result\": true, \"status\": \"ok\"}");
    }

    private Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    private Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(10));
    }
}
