package com.netcourier.enrichment.service.query;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.service.stage.Deadline;
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
import static org.assertj.core.api.Assertions.within;

class QdrantChunkRetrieverTest {

    @Test
    void mapsSearchHitsToRetrievedChunks() {
        List<ClientRequest> requests = new ArrayList<>();
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("""
                                    {"result": [
                                      {"id": "5b1a", "version": 3, "score": 0.87,
                                       "payload": {"chunk_id": "c1", "document_id": "doc-1", "source": "terms.pdf",
                                                   "text": "Payment is due within 30 days.", "summary": "Due date.",
                                                   "keywords": ["payment"]}}
                                    ], "status": "ok", "time": 0.002}
                                    """)
                            .build());
                })
                .build();
        PipelineProperties properties = new PipelineProperties();
        QdrantChunkRetriever retriever = new QdrantChunkRetriever(webClient, properties, new SimpleMeterRegistry(), 3);

        List<RetrievedChunk> hits = retriever.search(List.of(0.1, 0.2), Deadline.after(Duration.ofSeconds(10)));

        assertThat(hits).singleElement().satisfies(hit -> {
            assertThat(hit.chunkId()).isEqualTo("c1");
            assertThat(hit.documentId()).isEqualTo("doc-1");
            assertThat(hit.source()).isEqualTo("terms.pdf");
            assertThat(hit.text()).isEqualTo("Payment is due within 30 days.");
            assertThat(hit.score()).isCloseTo(0.87, within(1e-9));
        });
        assertThat(requests.get(0).url().getPath()).isEqualTo("/collections/rag_documents/points/search");
    }
}
