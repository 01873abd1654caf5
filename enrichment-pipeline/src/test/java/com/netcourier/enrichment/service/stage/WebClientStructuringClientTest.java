package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.LayoutBlock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientStructuringClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void assemblesTextFromTextBearingBlocks() {
        StructuringClient client = client("""
                [
                  {"type": "Title", "text": "Annual Report", "metadata": {"page_number": 1}},
                  {"type": "Image", "text": "logo", "metadata": {"page_number": 1}},
                  {"type": "NarrativeText", "text": "Revenue grew by 4 percent.", "metadata": {"page_number": 2}},
                  {"type": "Footer", "text": "Page 2"}
                ]
                """);

        StageResponse<StructuredText> response = client.structure("report.pdf",
                "%PDF-1.4".getBytes(StandardCharsets.US_ASCII), Deadline.after(Duration.ofSeconds(10)));

        assertThat(response.body().text()).isEqualTo("Annual Report\n\nRevenue grew by 4 percent.");
        assertThat(response.body().blocks())
                .extracting(LayoutBlock::type)
                .containsExactly("Title", "Image", "NarrativeText", "Footer");
        assertThat(response.body().blocks().get(2).page()).isEqualTo(2);
        assertThat(requests.get(0).url().getPath()).isEqualTo("/structure-pdf/");
        assertThat(requests.get(0).headers().getContentType()).isNotNull();
        assertThat(requests.get(0).headers().getContentType().isCompatibleWith(MediaType.MULTIPART_FORM_DATA)).isTrue();
    }

    @Test
    void rejectsDocumentWithoutText() {
        StructuringClient client = client("[{\"type\": \"Image\", \"text\": \"\"}]");

        assertThatThrownBy(() -> client.structure("scan.pdf", new byte[]{1, 2, 3}, Deadline.after(Duration.ofSeconds(10))))
                .isInstanceOfSatisfying(StageException.class, ex -> assertThat(ex.code()).isEqualTo(ErrorCode.STAGE_REJECTED));
    }

    private StructuringClient client(String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new WebClientStructuringClient(webClient, new PipelineProperties(), new SimpleMeterRegistry());
    }
}
