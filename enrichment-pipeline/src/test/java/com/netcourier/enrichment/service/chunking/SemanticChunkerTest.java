package com.netcourier.enrichment.service.chunking;

import com.netcourier.enrichment.model.Chunk;
import com.netcourier.enrichment.model.Document;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.enrichment.EnrichmentGenerator;
import com.netcourier.enrichment.service.enrichment.GenerationOutcome;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.reconcile.ChunkIdentity;
import com.netcourier.enrichment.service.reconcile.ChunkReconciler;
import com.netcourier.enrichment.service.recovery.ValidatedObject;
import com.netcourier.enrichment.service.stage.Deadline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SemanticChunkerTest {

    private static final String TEXT = "Alpha section text about invoices.\n\nBeta section text about payment terms.";

    @Mock
    private EnrichmentGenerator generator;

    private SemanticChunker chunker;
    private Document document;

    @BeforeEach
    void setUp() {
        chunker = new SemanticChunker(new TextWindowSplitter(4000), generator, new ChunkReconciler());
        document = new Document("doc-1", Path.of("terms.pdf"), "en", TEXT, List.of());
    }

    @Test
    void keepsOnlyChunksThatOccurInTheDocument() {
        chunksReturned(List.of("Alpha section text about invoices.", "Beta  section text\nabout payment terms.", "Invented summary text."));

        List<Chunk> chunks = chunker.chunk(document, Deadline.after(Duration.ofMinutes(1)));

        assertThat(chunks).extracting(Chunk::order).containsExactly(1, 2);
        assertThat(chunks.get(0).text()).isEqualTo("Alpha section text about invoices.");
        assertThat(chunks.get(1).id()).isEqualTo(ChunkIdentity.chunkId("doc-1", 2, "Beta section text about payment terms."));
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.documentId()).isEqualTo("doc-1");
            assertThat(chunk.language()).isEqualTo("en");
        });
    }

    @Test
    void failsWhenNoChunkOccursInTheDocument() {
        chunksReturned(List.of("Something else entirely."));

        assertThatThrownBy(() -> chunker.chunk(document, Deadline.after(Duration.ofMinutes(1))))
                .isInstanceOfSatisfying(PipelineException.class,
                        ex -> assertThat(ex.code()).isEqualTo(ErrorCode.RECOVERY_SCHEMA_MISMATCH));
    }

    @Test
    void propagatesGenerationFailure() {
        when(generator.generate(eq(PipelineStage.CHUNKING), eq(EnrichmentPrompt.SEMANTIC_CHUNKING), anyString(), eq("en"), any(Deadline.class)))
                .thenReturn(GenerationOutcome.failed(EnrichmentPrompt.SEMANTIC_CHUNKING, ErrorCode.STAGE_UNREACHABLE, "connection refused"));

        assertThatThrownBy(() -> chunker.chunk(document, Deadline.after(Duration.ofMinutes(1))))
                .isInstanceOfSatisfying(PipelineException.class, ex -> {
                    assertThat(ex.code()).isEqualTo(ErrorCode.STAGE_UNREACHABLE);
                    assertThat(ex.getMessage()).contains("connection refused");
                });
    }

    private void chunksReturned(List<String> chunks) {
        when(generator.generate(eq(PipelineStage.CHUNKING), eq(EnrichmentPrompt.SEMANTIC_CHUNKING), anyString(), eq("en"), any(Deadline.class)))
                .thenReturn(GenerationOutcome.valid(EnrichmentPrompt.SEMANTIC_CHUNKING,
                        new ValidatedObject("semantic_chunking", Map.of("chunks", chunks))));
    }
}
