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
import com.netcourier.enrichment.service.stage.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SemanticChunker {

    private static final Logger log = LoggerFactory.getLogger(SemanticChunker.class);

    private final TextWindowSplitter windowSplitter;
    private final EnrichmentGenerator generator;
    private final ChunkReconciler reconciler;

    public SemanticChunker(TextWindowSplitter windowSplitter, EnrichmentGenerator generator, ChunkReconciler reconciler) {
        this.windowSplitter = windowSplitter;
        this.generator = generator;
        this.reconciler = reconciler;
    }

    public List<Chunk> chunk(Document document, Deadline deadline) {
        String normalizedDocument = ChunkIdentity.normalize(document.text());
        List<Chunk> chunks = new ArrayList<>();
        int order = 1;
        List<String> windows = windowSplitter.split(document.text());
        for (int i = 0; i < windows.size(); i++) {
            GenerationOutcome outcome = generator.generate(PipelineStage.CHUNKING, EnrichmentPrompt.SEMANTIC_CHUNKING,
                    windows.get(i), document.language(), deadline);
            if (!outcome.succeeded()) {
                throw new PipelineException(outcome.errorCode(),
                        "Chunking of window " + (i + 1) + "/" + windows.size() + " failed: " + outcome.reason());
            }
            for (String text : outcome.value().strings("chunks")) {
                String normalized = ChunkIdentity.normalize(text);
                if (normalized.isEmpty()) {
                    continue;
                }
                if (!normalizedDocument.contains(normalized)) {
                    log.warn("Discarding chunk candidate of document {} that does not occur in its text: '{}'",
                            document.documentId(), abbreviate(text));
                    continue;
                }
                chunks.add(reconciler.createChunk(document.documentId(), order++, text, document.language()));
            }
        }
        if (chunks.isEmpty()) {
            throw new PipelineException(ErrorCode.RECOVERY_SCHEMA_MISMATCH,
                    "Chunking produced no chunk that occurs in document " + document.documentId());
        }
        log.info("Document {} split into {} chunks from {} windows", document.documentId(), chunks.size(), windows.size());
        return chunks;
    }

    private String abbreviate(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= 80 ? flat : flat.substring(0, 77) + "...";
    }
}
