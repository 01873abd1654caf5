package com.netcourier.enrichment.service.pipeline;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.Annotation;
import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.Document;
import com.netcourier.enrichment.model.EmbeddingRecord;
import com.netcourier.enrichment.model.EnrichmentBundle;
import com.netcourier.enrichment.model.NamedEntity;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.EmbeddingClient;
import com.netcourier.enrichment.service.stage.StageResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Component
public class ChunkEmbedder {

    private static final Logger log = LoggerFactory.getLogger(ChunkEmbedder.class);

    private final EmbeddingClient embeddingClient;
    private final int batchSize;

    public ChunkEmbedder(EmbeddingClient embeddingClient, PipelineProperties properties) {
        this.embeddingClient = embeddingClient;
        this.batchSize = properties.getEmbedding().getBatchSize();
    }

    public EmbeddingResult embed(Document document,
                                 Annotation annotation,
                                 List<ChunkOutcome> reconciled,
                                 String collection,
                                 Deadline deadline) {
        List<EmbeddingRecord> records = new ArrayList<>();
        List<ChunkOutcome> failures = new ArrayList<>();
        int attempts = 1;
        for (int start = 0; start < reconciled.size(); start += batchSize) {
            List<ChunkOutcome> batch = reconciled.subList(start, Math.min(start + batchSize, reconciled.size()));
            List<String> texts = batch.stream().map(outcome -> outcome.chunk().text()).toList();
            try {
                StageResponse<EmbeddingClient.EmbeddingBatch> response = embeddingClient.embedPassages(texts, deadline);
                attempts = Math.max(attempts, response.attempts());
                for (int i = 0; i < batch.size(); i++) {
                    ChunkOutcome outcome = batch.get(i);
                    records.add(new EmbeddingRecord(collection, outcome.chunk(), response.body().vectors().get(i),
                            payloadFor(document, annotation, outcome)));
                }
            } catch (PipelineException ex) {
                log.warn("Embedding batch of {} chunks of document {} failed: {}", batch.size(), document.documentId(), ex.getMessage());
                for (ChunkOutcome outcome : batch) {
                    failures.add(ChunkOutcome.partialFailed(outcome.chunk(), ex.code(), "embedding failed: " + ex.getMessage()));
                }
            }
        }
        return new EmbeddingResult(records, failures, attempts);
    }

    Map<String, Object> payloadFor(Document document, Annotation annotation, ChunkOutcome outcome) {
        EnrichmentBundle bundle = outcome.bundle();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("document_id", document.documentId());
        payload.put("chunk_id", outcome.chunkId());
        payload.put("chunk_order", outcome.order());
        payload.put("source", document.fileName());
        payload.put("language", outcome.chunk().language());
        payload.put("text", outcome.chunk().text());
        payload.put("summary", bundle.summary());
        payload.put("keywords", List.copyOf(bundle.keywords()));
        payload.put("questions", bundle.questions());
        payload.put("key_sentences", bundle.keySentences());
        payload.put("main_topic", bundle.metadata().mainTopic());
        payload.put("sentiment", bundle.metadata().sentiment());
        List<Map<String, String>> entities = new ArrayList<>();
        for (NamedEntity entity : bundle.metadata().entities()) {
            entities.add(Map.of("name", entity.name(), "type", entity.type()));
        }
        payload.put("entities", entities);
        payload.put("nlp_entities", annotationEntitiesIn(annotation, outcome.chunk().text()));
        return payload;
    }

    private List<Map<String, String>> annotationEntitiesIn(Annotation annotation, String chunkText) {
        if (annotation == null) {
            return List.of();
        }
        String haystack = chunkText.toLowerCase(Locale.ROOT);
        Set<Annotation.AnnotatedEntity> seen = new LinkedHashSet<>();
        for (Annotation.AnnotatedEntity entity : annotation.entities()) {
            if (entity.text() != null && !entity.text().isBlank() && entity.label() != null
                    && haystack.contains(entity.text().toLowerCase(Locale.ROOT))) {
                seen.add(entity);
            }
        }
        return seen.stream()
                .map(entity -> Map.of("text", entity.text(), "label", entity.label()))
                .toList();
    }

    public record EmbeddingResult(List<EmbeddingRecord> records, List<ChunkOutcome> failures, int attempts) {}
}
