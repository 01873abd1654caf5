package com.netcourier.enrichment.service.pipeline;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.Annotation;
import com.netcourier.enrichment.model.Chunk;
import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.ChunkStatus;
import com.netcourier.enrichment.model.Document;
import com.netcourier.enrichment.model.EmbeddingRecord;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineRun;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.model.PipelineState;
import com.netcourier.enrichment.model.RunSummary;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.chunking.SemanticChunker;
import com.netcourier.enrichment.service.extraction.DocumentTextExtractor;
import com.netcourier.enrichment.service.pipeline.statemachine.PipelineEvent;
import com.netcourier.enrichment.service.pipeline.statemachine.PipelineStateMachineFactory;
import com.netcourier.enrichment.service.reconcile.ChunkIdentity;
import com.netcourier.enrichment.service.reconcile.ChunkReconciler;
import com.netcourier.enrichment.service.runlog.RunLogWriter;
import com.netcourier.enrichment.service.stage.AnnotationClient;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.LanguageDetectionClient;
import com.netcourier.enrichment.service.stage.StageResponse;
import com.netcourier.enrichment.service.stage.StructuredText;
import com.netcourier.enrichment.service.stage.StructuringClient;
import com.netcourier.enrichment.service.store.StoreWriter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentMap;

/**
 * Drives one PDF through detection, structuring, annotation, chunking, enrichment, embedding and storage.
 *
 * <p>A failure before chunking has completed fails the whole document. From there on failures are
 * confined to the chunks they concern and the document always reaches {@link PipelineState#STORED}.</p>
 */
@Service
public class PipelineOrchestrator implements IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final DocumentTextExtractor textExtractor;
    private final LanguageDetectionClient languageDetectionClient;
    private final StructuringClient structuringClient;
    private final AnnotationClient annotationClient;
    private final SemanticChunker semanticChunker;
    private final EnrichmentExecutor enrichmentExecutor;
    private final ChunkReconciler reconciler;
    private final ChunkEmbedder chunkEmbedder;
    private final StoreWriter storeWriter;
    private final RunLogWriter runLog;
    private final PipelineStateMachineFactory stateMachineFactory;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Timer runTimer;

    public PipelineOrchestrator(DocumentTextExtractor textExtractor,
                                LanguageDetectionClient languageDetectionClient,
                                StructuringClient structuringClient,
                                AnnotationClient annotationClient,
                                SemanticChunker semanticChunker,
                                EnrichmentExecutor enrichmentExecutor,
                                ChunkReconciler reconciler,
                                ChunkEmbedder chunkEmbedder,
                                StoreWriter storeWriter,
                                RunLogWriter runLog,
                                PipelineStateMachineFactory stateMachineFactory,
                                PipelineProperties properties,
                                MeterRegistry meterRegistry) {
        this.textExtractor = textExtractor;
        this.languageDetectionClient = languageDetectionClient;
        this.structuringClient = structuringClient;
        this.annotationClient = annotationClient;
        this.semanticChunker = semanticChunker;
        this.enrichmentExecutor = enrichmentExecutor;
        this.reconciler = reconciler;
        this.chunkEmbedder = chunkEmbedder;
        this.storeWriter = storeWriter;
        this.runLog = runLog;
        this.stateMachineFactory = stateMachineFactory;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.runTimer = meterRegistry.timer("pipeline.run.duration");
    }

    @Override
    public RunSummary ingest(Path pdf) {
        byte[] bytes = readDocument(pdf);
        PipelineRun run = new PipelineRun(ChunkIdentity.documentId(bytes), pdf);
        Deadline deadline = Deadline.after(properties.getDocumentDeadline());
        StateMachine<PipelineState, PipelineEvent> machine = stateMachineFactory.create(run.runId());
        log.info("Starting run {} for document {} ({})", run.runId(), run.documentId(), pdf);
        runLog.runStarted(run);

        Timer.Sample sample = Timer.start(meterRegistry);
        RunSummary summary;
        try {
            summary = execute(run, machine, bytes, deadline);
        } finally {
            sample.stop(runTimer);
            machine.stopReactively().block();
        }
        runLog.runFinished(run, summary);
        record(summary);
        log.info("Run {} for document {} finished in state {}: {} chunks stored, {} failed",
                run.runId(), run.documentId(), summary.finalState(), summary.storedChunkIds().size(), summary.failedChunks().size());
        return summary;
    }

    private RunSummary execute(PipelineRun run,
                               StateMachine<PipelineState, PipelineEvent> machine,
                               byte[] bytes,
                               Deadline deadline) {
        PipelineStage stage = PipelineStage.LANGUAGE_DETECTION;
        Document document;
        Annotation annotation;
        List<Chunk> chunks;
        try {
            String fileName = fileName(run.sourcePath(), run.documentId());
            requireTime(stage, deadline);
            String rawText;
            try (InputStream inputStream = new ByteArrayInputStream(bytes)) {
                rawText = textExtractor.extract(fileName, inputStream);
            }
            StageResponse<String> language = languageDetectionClient.detect(rawText, deadline);
            advance(run, machine, stage, language.attempts(), PipelineState.LANGUAGE_DETECTED, "language " + language.body());

            stage = PipelineStage.STRUCTURING;
            requireTime(stage, deadline);
            StageResponse<StructuredText> structured = structuringClient.structure(fileName, bytes, deadline);
            document = new Document(run.documentId(), run.sourcePath(), language.body(),
                    structured.body().text(), structured.body().blocks());
            advance(run, machine, stage, structured.attempts(), PipelineState.STRUCTURED,
                    structured.body().blocks().size() + " layout blocks");

            stage = PipelineStage.ANNOTATION;
            requireTime(stage, deadline);
            StageResponse<Annotation> annotated = annotationClient.annotate(document.text(), document.language(), deadline);
            annotation = annotated.body();
            advance(run, machine, stage, annotated.attempts(), PipelineState.ANNOTATED,
                    annotation.entities().size() + " entities, " + annotation.lemmas().size() + " lemmas");

            stage = PipelineStage.CHUNKING;
            requireTime(stage, deadline);
            chunks = semanticChunker.chunk(document, deadline);
            if (deadline.isExpired()) {
                throw new PipelineException(ErrorCode.DEADLINE_EXCEEDED, "Document deadline expired during chunking");
            }
            advance(run, machine, stage, 1, PipelineState.CHUNKED, chunks.size() + " chunks");
        } catch (PipelineException ex) {
            return fail(run, machine, stage, ex);
        } catch (IOException e) {
            return fail(run, machine, stage, new PipelineException(ErrorCode.STAGE_REJECTED, "Failed to read document", e));
        }

        advance(run, machine, null, 0, PipelineState.ENRICHING, "enriching " + chunks.size() + " chunks");
        List<ChunkOutcome> enriched = enrich(run, chunks, deadline);
        List<ChunkOutcome> collapsed = reconciler.collapseDuplicates(enriched);

        Deadline completion = Deadline.after(max(deadline.remaining(), properties.getCompletionGrace()));
        Map<String, ChunkOutcome> outcomes = new LinkedHashMap<>();
        collapsed.forEach(outcome -> outcomes.put(outcome.chunkId(), outcome));
        List<ChunkOutcome> reconciled = collapsed.stream().filter(ChunkOutcome::isReconciled).toList();

        ChunkEmbedder.EmbeddingResult embedded = chunkEmbedder.embed(document, annotation, reconciled, properties.getCollection(), completion);
        embedded.failures().forEach(failure -> outcomes.put(failure.chunkId(), failure));
        if (!reconciled.isEmpty() && embedded.records().isEmpty()) {
            run.markStageFailed(PipelineStage.EMBEDDING, "no chunk could be embedded");
        } else {
            run.markStage(PipelineStage.EMBEDDING, embedded.attempts());
        }
        advance(run, machine, PipelineStage.EMBEDDING, -1, PipelineState.EMBEDDED,
                embedded.records().size() + " embedded, " + embedded.failures().size() + " failed");

        store(run, embedded.records(), outcomes, completion);
        advance(run, machine, PipelineStage.STORAGE, -1, PipelineState.STORED,
                outcomes.values().stream().filter(outcome -> outcome.status() == ChunkStatus.STORED).count() + " chunks stored");

        List<ChunkOutcome> finalOutcomes = new ArrayList<>(outcomes.values());
        finalOutcomes.stream()
                .filter(outcome -> outcome.status() == ChunkStatus.PARTIAL_FAILED)
                .forEach(outcome -> run.addError("chunk " + outcome.order() + " " + outcome.errorCode() + ": " + outcome.reason()));
        return new RunSummary(run.runId(), run.documentId(), run.state(), null, null, finalOutcomes);
    }

    private List<ChunkOutcome> enrich(PipelineRun run, List<Chunk> chunks, Deadline deadline) {
        ConcurrentMap<String, ChunkOutcome> published = enrichmentExecutor.enrich(chunks, deadline);
        List<ChunkOutcome> outcomes = new ArrayList<>();
        for (Chunk chunk : chunks) {
            published.putIfAbsent(chunk.id(), ChunkOutcome.partialFailed(chunk, ErrorCode.DEADLINE_EXCEEDED,
                    "no enrichment result before the document deadline"));
            outcomes.add(published.get(chunk.id()));
        }
        long failed = outcomes.stream().filter(outcome -> !outcome.isReconciled()).count();
        if (failed > 0) {
            log.warn("{} of {} chunks of document {} could not be enriched", failed, chunks.size(), run.documentId());
        }
        if (failed == chunks.size()) {
            run.markStageFailed(PipelineStage.ENRICHMENT, "no chunk could be enriched");
        } else {
            run.markStage(PipelineStage.ENRICHMENT, 1);
        }
        return outcomes;
    }

    private void store(PipelineRun run, List<EmbeddingRecord> records, Map<String, ChunkOutcome> outcomes, Deadline deadline) {
        if (records.isEmpty()) {
            run.markStage(PipelineStage.STORAGE, 1);
            return;
        }
        String collection = records.get(0).collection();
        try {
            storeWriter.ensureCollection(collection, records.get(0).vector().size(), deadline);
        } catch (PipelineException ex) {
            log.error("Collection {} is not available: {}", collection, ex.getMessage());
            for (EmbeddingRecord record : records) {
                outcomes.put(record.chunk().id(), ChunkOutcome.partialFailed(record.chunk(), ErrorCode.STORE_FAILED, ex.getMessage()));
            }
            run.markStageFailed(PipelineStage.STORAGE, ex.getMessage());
            return;
        }
        int failed = 0;
        for (EmbeddingRecord record : records) {
            String chunkId = record.chunk().id();
            try {
                storeWriter.upsert(record, deadline);
                outcomes.put(chunkId, outcomes.get(chunkId).stored());
            } catch (PipelineException ex) {
                failed++;
                outcomes.put(chunkId, ChunkOutcome.partialFailed(record.chunk(), ErrorCode.STORE_FAILED, ex.getMessage()));
            }
        }
        if (failed == records.size()) {
            run.markStageFailed(PipelineStage.STORAGE, "no chunk could be stored");
        } else {
            run.markStage(PipelineStage.STORAGE, 1);
        }
    }

    /**
     * Moves the run one state forward. A non-negative {@code attempts} marks {@code stage} as completed first.
     */
    private void advance(PipelineRun run,
                         StateMachine<PipelineState, PipelineEvent> machine,
                         PipelineStage stage,
                         int attempts,
                         PipelineState expected,
                         String detail) {
        if (stage != null && attempts > 0) {
            run.markStage(stage, attempts);
        }
        PipelineState from = run.state();
        if (!PipelineStateMachineFactory.send(machine, PipelineEvent.ADVANCE) || machine.getState().getId() != expected) {
            throw new IllegalStateException("Run " + run.runId() + " cannot move from " + from + " to " + expected);
        }
        run.moveTo(expected);
        runLog.transition(run, from, expected, stage, detail);
        log.info("Document {}: {} -> {} ({})", run.documentId(), from, expected, detail);
    }

    private RunSummary fail(PipelineRun run,
                            StateMachine<PipelineState, PipelineEvent> machine,
                            PipelineStage stage,
                            PipelineException ex) {
        String reason = ex.code() + ": " + ex.getMessage();
        run.fail(stage, ex.code(), reason);
        PipelineState from = run.state();
        if (!PipelineStateMachineFactory.send(machine, PipelineEvent.FAIL)) {
            throw new IllegalStateException("Run " + run.runId() + " cannot fail from " + from, ex);
        }
        run.moveTo(PipelineState.FAILED);
        runLog.transition(run, from, PipelineState.FAILED, stage, reason);
        log.error("Document {} failed at {}: {}", run.documentId(), stage, reason);
        return new RunSummary(run.runId(), run.documentId(), PipelineState.FAILED, stage, reason, List.of());
    }

    private void requireTime(PipelineStage stage, Deadline deadline) {
        if (deadline.isExpired()) {
            throw new PipelineException(ErrorCode.DEADLINE_EXCEEDED, "Document deadline expired before " + stage);
        }
    }

    private void record(RunSummary summary) {
        String outcome = switch (summary.exitCode()) {
            case RunSummary.EXIT_STORED -> "stored";
            case RunSummary.EXIT_PARTIAL -> "partial";
            default -> "failed";
        };
        meterRegistry.counter("pipeline.runs", "outcome", outcome).increment();
        for (ChunkOutcome chunkOutcome : summary.outcomes()) {
            meterRegistry.counter("pipeline.chunks", "outcome", chunkOutcome.status().name().toLowerCase(Locale.ROOT)).increment();
        }
    }

    private byte[] readDocument(Path pdf) {
        if (pdf == null || !Files.isRegularFile(pdf)) {
            throw new PipelineException(ErrorCode.STAGE_REJECTED, "Document not found: " + pdf);
        }
        try {
            byte[] bytes = Files.readAllBytes(pdf);
            if (bytes.length == 0) {
                throw new PipelineException(ErrorCode.STAGE_REJECTED, "Document is empty: " + pdf);
            }
            return bytes;
        } catch (PipelineException ex) {
            throw ex;
        } catch (Exception e) {
            throw new PipelineException(ErrorCode.STAGE_REJECTED, "Failed to read document " + pdf, e);
        }
    }

    private String fileName(Path path, String fallback) {
        String name = path == null ? null : FilenameUtils.getName(path.toString());
        return name == null || name.isBlank() ? fallback : name;
    }

    private Duration max(Duration first, Duration second) {
        return first.compareTo(second) >= 0 ? first : second;
    }
}
