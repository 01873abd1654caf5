package com.netcourier.enrichment.service.pipeline;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.Chunk;
import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.enrichment.EnrichmentGenerator;
import com.netcourier.enrichment.service.enrichment.GenerationOutcome;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.reconcile.ChunkReconciler;
import com.netcourier.enrichment.service.stage.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enriches the chunks of one document on a bounded worker pool.
 *
 * <p>Each worker publishes exactly one outcome for its chunk into a map keyed by chunk id. Workers
 * still running when the deadline expires are interrupted and publish nothing; the caller decides
 * what a missing entry means.</p>
 */
@Component
public class EnrichmentExecutor {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentExecutor.class);

    private final EnrichmentGenerator generator;
    private final ChunkReconciler reconciler;
    private final int workerLimit;

    public EnrichmentExecutor(EnrichmentGenerator generator, ChunkReconciler reconciler, PipelineProperties properties) {
        this.generator = generator;
        this.reconciler = reconciler;
        this.workerLimit = properties.getEnrichment().getWorkerLimit();
    }

    public ConcurrentMap<String, ChunkOutcome> enrich(List<Chunk> chunks, Deadline deadline) {
        ConcurrentMap<String, ChunkOutcome> results = new ConcurrentHashMap<>();
        if (chunks.isEmpty()) {
            return results;
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workerLimit, chunks.size()), workerThreads());
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (Chunk chunk : chunks) {
                tasks.add(() -> {
                    enrichChunk(chunk, deadline, results);
                    return null;
                });
            }
            List<Future<Void>> futures = pool.invokeAll(tasks, deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
            long cancelled = futures.stream().filter(Future::isCancelled).count();
            if (cancelled > 0) {
                log.warn("Document deadline expired with {} of {} chunks still being enriched", cancelled, chunks.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Enrichment was interrupted with {} of {} chunks published", results.size(), chunks.size());
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private void enrichChunk(Chunk chunk, Deadline deadline, ConcurrentMap<String, ChunkOutcome> results) {
        ChunkOutcome outcome;
        try {
            Map<EnrichmentPrompt, GenerationOutcome> parts = new EnumMap<>(EnrichmentPrompt.class);
            for (EnrichmentPrompt prompt : EnrichmentPrompt.values()) {
                if (!prompt.isPerChunk()) {
                    continue;
                }
                if (Thread.currentThread().isInterrupted()) {
                    return;
                }
                parts.put(prompt, generator.generate(PipelineStage.ENRICHMENT, prompt, chunk.text(), chunk.language(), deadline));
            }
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            outcome = reconciler.reconcile(chunk, parts);
        } catch (RuntimeException e) {
            log.error("Enrichment of chunk {} failed unexpectedly", chunk.id(), e);
            outcome = ChunkOutcome.partialFailed(chunk, ErrorCode.RECONCILE_INCOMPLETE, "unexpected error: " + e.getMessage());
        }
        if (results.putIfAbsent(chunk.id(), outcome) != null) {
            log.debug("Outcome of chunk {} was already published", chunk.id());
        }
    }

    private ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "enrichment-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
