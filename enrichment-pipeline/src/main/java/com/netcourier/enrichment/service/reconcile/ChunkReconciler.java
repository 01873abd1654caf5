package com.netcourier.enrichment.service.reconcile;

import com.netcourier.enrichment.model.Chunk;
import com.netcourier.enrichment.model.ChunkMetadata;
import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.ChunkStatus;
import com.netcourier.enrichment.model.EnrichmentBundle;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.service.enrichment.GenerationOutcome;
import com.netcourier.enrichment.service.prompt.EnrichmentPrompt;
import com.netcourier.enrichment.service.recovery.ValidatedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Assembles the per-prompt results of a chunk into one bundle and collapses duplicate chunks.
 *
 * <p>A bundle is only built when all four per-chunk prompts produced a valid object. Anything less
 * is reported as {@link ErrorCode#RECONCILE_INCOMPLETE}; no field is ever filled with a default.</p>
 */
@Component
public class ChunkReconciler {

    private static final Logger log = LoggerFactory.getLogger(ChunkReconciler.class);
    private static final List<EnrichmentPrompt> PER_CHUNK_PROMPTS = List.of(
            EnrichmentPrompt.SUMMARY_KEYWORDS,
            EnrichmentPrompt.QUESTIONS,
            EnrichmentPrompt.KEY_SENTENCES,
            EnrichmentPrompt.METADATA);

    public Chunk createChunk(String documentId, int order, String text, String language) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Chunk " + order + " of " + documentId + " has no text");
        }
        String stripped = text.strip();
        return new Chunk(ChunkIdentity.chunkId(documentId, order, stripped), documentId, order, stripped, language);
    }

    public ChunkOutcome reconcile(String chunkText,
                                  int order,
                                  String documentId,
                                  String language,
                                  Map<EnrichmentPrompt, GenerationOutcome> results) {
        return reconcile(createChunk(documentId, order, chunkText, language), results);
    }

    public ChunkOutcome reconcile(Chunk chunk, Map<EnrichmentPrompt, GenerationOutcome> results) {
        List<String> problems = new ArrayList<>();
        for (EnrichmentPrompt prompt : PER_CHUNK_PROMPTS) {
            GenerationOutcome outcome = results == null ? null : results.get(prompt);
            if (outcome == null) {
                problems.add(prompt.id() + ": no result");
            } else if (!outcome.succeeded()) {
                problems.add(prompt.id() + ": " + outcome.errorCode() + " (" + outcome.reason() + ")");
            }
        }
        if (!problems.isEmpty()) {
            String reason = String.join("; ", problems);
            log.warn("Chunk {} (order {}) is incomplete: {}", chunk.id(), chunk.order(), reason);
            return ChunkOutcome.partialFailed(chunk, ErrorCode.RECONCILE_INCOMPLETE, reason);
        }
        ValidatedObject summary = results.get(EnrichmentPrompt.SUMMARY_KEYWORDS).value();
        ValidatedObject questions = results.get(EnrichmentPrompt.QUESTIONS).value();
        ValidatedObject keySentences = results.get(EnrichmentPrompt.KEY_SENTENCES).value();
        ValidatedObject metadata = results.get(EnrichmentPrompt.METADATA).value();
        EnrichmentBundle bundle = new EnrichmentBundle(
                summary.string("summary"),
                new LinkedHashSet<>(summary.strings("keywords")),
                questions.strings("questions"),
                keySentences.strings("key_sentences"),
                new ChunkMetadata(metadata.string("main_topic"), metadata.string("sentiment"), metadata.entities("entities")));
        return ChunkOutcome.reconciled(chunk, bundle);
    }

    /**
     * Collapses chunks with identical normalized text into the lowest-order chunk of each group.
     * The result keeps chunk order; collapsed chunks come back as {@link ChunkStatus#MERGED}.
     */
    public List<ChunkOutcome> collapseDuplicates(List<ChunkOutcome> outcomes) {
        Map<String, List<ChunkOutcome>> groups = new LinkedHashMap<>();
        outcomes.stream()
                .sorted(Comparator.comparingInt(ChunkOutcome::order))
                .forEach(outcome -> groups.computeIfAbsent(ChunkIdentity.normalize(outcome.chunk().text()), key -> new ArrayList<>())
                        .add(outcome));

        List<ChunkOutcome> collapsed = new ArrayList<>();
        for (List<ChunkOutcome> group : groups.values()) {
            ChunkOutcome survivor = group.get(0);
            if (group.size() == 1) {
                collapsed.add(survivor);
                continue;
            }
            collapsed.add(mergeGroup(survivor, group));
            for (ChunkOutcome duplicate : group.subList(1, group.size())) {
                collapsed.add(ChunkOutcome.merged(duplicate.chunk(), survivor.chunkId()));
            }
            log.info("Collapsed {} duplicate chunk(s) into {}", group.size() - 1, survivor.chunkId());
        }
        collapsed.sort(Comparator.comparingInt(ChunkOutcome::order));
        return collapsed;
    }

    private ChunkOutcome mergeGroup(ChunkOutcome survivor, List<ChunkOutcome> group) {
        List<EnrichmentBundle> complete = group.stream()
                .filter(ChunkOutcome::isReconciled)
                .map(ChunkOutcome::bundle)
                .toList();
        if (complete.isEmpty()) {
            if (survivor.status() == ChunkStatus.PARTIAL_FAILED) {
                return survivor;
            }
            return ChunkOutcome.partialFailed(survivor.chunk(), ErrorCode.RECONCILE_INCOMPLETE, "no complete bundle among duplicates");
        }
        EnrichmentBundle base = survivor.isReconciled() ? survivor.bundle() : complete.get(0);
        EnrichmentBundle merged = base;
        for (EnrichmentBundle bundle : complete) {
            if (bundle != base) {
                merged = merged.mergedWith(bundle);
            }
        }
        return ChunkOutcome.reconciled(survivor.chunk(), merged);
    }
}
