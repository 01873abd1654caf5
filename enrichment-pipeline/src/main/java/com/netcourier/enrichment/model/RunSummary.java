package com.netcourier.enrichment.model;

import java.util.List;

public record RunSummary(String runId,
                         String documentId,
                         PipelineState finalState,
                         PipelineStage failedStage,
                         String failureReason,
                         List<ChunkOutcome> outcomes) {

    public static final int EXIT_STORED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_PARTIAL = 2;

    public RunSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public List<String> storedChunkIds() {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == ChunkStatus.STORED)
                .map(ChunkOutcome::chunkId)
                .toList();
    }

    public List<ChunkOutcome> failedChunks() {
        return outcomes.stream()
                .filter(outcome -> outcome.status() == ChunkStatus.PARTIAL_FAILED)
                .toList();
    }

    public int exitCode() {
        if (finalState == PipelineState.FAILED) {
            return EXIT_FAILED;
        }
        return failedChunks().isEmpty() ? EXIT_STORED : EXIT_PARTIAL;
    }
}
