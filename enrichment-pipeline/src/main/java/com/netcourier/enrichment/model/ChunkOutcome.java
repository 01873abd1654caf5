package com.netcourier.enrichment.model;

public record ChunkOutcome(Chunk chunk,
                           ChunkStatus status,
                           EnrichmentBundle bundle,
                           ErrorCode errorCode,
                           String reason,
                           String mergedInto) {

    public static ChunkOutcome reconciled(Chunk chunk, EnrichmentBundle bundle) {
        return new ChunkOutcome(chunk, ChunkStatus.RECONCILED, bundle, null, null, null);
    }

    public static ChunkOutcome partialFailed(Chunk chunk, ErrorCode errorCode, String reason) {
        return new ChunkOutcome(chunk, ChunkStatus.PARTIAL_FAILED, null, errorCode, reason, null);
    }

    public static ChunkOutcome merged(Chunk chunk, String survivorId) {
        return new ChunkOutcome(chunk, ChunkStatus.MERGED, null, null, "identical text as " + survivorId, survivorId);
    }

    public ChunkOutcome stored() {
        return new ChunkOutcome(chunk, ChunkStatus.STORED, bundle, null, null, null);
    }

    public String chunkId() {
        return chunk.id();
    }

    public int order() {
        return chunk.order();
    }

    public boolean isReconciled() {
        return status == ChunkStatus.RECONCILED;
    }
}
