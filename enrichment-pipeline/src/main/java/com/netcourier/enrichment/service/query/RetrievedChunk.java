package com.netcourier.enrichment.service.query;

public record RetrievedChunk(String chunkId,
                             String documentId,
                             String source,
                             String text,
                             String summary,
                             double score) {
}
