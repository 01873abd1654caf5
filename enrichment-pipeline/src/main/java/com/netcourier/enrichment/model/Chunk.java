package com.netcourier.enrichment.model;

public record Chunk(String id,
                    String documentId,
                    int order,
                    String text,
                    String language) {
}
