package com.netcourier.enrichment.model;

import java.util.List;

public record ChunkMetadata(String mainTopic, String sentiment, List<NamedEntity> entities) {

    public ChunkMetadata {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }
}
