package com.netcourier.enrichment.model;

import java.nio.file.Path;
import java.util.List;

public record Document(String documentId,
                       Path sourcePath,
                       String language,
                       String text,
                       List<LayoutBlock> blocks) {

    public Document {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public String fileName() {
        return sourcePath == null || sourcePath.getFileName() == null ? documentId : sourcePath.getFileName().toString();
    }
}
