package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.model.LayoutBlock;

import java.util.List;

public record StructuredText(List<LayoutBlock> blocks, String text) {

    public StructuredText {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }
}
