package com.netcourier.enrichment.service.pipeline;

import com.netcourier.enrichment.model.RunSummary;

import java.nio.file.Path;

public interface IngestionPipeline {

    RunSummary ingest(Path pdf);
}
