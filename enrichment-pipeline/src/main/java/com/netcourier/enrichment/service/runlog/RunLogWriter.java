package com.netcourier.enrichment.service.runlog;

import com.netcourier.enrichment.model.PipelineRun;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.model.PipelineState;
import com.netcourier.enrichment.model.RunSummary;

import java.util.Optional;

public interface RunLogWriter {

    void runStarted(PipelineRun run);

    void transition(PipelineRun run, PipelineState from, PipelineState to, PipelineStage stage, String detail);

    void runFinished(PipelineRun run, RunSummary summary);

    Optional<RunReport> latestRun(String documentId);
}
