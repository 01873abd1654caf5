package com.netcourier.enrichment.model;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public class PipelineRun {

    private final String runId;
    private final String documentId;
    private final Path sourcePath;
    private final OffsetDateTime startedAt;
    private final Map<PipelineStage, StageStatus> stageStatuses = new EnumMap<>(PipelineStage.class);
    private final List<String> errors = new ArrayList<>();
    private PipelineState state = PipelineState.INGESTED;
    private PipelineStage failedStage;
    private ErrorCode failureCode;
    private String failureReason;

    public PipelineRun(String documentId, Path sourcePath) {
        this.runId = UUID.randomUUID().toString();
        this.documentId = documentId;
        this.sourcePath = sourcePath;
        this.startedAt = OffsetDateTime.now();
        for (PipelineStage stage : PipelineStage.values()) {
            stageStatuses.put(stage, StageStatus.PENDING);
        }
    }

    public void markStage(PipelineStage stage, int attempts) {
        stageStatuses.put(stage, attempts > 1 ? StageStatus.RETRIED : StageStatus.SUCCEEDED);
    }

    public void markStageFailed(PipelineStage stage, String reason) {
        stageStatuses.put(stage, StageStatus.FAILED);
        errors.add(stage + ": " + reason);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void fail(PipelineStage stage, ErrorCode code, String reason) {
        markStageFailed(stage, reason);
        this.failedStage = stage;
        this.failureCode = code;
        this.failureReason = reason;
    }

    public void moveTo(PipelineState next) {
        this.state = next;
    }

    public String runId() {
        return runId;
    }

    public String documentId() {
        return documentId;
    }

    public Path sourcePath() {
        return sourcePath;
    }

    public OffsetDateTime startedAt() {
        return startedAt;
    }

    public PipelineState state() {
        return state;
    }

    public StageStatus stageStatus(PipelineStage stage) {
        return stageStatuses.get(stage);
    }

    public Map<PipelineStage, StageStatus> stageStatuses() {
        return Collections.unmodifiableMap(stageStatuses);
    }

    public List<String> errors() {
        return Collections.unmodifiableList(errors);
    }

    public PipelineStage failedStage() {
        return failedStage;
    }

    public ErrorCode failureCode() {
        return failureCode;
    }

    public String failureReason() {
        return failureReason;
    }
}
