package com.netcourier.enrichment.service.runlog;

import java.time.OffsetDateTime;
import java.util.List;

public record RunReport(String runId,
                        String documentId,
                        String sourcePath,
                        String state,
                        String failedStage,
                        String failureCode,
                        String failureReason,
                        Integer exitCode,
                        OffsetDateTime startedAt,
                        OffsetDateTime finishedAt,
                        List<Transition> transitions,
                        List<Outcome> outcomes) {

    public RunReport {
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public record Transition(String fromState, String toState, String stage, String stageStatus, String detail,
                             OffsetDateTime occurredAt) {}

    public record Outcome(String chunkId, int order, String status, String errorCode, String reason, String mergedInto) {}
}
