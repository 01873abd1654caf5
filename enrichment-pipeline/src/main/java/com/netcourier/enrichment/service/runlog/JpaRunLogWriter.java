package com.netcourier.enrichment.service.runlog;

import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.PipelineRun;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.model.PipelineState;
import com.netcourier.enrichment.model.RunSummary;
import com.netcourier.enrichment.persistence.entity.ChunkOutcomeEntity;
import com.netcourier.enrichment.persistence.entity.PipelineRunEntity;
import com.netcourier.enrichment.persistence.entity.StageTransitionEntity;
import com.netcourier.enrichment.persistence.repository.ChunkOutcomeRepository;
import com.netcourier.enrichment.persistence.repository.PipelineRunRepository;
import com.netcourier.enrichment.persistence.repository.StageTransitionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class JpaRunLogWriter implements RunLogWriter {

    private static final Logger log = LoggerFactory.getLogger(JpaRunLogWriter.class);
    private static final int MAX_TEXT = 4000;

    private final PipelineRunRepository runRepository;
    private final StageTransitionRepository transitionRepository;
    private final ChunkOutcomeRepository outcomeRepository;

    public JpaRunLogWriter(PipelineRunRepository runRepository,
                           StageTransitionRepository transitionRepository,
                           ChunkOutcomeRepository outcomeRepository) {
        this.runRepository = runRepository;
        this.transitionRepository = transitionRepository;
        this.outcomeRepository = outcomeRepository;
    }

    @Override
    @Transactional
    public void runStarted(PipelineRun run) {
        PipelineRunEntity entity = new PipelineRunEntity();
        entity.setRunId(run.runId());
        entity.setDocumentId(run.documentId());
        entity.setSourcePath(run.sourcePath() == null ? null : run.sourcePath().toString());
        entity.setState(run.state().name());
        entity.setStartedAt(run.startedAt());
        runRepository.save(entity);
    }

    @Override
    @Transactional
    public void transition(PipelineRun run, PipelineState from, PipelineState to, PipelineStage stage, String detail) {
        StageTransitionEntity entity = new StageTransitionEntity();
        entity.setRunId(run.runId());
        entity.setDocumentId(run.documentId());
        entity.setFromState(from.name());
        entity.setToState(to.name());
        if (stage != null) {
            entity.setStage(stage.name());
            entity.setStageStatus(run.stageStatus(stage).name());
        }
        entity.setDetail(truncate(detail));
        entity.setOccurredAt(OffsetDateTime.now());
        transitionRepository.save(entity);
        runRepository.findById(run.runId()).ifPresent(existing -> {
            existing.setState(to.name());
            runRepository.save(existing);
        });
    }

    @Override
    @Transactional
    public void runFinished(PipelineRun run, RunSummary summary) {
        PipelineRunEntity entity = runRepository.findById(run.runId()).orElseGet(() -> {
            log.warn("Run {} was not recorded at start, recording it now", run.runId());
            PipelineRunEntity created = new PipelineRunEntity();
            created.setRunId(run.runId());
            created.setDocumentId(run.documentId());
            created.setStartedAt(run.startedAt());
            return created;
        });
        entity.setState(summary.finalState().name());
        entity.setFailedStage(summary.failedStage() == null ? null : summary.failedStage().name());
        entity.setFailureCode(run.failureCode() == null ? null : run.failureCode().name());
        entity.setFailureReason(truncate(summary.failureReason()));
        entity.setExitCode(summary.exitCode());
        entity.setFinishedAt(OffsetDateTime.now());
        runRepository.save(entity);

        List<ChunkOutcomeEntity> rows = summary.outcomes().stream()
                .map(outcome -> toEntity(run, outcome))
                .toList();
        outcomeRepository.saveAll(rows);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RunReport> latestRun(String documentId) {
        return runRepository.findTopByDocumentIdOrderByStartedAtDesc(documentId)
                .map(this::toReport);
    }

    private RunReport toReport(PipelineRunEntity entity) {
        List<RunReport.Transition> transitions = transitionRepository.findByRunIdOrderByIdAsc(entity.getRunId()).stream()
                .map(row -> new RunReport.Transition(row.getFromState(), row.getToState(), row.getStage(),
                        row.getStageStatus(), row.getDetail(), row.getOccurredAt()))
                .toList();
        List<RunReport.Outcome> outcomes = outcomeRepository.findByRunIdOrderByChunkOrderAsc(entity.getRunId()).stream()
                .map(row -> new RunReport.Outcome(row.getChunkId(), row.getChunkOrder(), row.getStatus(),
                        row.getErrorCode(), row.getReason(), row.getMergedInto()))
                .toList();
        return new RunReport(entity.getRunId(), entity.getDocumentId(), entity.getSourcePath(), entity.getState(),
                entity.getFailedStage(), entity.getFailureCode(), entity.getFailureReason(), entity.getExitCode(),
                entity.getStartedAt(), entity.getFinishedAt(), transitions, outcomes);
    }

    private ChunkOutcomeEntity toEntity(PipelineRun run, ChunkOutcome outcome) {
        ChunkOutcomeEntity entity = new ChunkOutcomeEntity();
        entity.setRunId(run.runId());
        entity.setDocumentId(run.documentId());
        entity.setChunkId(outcome.chunkId());
        entity.setChunkOrder(outcome.order());
        entity.setStatus(outcome.status().name());
        entity.setErrorCode(outcome.errorCode() == null ? null : outcome.errorCode().name());
        entity.setReason(truncate(outcome.reason()));
        entity.setMergedInto(outcome.mergedInto());
        return entity;
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_TEXT) {
            return value;
        }
        return value.substring(0, MAX_TEXT - 3) + "...";
    }
}
