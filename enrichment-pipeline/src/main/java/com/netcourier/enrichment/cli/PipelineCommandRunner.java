package com.netcourier.enrichment.cli;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ChunkOutcome;
import com.netcourier.enrichment.model.RunSummary;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.pipeline.IngestionPipeline;
import com.netcourier.enrichment.service.runlog.RunLogWriter;
import com.netcourier.enrichment.service.runlog.RunReport;
import com.netcourier.enrichment.service.store.StoreWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Component
public class PipelineCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommandRunner.class);
    static final int EXIT_USAGE = 64;

    private final IngestionPipeline pipeline;
    private final QueryConsole queryConsole;
    private final StoreWriter storeWriter;
    private final RunLogWriter runLog;
    private final PipelineProperties properties;
    private int exitCode;

    public PipelineCommandRunner(IngestionPipeline pipeline,
                                 QueryConsole queryConsole,
                                 StoreWriter storeWriter,
                                 RunLogWriter runLog,
                                 PipelineProperties properties) {
        this.pipeline = pipeline;
        this.queryConsole = queryConsole;
        this.storeWriter = storeWriter;
        this.runLog = runLog;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> command = args.getNonOptionArgs();
        if (command.isEmpty()) {
            log.info("No command given. Usage: ingest <pdf> | chat | clear | runs <documentId>");
            return;
        }
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        exitCode = execute(command, in, System.out);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> command, BufferedReader in, PrintStream out) throws IOException {
        String name = command.get(0);
        switch (name) {
            case "ingest" -> {
                if (command.size() != 2) {
                    out.println("Usage: ingest <pdf>");
                    return EXIT_USAGE;
                }
                return ingest(Path.of(command.get(1)), out);
            }
            case "chat" -> {
                queryConsole.run(in, out);
                return 0;
            }
            case "clear" -> {
                storeWriter.deleteCollection(properties.getCollection());
                out.println("Collection " + properties.getCollection() + " deleted.");
                return 0;
            }
            case "runs" -> {
                if (command.size() != 2) {
                    out.println("Usage: runs <documentId>");
                    return EXIT_USAGE;
                }
                return printLatestRun(command.get(1), out);
            }
            default -> {
                out.println("Unknown command '" + name + "'. Usage: ingest <pdf> | chat | clear | runs <documentId>");
                return EXIT_USAGE;
            }
        }
    }

    private int ingest(Path pdf, PrintStream out) {
        RunSummary summary;
        try {
            summary = pipeline.ingest(pdf);
        } catch (PipelineException ex) {
            log.error("Could not start ingestion of {}: {}", pdf, ex.getMessage());
            out.println("FAILED: " + ex.getMessage());
            return RunSummary.EXIT_FAILED;
        }
        out.printf("Document %s (run %s): %s%n", summary.documentId(), summary.runId(), summary.finalState());
        if (summary.failedStage() != null) {
            out.printf("  failed at %s: %s%n", summary.failedStage(), summary.failureReason());
        }
        out.printf("  stored chunks: %d%n", summary.storedChunkIds().size());
        for (ChunkOutcome outcome : summary.outcomes()) {
            switch (outcome.status()) {
                case PARTIAL_FAILED -> out.printf("  chunk %d %s PARTIAL_FAILED %s: %s%n",
                        outcome.order(), outcome.chunkId(), outcome.errorCode(), outcome.reason());
                case MERGED -> out.printf("  chunk %d %s MERGED into %s%n", outcome.order(), outcome.chunkId(), outcome.mergedInto());
                default -> {
                }
            }
        }
        return summary.exitCode();
    }

    private int printLatestRun(String documentId, PrintStream out) {
        Optional<RunReport> report = runLog.latestRun(documentId);
        if (report.isEmpty()) {
            out.println("No run recorded for document " + documentId);
            return 1;
        }
        RunReport run = report.get();
        out.printf("Run %s of %s (%s): %s, exit code %s%n", run.runId(), run.documentId(), run.sourcePath(), run.state(), run.exitCode());
        if (run.failedStage() != null) {
            out.printf("  failed at %s [%s]: %s%n", run.failedStage(), run.failureCode(), run.failureReason());
        }
        for (RunReport.Transition transition : run.transitions()) {
            out.printf("  %s -> %s %s %s%n", transition.fromState(), transition.toState(),
                    transition.stageStatus() == null ? "" : transition.stage() + "=" + transition.stageStatus(),
                    transition.detail() == null ? "" : transition.detail());
        }
        for (RunReport.Outcome outcome : run.outcomes()) {
            String detail = outcome.reason() == null ? ""
                    : outcome.errorCode() == null ? " " + outcome.reason() : " " + outcome.errorCode() + ": " + outcome.reason();
            out.printf("  chunk %d %s %s%s%n", outcome.order(), outcome.chunkId(), outcome.status(), detail);
        }
        return 0;
    }
}
