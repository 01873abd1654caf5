package com.netcourier.enrichment.cli;

import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.query.QueryService;
import com.netcourier.enrichment.service.query.RetrievedChunk;
import com.netcourier.enrichment.service.query.openai.OpenAiChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Set;

@Component
public class QueryConsole {

    private static final Logger log = LoggerFactory.getLogger(QueryConsole.class);
    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit", "beenden");

    private final QueryService queryService;

    public QueryConsole(QueryService queryService) {
        this.queryService = queryService;
    }

    public void run(BufferedReader in, PrintStream out) throws IOException {
        out.println("Ask a question about the ingested documents ('exit' to leave).");
        while (true) {
            out.print("> ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                return;
            }
            String question = line.strip();
            if (question.isEmpty()) {
                continue;
            }
            if (EXIT_WORDS.contains(question.toLowerCase(Locale.ROOT))) {
                return;
            }
            try {
                QueryService.Answer answer = queryService.ask(question);
                out.println(answer.text());
                for (RetrievedChunk source : answer.sources()) {
                    out.printf("  - %s (score %.3f)%n", source.source(), source.score());
                }
            } catch (PipelineException | OpenAiChatException ex) {
                log.warn("Question could not be answered: {}", ex.getMessage());
                out.println("Error: " + ex.getMessage());
            }
        }
    }
}
