package com.netcourier.enrichment.cli;

import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.query.QueryService;
import com.netcourier.enrichment.service.query.RetrievedChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryConsoleTest {

    @Mock
    private QueryService queryService;

    private QueryConsole console;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        console = new QueryConsole(queryService);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @Test
    void printsAnswerWithSources() throws Exception {
        RetrievedChunk hit = new RetrievedChunk("c1", "doc-1", "terms.pdf", "Payment is due within 30 days.", null, 0.87);
        when(queryService.ask("When is payment due?"))
                .thenReturn(new QueryService.Answer("Within 30 days.", List.of(hit)));

        console.run(input("When is payment due?\nexit\n"), out);

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("Within 30 days.");
        assertThat(printed).contains(String.format("  - terms.pdf (score %.3f)", 0.87));
    }

    @Test
    void skipsBlankLinesAndStopsOnExitWord() throws Exception {
        console.run(input("\n   \nBEENDEN\nnever asked\n"), out);

        verifyNoInteractions(queryService);
    }

    @Test
    void endsAtEndOfInput() throws Exception {
        console.run(input(""), out);

        assertThat(buffer.toString(StandardCharsets.UTF_8)).startsWith("Ask a question");
        verifyNoInteractions(queryService);
    }

    @Test
    void reportsFailureAndKeepsAsking() throws Exception {
        when(queryService.ask("first"))
                .thenThrow(new PipelineException(ErrorCode.STAGE_UNREACHABLE, "embedding service down"));
        when(queryService.ask("second"))
                .thenReturn(new QueryService.Answer("Second answer.", List.of()));

        console.run(input("first\nsecond\nquit\n"), out);

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("Error: embedding service down");
        assertThat(printed).contains("Second answer.");
        verify(queryService).ask("second");
    }

    private static BufferedReader input(String text) {
        return new BufferedReader(new StringReader(text));
    }
}
