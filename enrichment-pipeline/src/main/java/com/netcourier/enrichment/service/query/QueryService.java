package com.netcourier.enrichment.service.query;

import com.netcourier.enrichment.service.query.openai.OpenAiChatClient;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.EmbeddingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);
    static final String NO_CONTEXT_ANSWER = "No stored passage matches this question.";

    private final EmbeddingClient embeddingClient;
    private final QdrantChunkRetriever retriever;
    private final OpenAiChatClient chatClient;
    private final String model;
    private final String systemPrompt;
    private final Duration timeout;

    public QueryService(EmbeddingClient embeddingClient,
                        QdrantChunkRetriever retriever,
                        OpenAiChatClient chatClient,
                        @Value("${chat.llm.model:llama3}") String model,
                        @Value("${chat.llm.system-prompt:Answer only from the provided context. If the context does not contain the answer, say so.}") String systemPrompt,
                        @Value("${chat.query.timeout-seconds:120}") long timeoutSeconds) {
        this.embeddingClient = embeddingClient;
        this.retriever = retriever;
        this.chatClient = chatClient;
        this.model = model;
        this.systemPrompt = systemPrompt;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
    }

    public Answer ask(String question) {
        Deadline deadline = Deadline.after(timeout);
        List<Double> vector = embeddingClient.embedQuery(question, deadline).body();
        List<RetrievedChunk> hits = retriever.search(vector, deadline);
        if (hits.isEmpty()) {
            log.info("No passages found for question '{}'", question);
            return new Answer(NO_CONTEXT_ANSWER, List.of());
        }
        OpenAiChatClient.Request request = new OpenAiChatClient.Request(model, List.of(
                new OpenAiChatClient.Message("system", systemPrompt),
                new OpenAiChatClient.Message("user", groundedPrompt(question, hits))), 0.1, null);
        String answer = chatClient.complete(request).firstChoice().message().content();
        return new Answer(answer == null ? "" : answer.strip(), hits);
    }

    String groundedPrompt(String question, List<RetrievedChunk> hits) {
        StringBuilder prompt = new StringBuilder("Context:\n");
        for (int i = 0; i < hits.size(); i++) {
            RetrievedChunk hit = hits.get(i);
            prompt.append('[').append(i + 1).append("] (").append(hit.source()).append(") ")
                    .append(hit.text()).append("\n\n");
        }
        prompt.append("Question: ").append(question);
        return prompt.toString();
    }

    public record Answer(String text, List<RetrievedChunk> sources) {}
}
