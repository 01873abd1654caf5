package com.netcourier.enrichment.service.stage;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.LayoutBlock;
import com.netcourier.enrichment.model.PipelineStage;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class WebClientStructuringClient implements StructuringClient {

    private static final Logger log = LoggerFactory.getLogger(WebClientStructuringClient.class);
    private static final ParameterizedTypeReference<List<BlockResponse>> BLOCKS = new ParameterizedTypeReference<>() {};

    private final StageClient stageClient;
    private final StageEndpoint endpoint;
    private final PipelineProperties properties;

    public WebClientStructuringClient(WebClient structuringWebClient,
                                      PipelineProperties properties,
                                      MeterRegistry meterRegistry) {
        this.stageClient = new StageClient(structuringWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.endpoint = StageEndpoint.post(PipelineStage.STRUCTURING, properties.getStages().getStructuring().getPath());
        this.properties = properties;
    }

    @Override
    public StageResponse<StructuredText> structure(String fileName, byte[] pdf, Deadline deadline) {
        MultipartBodyBuilder multipart = new MultipartBodyBuilder();
        multipart.part("file", pdf)
                .filename(fileName)
                .contentType(MediaType.APPLICATION_PDF);
        StageResponse<List<BlockResponse>> response = stageClient.call(endpoint, multipart.build(), BLOCKS,
                properties.getStages().getStructuring().getTimeout(), deadline);

        List<LayoutBlock> blocks = new ArrayList<>();
        if (response.body() != null) {
            for (BlockResponse block : response.body()) {
                if (block != null && block.type() != null) {
                    blocks.add(new LayoutBlock(block.type(), block.text() == null ? "" : block.text(), block.pageNumber()));
                }
            }
        }
        Set<String> textTypes = new HashSet<>(properties.getStructuring().getTextTypes());
        String text = blocks.stream()
                .filter(block -> textTypes.contains(block.type()))
                .map(LayoutBlock::text)
                .map(String::strip)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining("\n\n"));
        if (text.isBlank()) {
            throw new StageException(PipelineStage.STRUCTURING, ErrorCode.STAGE_REJECTED, response.attempts(),
                    "Structuring returned no text-bearing blocks for " + fileName);
        }
        log.debug("Structured {} into {} blocks ({} characters of text)", fileName, blocks.size(), text.length());
        return new StageResponse<>(new StructuredText(blocks, text), response.attempts());
    }

    private record BlockResponse(String type, String text, BlockMetadata metadata) {

        Integer pageNumber() {
            return metadata == null ? null : metadata.pageNumber();
        }
    }

    private record BlockMetadata(@JsonProperty("page_number") Integer pageNumber) {}
}
