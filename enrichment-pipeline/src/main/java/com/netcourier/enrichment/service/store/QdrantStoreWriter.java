package com.netcourier.enrichment.service.store;

import com.netcourier.enrichment.config.PipelineProperties;
import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.model.PipelineStage;
import com.netcourier.enrichment.service.PipelineException;
import com.netcourier.enrichment.service.reconcile.ChunkIdentity;
import com.netcourier.enrichment.service.stage.Deadline;
import com.netcourier.enrichment.service.stage.RetryPolicy;
import com.netcourier.enrichment.service.stage.StageClient;
import com.netcourier.enrichment.service.stage.StageEndpoint;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class QdrantStoreWriter implements StoreWriter {

    private static final Logger log = LoggerFactory.getLogger(QdrantStoreWriter.class);

    private final StageClient stageClient;
    private final PipelineProperties.Endpoint config;
    private final Set<String> knownCollections = ConcurrentHashMap.newKeySet();

    public QdrantStoreWriter(WebClient qdrantWebClient, PipelineProperties properties, MeterRegistry meterRegistry) {
        this.stageClient = new StageClient(qdrantWebClient, RetryPolicy.from(properties.getRetry()), meterRegistry);
        this.config = properties.getStages().getVectorStore();
    }

    @Override
    public void ensureCollection(String collection, int vectorSize, Deadline deadline) {
        if (knownCollections.contains(collection)) {
            return;
        }
        try {
            ExistsResponse exists = stageClient.call(endpoint(HttpMethod.GET, collection + "/exists"), null,
                    ExistsResponse.class, config.getTimeout(), deadline).body();
            if (exists == null || exists.result() == null || !exists.result().exists()) {
                stageClient.call(endpoint(HttpMethod.PUT, collection), new CreateCollectionRequest(new VectorParams(vectorSize, "Cosine")),
                        Map.class, config.getTimeout(), deadline);
                log.info("Created collection {} with vector size {}", collection, vectorSize);
            }
            knownCollections.add(collection);
        } catch (PipelineException ex) {
            throw new PipelineException(ErrorCode.STORE_FAILED, "Failed to prepare collection " + collection + ": " + ex.getMessage(), ex);
        } catch (Exception e) {
            throw new PipelineException(ErrorCode.STORE_FAILED, "Failed to prepare collection " + collection, e);
        }
    }

    @Override
    public void upsert(String collection, String chunkId, List<Double> vector, Map<String, Object> payload, Deadline deadline) {
        Point point = new Point(ChunkIdentity.pointId(chunkId), vector, payload);
        try {
            stageClient.call(endpoint(HttpMethod.PUT, collection + "/points?wait=true"), new UpsertRequest(List.of(point)),
                    Map.class, config.getTimeout(), deadline);
        } catch (PipelineException ex) {
            log.error("Failed to upsert chunk {} into {}: {}", chunkId, collection, ex.getMessage());
            throw new PipelineException(ErrorCode.STORE_FAILED, "Failed to upsert chunk " + chunkId + ": " + ex.getMessage(), ex);
        } catch (Exception e) {
            throw new PipelineException(ErrorCode.STORE_FAILED, "Failed to upsert chunk " + chunkId, e);
        }
    }

    @Override
    public void deleteCollection(String collection) {
        try {
            stageClient.call(endpoint(HttpMethod.DELETE, collection), null, Map.class, config.getTimeout(), Deadline.after(config.getTimeout()));
            knownCollections.remove(collection);
            log.info("Deleted collection {}", collection);
        } catch (PipelineException ex) {
            throw new PipelineException(ErrorCode.STORE_FAILED, "Failed to delete collection " + collection + ": " + ex.getMessage(), ex);
        }
    }

    private StageEndpoint endpoint(HttpMethod method, String suffix) {
        return new StageEndpoint(PipelineStage.STORAGE, method, config.getPath() + "/" + suffix);
    }

    private record Point(String id, List<Double> vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<Point> points) {}

    private record VectorParams(int size, String distance) {}

    private record CreateCollectionRequest(VectorParams vectors) {}

    private record ExistsResult(boolean exists) {}

    private record ExistsResponse(ExistsResult result) {}
}
