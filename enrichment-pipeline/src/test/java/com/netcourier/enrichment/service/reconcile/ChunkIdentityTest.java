package com.netcourier.enrichment.service.reconcile;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkIdentityTest {

    @Test
    void identifiersAreStableAcrossRuns() {
        byte[] pdf = "%PDF-1.7 sample".getBytes(StandardCharsets.US_ASCII);

        String documentId = ChunkIdentity.documentId(pdf);

        assertThat(documentId).isEqualTo(ChunkIdentity.documentId(pdf.clone())).startsWith("doc-").hasSize(20);
        assertThat(ChunkIdentity.chunkId(documentId, 1, "Some  text\n here"))
                .isEqualTo(ChunkIdentity.chunkId(documentId, 1, "some text here"))
                .hasSize(64);
    }

    @Test
    void orderIsPartOfTheChunkIdentity() {
        assertThat(ChunkIdentity.chunkId("doc-1", 1, "Same text"))
                .isNotEqualTo(ChunkIdentity.chunkId("doc-1", 2, "Same text"));
    }

    @Test
    void pointIdIsAUuidDerivedFromTheChunkId() {
        String pointId = ChunkIdentity.pointId("abc");

        assertThat(UUID.fromString(pointId)).isNotNull();
        assertThat(pointId).isEqualTo(ChunkIdentity.pointId("abc"));
    }
}
