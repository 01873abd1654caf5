package com.netcourier.enrichment.persistence.repository;

import com.netcourier.enrichment.persistence.entity.ChunkOutcomeEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ChunkOutcomeRepository extends JpaRepository<ChunkOutcomeEntity, Long> {

    List<ChunkOutcomeEntity> findByRunIdOrderByChunkOrderAsc(String runId);
}
