package com.netcourier.enrichment.persistence.repository;

import com.netcourier.enrichment.persistence.entity.PipelineRunEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PipelineRunRepository extends JpaRepository<PipelineRunEntity, String> {

    Optional<PipelineRunEntity> findTopByDocumentIdOrderByStartedAtDesc(String documentId);
}
