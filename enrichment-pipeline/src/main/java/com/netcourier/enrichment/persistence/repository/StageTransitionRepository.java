package com.netcourier.enrichment.persistence.repository;

import com.netcourier.enrichment.persistence.entity.StageTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface StageTransitionRepository extends JpaRepository<StageTransitionEntity, Long> {

    List<StageTransitionEntity> findByRunIdOrderByIdAsc(String runId);
}
