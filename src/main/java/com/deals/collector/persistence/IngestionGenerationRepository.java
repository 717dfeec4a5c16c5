package com.deals.collector.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface IngestionGenerationRepository extends JpaRepository<IngestionGenerationEntity, String> {

    Optional<IngestionGenerationEntity> findTopByStatusOrderByCompletedAtDesc(GenerationStatus status);

    Optional<IngestionGenerationEntity> findTopByOrderByCompletedAtDesc();
}
