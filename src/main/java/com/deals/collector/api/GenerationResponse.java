package com.deals.collector.api;

import com.deals.collector.persistence.IngestionGenerationEntity;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GenerationResponse(
        String generationId,
        String status,
        boolean purge,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        Integer candidateCount,
        Integer recordCount,
        Integer supersededCount,
        Integer unavailableCount,
        Integer unknownCount,
        Integer quotaSkippedCount,
        Integer filteredCount,
        String message) {

    public static GenerationResponse from(IngestionGenerationEntity entity) {
        return new GenerationResponse(
                entity.getGenerationId(),
                entity.getStatus().name(),
                entity.isPurge(),
                entity.getStartedAt(),
                entity.getCompletedAt(),
                entity.getCandidateCount(),
                entity.getRecordCount(),
                entity.getSupersededCount(),
                entity.getUnavailableCount(),
                entity.getUnknownCount(),
                entity.getQuotaSkippedCount(),
                entity.getFilteredCount(),
                entity.getMessage());
    }
}
