package com.deals.collector.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outcome of one ingestion cycle. The latest COMMITTED row identifies the current generation.
 */
@Entity
@Table(name = "ingestion_generation", indexes = {
    @Index(name = "idx_generation_status_completed", columnList = "status, completed_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionGenerationEntity {

    @Id
    @Column(name = "generation_id", length = 36)
    private String generationId;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "completed_at", nullable = false)
    private LocalDateTime completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GenerationStatus status;

    @Column(name = "purge_mode", nullable = false)
    private boolean purge;

    @Column(name = "candidate_count")
    private Integer candidateCount;

    @Column(name = "record_count")
    private Integer recordCount;

    /**
     * Previously active rows retired (retain mode) or deleted (purge mode).
     */
    @Column(name = "superseded_count")
    private Integer supersededCount;

    @Column(name = "unavailable_count")
    private Integer unavailableCount;

    @Column(name = "unknown_count")
    private Integer unknownCount;

    @Column(name = "quota_skipped_count")
    private Integer quotaSkippedCount;

    @Column(name = "filtered_count")
    private Integer filteredCount;

    @Column(name = "message", length = 1000)
    private String message;
}
