package com.deals.collector.service;

import com.deals.collector.analysis.DealRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything one cycle hands to the {@link SnapshotWriter}.
 */
@Value
@Builder
public class GenerationCommit {

    String generationId;
    LocalDateTime startedAt;

    @Builder.Default
    List<DealRecord> records = List.of();

    /**
     * ASINs reported unknown during the cycle, with the provider's reason.
     */
    @Builder.Default
    Map<String, String> unknownAsins = Map.of();

    @Builder.Default
    CycleStats stats = CycleStats.EMPTY;
}
