package com.deals.collector.service;

import com.deals.collector.analysis.DealRecord;
import com.deals.collector.persistence.DealRecordEntity;
import com.deals.collector.persistence.DealRecordRepository;
import com.deals.collector.persistence.ExcludedProductEntity;
import com.deals.collector.persistence.ExcludedProductRepository;
import com.deals.collector.persistence.GenerationStatus;
import com.deals.collector.persistence.IngestionGenerationEntity;
import com.deals.collector.persistence.IngestionGenerationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Commits a cycle's records as one generation, in a single transaction:
 *
 * Retain mode: retire every active row, insert the new rows active.
 * Purge mode:  delete every row, insert the new rows active.
 *
 * Unknown ASINs and the generation row are written in the same transaction, so a failure
 * leaves the store exactly as it was.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SnapshotWriter {

    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final DealRecordRepository dealRepository;
    private final IngestionGenerationRepository generationRepository;
    private final ExcludedProductRepository excludedRepository;
    private final Clock clock;

    @Value("${deals.snapshot.purge:false}")
    private boolean purge;

    // Self-injection so the commit runs through the transactional proxy
    @Autowired
    @Lazy
    private SnapshotWriter self;

    public boolean isPurge() {
        return purge;
    }

    /**
     * @throws CommitFailureException when the generation is rejected or the transaction rolls back
     */
    public CommitResult commit(GenerationCommit generation) {
        String generationId = generation.getGenerationId();
        validateUnique(generation);

        log.info("Committing generation {}: {} records ({} mode)",
                generationId, generation.getRecords().size(), purge ? "purge" : "retain");

        try {
            CommitResult result = self.commitInTransaction(generation);
            log.info("Generation {} committed: {} inserted, {} superseded, {} excluded",
                    generationId, result.inserted(), result.superseded(), result.excluded());
            return result;
        } catch (RuntimeException e) {
            log.error("Commit of generation {} rolled back: {}", generationId, e.getMessage(), e);
            throw new CommitFailureException(generationId, "Commit rolled back: " + e.getMessage(), e);
        }
    }

    @Transactional
    public CommitResult commitInTransaction(GenerationCommit generation) {
        String generationId = generation.getGenerationId();
        LocalDateTime committedAt = LocalDateTime.now(clock);

        // publishedAt survives only for pairs that are active right now
        Map<String, LocalDateTime> publishedAt = new HashMap<>();
        for (DealRecordEntity previous : dealRepository.findByActiveTrue()) {
            publishedAt.merge(key(previous.getAsin(), previous.getCategory()), previous.getPublishedAt(),
                    (a, b) -> a.isBefore(b) ? a : b);
        }

        int superseded = purge ? dealRepository.deleteAllRecords() : dealRepository.deactivateAll();

        List<DealRecordEntity> entities = new ArrayList<>(generation.getRecords().size());
        for (DealRecord record : generation.getRecords()) {
            LocalDateTime published = publishedAt.getOrDefault(key(record.getAsin(), record.getCategory()), committedAt);
            entities.add(toEntity(record, generationId, published));
        }
        dealRepository.saveAll(entities);
        dealRepository.flush();

        int excluded = saveExclusions(generation, committedAt);

        CycleStats stats = generation.getStats();
        generationRepository.save(IngestionGenerationEntity.builder()
                .generationId(generationId)
                .startedAt(generation.getStartedAt())
                .completedAt(committedAt)
                .status(GenerationStatus.COMMITTED)
                .purge(purge)
                .candidateCount(stats.candidates())
                .recordCount(entities.size())
                .supersededCount(superseded)
                .unavailableCount(stats.unavailable())
                .unknownCount(stats.unknown())
                .quotaSkippedCount(stats.quotaSkipped())
                .filteredCount(stats.filtered())
                .build());

        return new CommitResult(generationId, entities.size(), superseded, excluded, committedAt);
    }

    /**
     * Record a cycle that ended without a committed generation, keeping its unknown ASINs
     * excluded. Runs in its own transaction because the cycle's commit, if any, has already
     * been rolled back.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(GenerationCommit generation, String message) {
        LocalDateTime completedAt = LocalDateTime.now(clock);
        saveExclusions(generation, completedAt);

        CycleStats stats = generation.getStats();
        generationRepository.save(IngestionGenerationEntity.builder()
                .generationId(generation.getGenerationId())
                .startedAt(generation.getStartedAt())
                .completedAt(completedAt)
                .status(GenerationStatus.FAILED)
                .purge(purge)
                .candidateCount(stats.candidates())
                .recordCount(0)
                .supersededCount(0)
                .unavailableCount(stats.unavailable())
                .unknownCount(stats.unknown())
                .quotaSkippedCount(stats.quotaSkipped())
                .filteredCount(stats.filtered())
                .message(truncate(message, MAX_MESSAGE_LENGTH))
                .build());
    }

    private int saveExclusions(GenerationCommit generation, LocalDateTime excludedAt) {
        List<ExcludedProductEntity> excluded = new ArrayList<>();
        for (Map.Entry<String, String> unknown : generation.getUnknownAsins().entrySet()) {
            if (!excludedRepository.existsById(unknown.getKey())) {
                excluded.add(ExcludedProductEntity.builder()
                        .asin(unknown.getKey())
                        .excludedAt(excludedAt)
                        .generationId(generation.getGenerationId())
                        .reason(truncate(unknown.getValue(), 500))
                        .build());
            }
        }
        excludedRepository.saveAll(excluded);
        return excluded.size();
    }

    private void validateUnique(GenerationCommit generation) {
        Set<String> seen = new HashSet<>();
        for (DealRecord record : generation.getRecords()) {
            if (!seen.add(key(record.getAsin(), record.getCategory()))) {
                throw new CommitFailureException(generation.getGenerationId(),
                        "Duplicate record for " + record.getAsin() + " in " + record.getCategory());
            }
        }
    }

    private DealRecordEntity toEntity(DealRecord record, String generationId, LocalDateTime publishedAt) {
        return DealRecordEntity.builder()
                .generationId(generationId)
                .asin(record.getAsin())
                .category(record.getCategory())
                .title(record.getTitle())
                .brand(record.getBrand())
                .imageUrl(record.getImageUrl())
                .amazonUrl(record.getAmazonUrl())
                .priceCurrent(record.getPriceCurrent())
                .priceMedian90d(record.getPriceMedian90d())
                .discountPct90d(record.getDiscountPct90d())
                .priceStability(record.getPriceStability())
                .sampleCount(record.getSampleCount())
                .stale(record.isStale())
                .confidence(record.getConfidence())
                .score(record.getScore())
                .salesRankCurrent(record.getSalesRankCurrent())
                .salesRankTrend30d(record.getSalesRankTrend30d())
                .rankDrops7d(record.getRankDrops7d())
                .rating(record.getRating())
                .reviewCount(record.getReviewCount())
                .demandScore(record.getDemandScore())
                .hotScore(record.getHotScore())
                .active(true)
                .ingestedAt(record.getIngestedAt())
                .publishedAt(publishedAt)
                .build();
    }

    private static String key(String asin, DealCategory category) {
        return asin + "|" + category;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
