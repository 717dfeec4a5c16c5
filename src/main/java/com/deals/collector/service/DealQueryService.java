package com.deals.collector.service;

import com.deals.collector.persistence.DealRecordEntity;
import com.deals.collector.persistence.DealRecordRepository;
import com.deals.collector.persistence.GenerationStatus;
import com.deals.collector.persistence.IngestionGenerationEntity;
import com.deals.collector.persistence.IngestionGenerationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the store. Only rows of the current generation are ever returned.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DealQueryService {

    public enum DealSort {
        /**
         * Hot score, then deal score.
         */
        HOT,
        /**
         * Deal score only.
         */
        DEAL
    }

    private final DealRecordRepository dealRepository;
    private final IngestionGenerationRepository generationRepository;

    public List<DealRecordEntity> listDeals(DealCategory category, DealSort sort, int limit) {
        Sort order = sort == DealSort.DEAL
                ? Sort.by(Sort.Order.desc("score"), Sort.Order.asc("asin"))
                : Sort.by(Sort.Order.desc("hotScore"), Sort.Order.desc("score"), Sort.Order.asc("asin"));
        PageRequest page = PageRequest.of(0, limit, order);

        return category == null
                ? dealRepository.findByActiveTrue(page)
                : dealRepository.findByActiveTrueAndCategory(category, page);
    }

    /**
     * Highest-scoring active record for the product, across its categories.
     */
    public Optional<DealRecordEntity> findDeal(String asin) {
        return dealRepository.findFirstByAsinAndActiveTrueOrderByScoreDesc(asin);
    }

    public Optional<IngestionGenerationEntity> currentGeneration() {
        return generationRepository.findTopByStatusOrderByCompletedAtDesc(GenerationStatus.COMMITTED);
    }
}
