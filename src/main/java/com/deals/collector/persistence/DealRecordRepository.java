package com.deals.collector.persistence;

import com.deals.collector.service.DealCategory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DealRecordRepository extends JpaRepository<DealRecordEntity, Long> {

    List<DealRecordEntity> findByActiveTrue();

    List<DealRecordEntity> findByActiveTrue(Pageable pageable);

    List<DealRecordEntity> findByActiveTrueAndCategory(DealCategory category, Pageable pageable);

    /**
     * Best active record for an ASIN listed under several categories.
     */
    Optional<DealRecordEntity> findFirstByAsinAndActiveTrueOrderByScoreDesc(String asin);

    List<DealRecordEntity> findByGenerationId(String generationId);

    long countByActiveTrue();

    /**
     * Retire the current generation. Bulk update - does NOT load entities into memory.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DealRecordEntity d SET d.active = false WHERE d.active = true")
    int deactivateAll();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM DealRecordEntity d")
    int deleteAllRecords();
}
