package com.deals.collector.service;

import com.deals.collector.BaseIntegrationTest;
import com.deals.collector.analysis.DealRecord;
import com.deals.collector.persistence.DealRecordEntity;
import com.deals.collector.persistence.GenerationStatus;
import com.deals.collector.persistence.IngestionGenerationEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.deals.collector.service.TestDeals.deal;
import static com.deals.collector.service.TestDeals.generation;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SnapshotWriter Tests")
class SnapshotWriterTest extends BaseIntegrationTest {

    @Autowired
    private SnapshotWriter snapshotWriter;

    @BeforeEach
    void setUp() {
        clearStore();
    }

    private List<String> activeKeys() {
        return dealRepository.findByActiveTrue().stream()
                .map(e -> e.getAsin() + "|" + e.getCategory())
                .sorted()
                .toList();
    }

    private DealRecordEntity activeRow(String asin) {
        return dealRepository.findFirstByAsinAndActiveTrueOrderByScoreDesc(asin).orElseThrow();
    }

    @Nested
    @DisplayName("Retain mode")
    class RetainModeTests {

        @Test
        @DisplayName("New generation replaces the active set and keeps old rows inactive")
        void replacesActiveSet() {
            snapshotWriter.commit(generation("gen-1",
                    deal("B0TEST0001", DealCategory.HOME, 60),
                    deal("B0TEST0002", DealCategory.TOYS, 50)));

            CommitResult result = snapshotWriter.commit(generation("gen-2",
                    deal("B0TEST0001", DealCategory.HOME, 65),
                    deal("B0TEST0003", DealCategory.DIY, 40)));

            assertThat(snapshotWriter.isPurge()).isFalse();
            assertThat(result.inserted()).isEqualTo(2);
            assertThat(result.superseded()).isEqualTo(2);
            assertThat(activeKeys()).containsExactly("B0TEST0001|HOME", "B0TEST0003|DIY");
            assertThat(dealRepository.findByActiveTrue()).allMatch(e -> e.getGenerationId().equals("gen-2"));
            assertThat(dealRepository.count()).isEqualTo(4);
            assertThat(dealRepository.findByGenerationId("gen-1")).noneMatch(DealRecordEntity::isActive);
        }

        @Test
        @DisplayName("Published time survives while the pair stays active")
        void publishedAtPreserved() {
            snapshotWriter.commit(generation("gen-1", deal("B0TEST0001", DealCategory.HOME, 60)));
            LocalDateTime firstPublished = activeRow("B0TEST0001").getPublishedAt();

            snapshotWriter.commit(generation("gen-2", deal("B0TEST0001", DealCategory.HOME, 70)));

            DealRecordEntity current = activeRow("B0TEST0001");
            assertThat(current.getGenerationId()).isEqualTo("gen-2");
            assertThat(current.getScore()).isEqualTo(70.0);
            assertThat(current.getPublishedAt()).isEqualTo(firstPublished);
        }

        @Test
        @DisplayName("Published time restarts after the pair drops out")
        void publishedAtReset() {
            snapshotWriter.commit(generation("gen-1", deal("B0TEST0001", DealCategory.HOME, 60)));
            snapshotWriter.commit(generation("gen-2", deal("B0TEST0002", DealCategory.HOME, 60)));

            CommitResult third = snapshotWriter.commit(generation("gen-3", deal("B0TEST0001", DealCategory.HOME, 60)));

            assertThat(activeRow("B0TEST0001").getPublishedAt())
                    .isCloseTo(third.committedAt(), within(1, ChronoUnit.MILLIS));
        }

        @Test
        @DisplayName("Committed generation is recorded with its counters")
        void generationRecorded() {
            GenerationCommit commit = GenerationCommit.builder()
                    .generationId("gen-1")
                    .startedAt(LocalDateTime.of(2024, 6, 1, 12, 0))
                    .records(List.of(deal("B0TEST0001", DealCategory.HOME, 60)))
                    .unknownAsins(Map.of("B0GONE0001", "Keepa has no data"))
                    .stats(new CycleStats(4, 2, 1, 0, 0))
                    .build();

            CommitResult result = snapshotWriter.commit(commit);

            Optional<IngestionGenerationEntity> current =
                    generationRepository.findTopByStatusOrderByCompletedAtDesc(GenerationStatus.COMMITTED);
            assertThat(current).isPresent();
            assertThat(current.get().getGenerationId()).isEqualTo("gen-1");
            assertThat(current.get().getRecordCount()).isEqualTo(1);
            assertThat(current.get().getCandidateCount()).isEqualTo(4);
            assertThat(current.get().getUnavailableCount()).isEqualTo(2);
            assertThat(result.excluded()).isEqualTo(1);
            assertThat(excludedRepository.findAllAsins()).containsExactly("B0GONE0001");
        }
    }

    @Nested
    @DisplayName("Atomicity")
    class AtomicityTests {

        @Test
        @DisplayName("Failure mid-commit leaves the previous generation untouched")
        void rollbackOnFailure() {
            snapshotWriter.commit(generation("gen-1",
                    deal("B0TEST0001", DealCategory.HOME, 60),
                    deal("B0TEST0002", DealCategory.TOYS, 50)));

            DealRecord broken = deal("B0TEST0004", DealCategory.HOME, 30);
            broken.setCategory(null);
            GenerationCommit failing = GenerationCommit.builder()
                    .generationId("gen-2")
                    .startedAt(LocalDateTime.of(2024, 6, 2, 12, 0))
                    .records(List.of(deal("B0TEST0003", DealCategory.DIY, 80), broken))
                    .unknownAsins(Map.of("B0GONE0001", "unknown"))
                    .build();

            assertThatThrownBy(() -> snapshotWriter.commit(failing))
                    .isInstanceOf(CommitFailureException.class)
                    .extracting("generationId").isEqualTo("gen-2");

            assertThat(activeKeys()).containsExactly("B0TEST0001|HOME", "B0TEST0002|TOYS");
            assertThat(dealRepository.findByGenerationId("gen-2")).isEmpty();
            assertThat(excludedRepository.count()).isZero();
            assertThat(generationRepository.findTopByStatusOrderByCompletedAtDesc(GenerationStatus.COMMITTED)
                    .map(IngestionGenerationEntity::getGenerationId)).contains("gen-1");
        }

        @Test
        @DisplayName("Duplicate pairs are rejected before touching the store")
        void duplicatesRejected() {
            snapshotWriter.commit(generation("gen-1", deal("B0TEST0001", DealCategory.HOME, 60)));

            assertThatThrownBy(() -> snapshotWriter.commit(generation("gen-2",
                    deal("B0TEST0002", DealCategory.HOME, 60),
                    deal("B0TEST0002", DealCategory.HOME, 61))))
                    .isInstanceOf(CommitFailureException.class);

            assertThat(activeKeys()).containsExactly("B0TEST0001|HOME");
        }

        @Test
        @DisplayName("Same product in two categories is allowed")
        void sameAsinDifferentCategories() {
            snapshotWriter.commit(generation("gen-1",
                    deal("B0TEST0001", DealCategory.HOME, 60),
                    deal("B0TEST0001", DealCategory.KITCHEN, 70)));

            assertThat(activeKeys()).containsExactly("B0TEST0001|HOME", "B0TEST0001|KITCHEN");
            assertThat(activeRow("B0TEST0001").getCategory()).isEqualTo(DealCategory.KITCHEN);
        }

        @Test
        @DisplayName("Failed cycle is recorded without changing the active set")
        void recordFailure() {
            snapshotWriter.commit(generation("gen-1", deal("B0TEST0001", DealCategory.HOME, 60)));

            GenerationCommit failed = GenerationCommit.builder()
                    .generationId("gen-2")
                    .startedAt(LocalDateTime.of(2024, 6, 2, 12, 0))
                    .unknownAsins(Map.of("B0GONE0001", "unknown"))
                    .stats(new CycleStats(3, 2, 1, 0, 0))
                    .build();
            snapshotWriter.recordFailure(failed, "upstream down");

            IngestionGenerationEntity row = generationRepository.findById("gen-2").orElseThrow();
            assertThat(row.getStatus()).isEqualTo(GenerationStatus.FAILED);
            assertThat(row.getMessage()).isEqualTo("upstream down");
            assertThat(excludedRepository.findAllAsins()).containsExactly("B0GONE0001");
            assertThat(activeKeys()).containsExactly("B0TEST0001|HOME");
            assertThat(generationRepository.findTopByStatusOrderByCompletedAtDesc(GenerationStatus.COMMITTED)
                    .map(IngestionGenerationEntity::getGenerationId)).contains("gen-1");
        }
    }
}
