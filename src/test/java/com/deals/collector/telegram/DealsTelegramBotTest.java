package com.deals.collector.telegram;

import com.deals.collector.persistence.DealRecordEntity;
import com.deals.collector.persistence.DealRecordRepository;
import com.deals.collector.persistence.GenerationStatus;
import com.deals.collector.persistence.IngestionGenerationEntity;
import com.deals.collector.persistence.IngestionGenerationRepository;
import com.deals.collector.service.DealCategory;
import com.deals.collector.service.IngestionCycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("DealsTelegramBot Tests")
class DealsTelegramBotTest {

    private IngestionCycleService cycleService;
    private DealRecordRepository dealRepository;
    private IngestionGenerationRepository generationRepository;
    private DealsTelegramBot bot;

    @BeforeEach
    void setUp() {
        cycleService = mock(IngestionCycleService.class);
        dealRepository = mock(DealRecordRepository.class);
        generationRepository = mock(IngestionGenerationRepository.class);
        bot = new DealsTelegramBot(cycleService, dealRepository, generationRepository);
    }

    @Test
    @DisplayName("Start lists the commands")
    void start() {
        String response = bot.processCommand("/start");

        assertThat(response).contains("/status", "/run", "/cancel", "/top");
    }

    @Test
    @DisplayName("Cancel reports whether a cycle was running")
    void cancel() {
        when(cycleService.requestCancel()).thenReturn(true, false);

        assertThat(bot.processCommand("/cancel")).startsWith("Cancellation requested");
        assertThat(bot.processCommand("/cancel")).isEqualTo("No cycle is running.");
    }

    @Test
    @DisplayName("Run refuses while a cycle is in progress")
    void runWhileRunning() {
        when(cycleService.isRunning()).thenReturn(true);

        assertThat(bot.processCommand("/run")).isEqualTo("A cycle is already running.");
        verify(cycleService, never()).runCycle();
    }

    @Test
    @DisplayName("Top rejects an unknown category")
    void topUnknownCategory() {
        assertThat(bot.processCommand("/top music")).isEqualTo("Unknown category: music");
    }

    @Test
    @DisplayName("Top lists the category's deals")
    void topByCategory() {
        DealRecordEntity deal = DealRecordEntity.builder()
                .asin("B0TEST0001")
                .category(DealCategory.TOYS)
                .title("Building Blocks")
                .amazonUrl("https://www.amazon.co.uk/dp/B0TEST0001")
                .priceCurrent(new BigDecimal("12.50"))
                .discountPct90d(0.3)
                .score(72.0)
                .hotScore(65.0)
                .build();
        when(dealRepository.findByActiveTrueAndCategory(eq(DealCategory.TOYS), any())).thenReturn(List.of(deal));

        String response = bot.processCommand("/top toys");

        assertThat(response).contains("1. Building Blocks", "£12.50", "(-30%)", "https://www.amazon.co.uk/dp/B0TEST0001");
    }

    @Test
    @DisplayName("Top shows a price above the median as a positive change")
    void topPriceAboveMedian() {
        DealRecordEntity deal = DealRecordEntity.builder()
                .asin("B0TEST0002")
                .category(DealCategory.PET)
                .title("Cat Tree")
                .amazonUrl("https://www.amazon.co.uk/dp/B0TEST0002")
                .priceCurrent(new BigDecimal("56.00"))
                .discountPct90d(-0.12)
                .score(30.0)
                .hotScore(30.0)
                .build();
        when(dealRepository.findByActiveTrue(any())).thenReturn(List.of(deal));

        String response = bot.processCommand("/top");

        assertThat(response).contains("(+12%)").doesNotContain("--");
    }

    @Test
    @DisplayName("Price change is signed against the median")
    void formatChange() {
        assertThat(DealsTelegramBot.formatChange(0.25)).isEqualTo(" (-25%)");
        assertThat(DealsTelegramBot.formatChange(-0.12)).isEqualTo(" (+12%)");
        assertThat(DealsTelegramBot.formatChange(0.0)).isEqualTo(" (+0%)");
        assertThat(DealsTelegramBot.formatChange(null)).isEmpty();
    }

    @Test
    @DisplayName("Status shows the current generation and a failed attempt")
    void status() {
        IngestionGenerationEntity committed = IngestionGenerationEntity.builder()
                .generationId("gen-1")
                .status(GenerationStatus.COMMITTED)
                .completedAt(LocalDateTime.of(2024, 6, 1, 12, 0))
                .recordCount(3)
                .candidateCount(5)
                .build();
        IngestionGenerationEntity failed = IngestionGenerationEntity.builder()
                .generationId("gen-2")
                .status(GenerationStatus.FAILED)
                .completedAt(LocalDateTime.of(2024, 6, 1, 18, 0))
                .message("Keepa unavailable")
                .build();
        when(dealRepository.countByActiveTrue()).thenReturn(3L);
        when(generationRepository.findTopByStatusOrderByCompletedAtDesc(GenerationStatus.COMMITTED))
                .thenReturn(Optional.of(committed));
        when(generationRepository.findTopByOrderByCompletedAtDesc()).thenReturn(Optional.of(failed));

        String response = bot.processCommand("/status");

        assertThat(response).contains("Active deals: 3", "Generation: gen-1", "2024-06-01 12:00",
                "Records: 3 of 5", "Last attempt FAILED: Keepa unavailable");
    }

    @Test
    @DisplayName("Unknown command")
    void unknown() {
        assertThat(bot.processCommand("/help")).startsWith("Unknown command");
    }
}
