package com.deals.collector.analysis;

import com.deals.collector.history.RankPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RankTrendCalculator Tests")
class RankTrendCalculatorTest {

    private static final LocalDateTime AS_OF = LocalDateTime.of(2024, 6, 1, 0, 0);

    private static RankPoint rank(int daysAgo, long rank) {
        return new RankPoint(AS_OF.minusDays(daysAgo), rank);
    }

    @Test
    @DisplayName("Improving rank gives a positive trend")
    void improvingTrend() {
        List<RankPoint> history = List.of(rank(25, 2000), rank(15, 1000), rank(5, 500));

        Double trend = RankTrendCalculator.trend30d(history, 500L, AS_OF);

        assertThat(trend).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Trend is clamped to -1")
    void trendClamped() {
        List<RankPoint> history = List.of(rank(20, 100), rank(10, 100), rank(1, 100));

        assertThat(RankTrendCalculator.trend30d(history, 10_000L, AS_OF)).isEqualTo(-1.0);
    }

    @Test
    @DisplayName("No rank or no recent history gives no trend")
    void undefinedTrend() {
        assertThat(RankTrendCalculator.trend30d(List.of(rank(5, 100)), null, AS_OF)).isNull();
        assertThat(RankTrendCalculator.trend30d(List.of(rank(60, 100)), 100L, AS_OF)).isNull();
        assertThat(RankTrendCalculator.trend30d(List.of(), 100L, AS_OF)).isNull();
    }

    @Test
    @DisplayName("Counts rank drops within 7 days")
    void countsDrops() {
        List<RankPoint> history = List.of(
                rank(20, 50), rank(6, 900), rank(5, 700), rank(4, 800), rank(3, 600), rank(1, 400));

        assertThat(RankTrendCalculator.drops7d(history, AS_OF)).isEqualTo(3);
        assertThat(RankTrendCalculator.drops7d(List.of(rank(2, 100)), AS_OF)).isZero();
        assertThat(RankTrendCalculator.drops7d(List.of(), AS_OF)).isNull();
    }
}
