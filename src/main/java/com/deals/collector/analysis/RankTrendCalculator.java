package com.deals.collector.analysis;

import com.deals.collector.history.RankPoint;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Sales rank movement: trend against the 30 day median and the number of recent rank improvements.
 */
public class RankTrendCalculator {

    private static final int TREND_DAYS = 30;
    private static final int DROPS_DAYS = 7;

    private RankTrendCalculator() {}

    /**
     * (median30d - current) / median30d clamped to [-1, 1]; positive means the rank is improving.
     */
    public static Double trend30d(List<RankPoint> history, Long currentRank, LocalDateTime asOf) {
        if (currentRank == null || history.isEmpty()) {
            return null;
        }
        List<Long> ranks = ranksSince(history, asOf.minusDays(TREND_DAYS));
        if (ranks.isEmpty()) {
            return null;
        }
        ranks.sort(null);
        int mid = ranks.size() / 2;
        double median = ranks.size() % 2 == 1
                ? ranks.get(mid)
                : (ranks.get(mid - 1) + ranks.get(mid)) / 2.0;
        if (median <= 0) {
            return null;
        }
        double trend = (median - currentRank) / median;
        return Math.max(-1.0, Math.min(1.0, trend));
    }

    /**
     * Number of times the rank number went down within the last 7 days.
     */
    public static Integer drops7d(List<RankPoint> history, LocalDateTime asOf) {
        if (history.isEmpty()) {
            return null;
        }
        List<Long> ranks = ranksSince(history, asOf.minusDays(DROPS_DAYS));
        int drops = 0;
        for (int i = 1; i < ranks.size(); i++) {
            if (ranks.get(i) < ranks.get(i - 1)) {
                drops++;
            }
        }
        return drops;
    }

    private static List<Long> ranksSince(List<RankPoint> history, LocalDateTime since) {
        List<Long> ranks = new ArrayList<>();
        for (RankPoint point : history) {
            if (!point.timestamp().isBefore(since) && point.rank() > 0) {
                ranks.add(point.rank());
            }
        }
        return ranks;
    }
}
