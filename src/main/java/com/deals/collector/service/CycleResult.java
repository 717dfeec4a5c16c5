package com.deals.collector.service;

/**
 * Outcome of one ingestion cycle.
 *
 * @param generationId null when the cycle was skipped
 * @param records      records committed, 0 unless COMMITTED
 */
public record CycleResult(CycleStatus status, String generationId, CycleStats stats, int records,
                          String message, long durationMs) {

    public static CycleResult skipped() {
        return new CycleResult(CycleStatus.SKIPPED, null, CycleStats.EMPTY, 0, "Cycle already running", 0);
    }

    /**
     * True for cycles that ended without a generation for a reason an operator should hear
     * about. A skipped cycle is not one of them.
     */
    public boolean needsAttention() {
        return status == CycleStatus.FAILED || status == CycleStatus.ABORTED;
    }

    public String summary() {
        return String.format("%s %s: %d records, %d candidates, %d unavailable, %d unknown, %d quota-skipped, %d filtered (%d ms)%s",
                status, generationId == null ? "-" : generationId, records, stats.candidates(),
                stats.unavailable(), stats.unknown(), stats.quotaSkipped(), stats.filtered(), durationMs,
                message == null ? "" : " - " + message);
    }
}
