package com.deals.collector.keepa;

import com.deals.collector.config.IngestionProperties;
import com.deals.collector.history.UpstreamQuotaExceededException;
import com.google.common.util.concurrent.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Global ceiling on Keepa calls. Every request takes a rate permit and counts against the
 * per-cycle call budget, whether it browses deals, lists categories or fetches a product.
 *
 * Once the budget is spent, no permit arrives within the timeout or Keepa answers 429, the
 * quota stays exhausted until the next cycle starts.
 */
@Component
@Slf4j
public class KeepaQuota {

    private final RateLimiter rateLimiter;
    private final Duration permitTimeout;
    private final int maxCallsPerCycle;

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean exhausted = new AtomicBoolean(false);

    public KeepaQuota(IngestionProperties properties) {
        // Shared across cycles, Keepa refills tokens per minute
        this.rateLimiter = RateLimiter.create(properties.getRequestsPerSecond());
        this.permitTimeout = properties.getPermitTimeout();
        this.maxCallsPerCycle = properties.getMaxCallsPerCycle();
    }

    public void startCycle() {
        calls.set(0);
        exhausted.set(false);
    }

    /**
     * Take one call from the budget and one rate permit.
     *
     * @param asin product the call is for, null for browsing calls
     * @throws UpstreamQuotaExceededException when the quota is exhausted
     */
    public void acquire(String asin) throws UpstreamQuotaExceededException {
        if (exhausted.get()) {
            throw new UpstreamQuotaExceededException(asin, "Keepa quota exhausted for this cycle");
        }
        int call = calls.incrementAndGet();
        if (maxCallsPerCycle > 0 && call > maxCallsPerCycle) {
            exhaust();
            log.warn("Keepa call budget of {} spent, skipping remaining calls", maxCallsPerCycle);
            throw new UpstreamQuotaExceededException(asin, "Keepa call budget of " + maxCallsPerCycle + " spent");
        }
        if (!rateLimiter.tryAcquire(permitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            exhaust();
            log.warn("No rate permit within {}, skipping remaining calls", permitTimeout);
            throw new UpstreamQuotaExceededException(asin, "No Keepa rate permit within " + permitTimeout);
        }
    }

    public void exhaust() {
        exhausted.set(true);
    }

    public boolean isExhausted() {
        return exhausted.get();
    }

    /**
     * Calls attempted since the cycle started, including the one that found the budget spent.
     */
    public int getCallsThisCycle() {
        return calls.get();
    }
}
