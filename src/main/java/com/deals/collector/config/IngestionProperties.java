package com.deals.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables for one ingestion cycle: worker pool, upstream quota and candidate selection.
 */
@Data
@ConfigurationProperties(prefix = "deals.ingestion")
public class IngestionProperties {

    // ========== WORKERS ==========
    private int workers = 4;
    private Duration productTimeout = Duration.ofSeconds(90);

    // ========== UPSTREAM QUOTA ==========
    /**
     * Global ceiling on Keepa calls per second.
     */
    private double requestsPerSecond = 1.0;

    /**
     * How long a Keepa call waits for a rate permit before the cycle gives up on the remaining
     * candidates.
     */
    private Duration permitTimeout = Duration.ofSeconds(30);

    /**
     * Maximum Keepa calls per cycle, candidate browsing included, 0 = unlimited.
     */
    private int maxCallsPerCycle = 0;

    /**
     * When set, a cycle whose every candidate is unavailable or quota-skipped ends FAILED and the
     * current generation stays. Off by default: such a cycle commits an empty generation.
     */
    private boolean keepGenerationOnOutage = false;

    // ========== CANDIDATES ==========
    private int pagesPerRootCategory = 2;

    /**
     * Minimum discount per category slug. Records with a defined discount below the threshold
     * are left out of the generation.
     */
    private Map<String, Double> minDiscount = new HashMap<>();

    /**
     * Static candidates as "ASIN:slug", used when deals.candidates.source=static.
     */
    private List<String> staticCandidates = new ArrayList<>();
}
