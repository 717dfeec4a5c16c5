package com.deals.collector.service;

import com.deals.collector.analysis.DealRecord;
import com.deals.collector.analysis.DealScorer;
import com.deals.collector.config.IngestionProperties;
import com.deals.collector.history.HistoryFetcher;
import com.deals.collector.history.ProductHistory;
import com.deals.collector.history.UnknownProductException;
import com.deals.collector.history.UpstreamQuotaExceededException;
import com.deals.collector.history.UpstreamUnavailableException;
import com.deals.collector.keepa.KeepaQuota;
import com.deals.collector.persistence.ExcludedProductRepository;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one ingestion cycle: load candidates, fetch and score each product on a worker pool,
 * then commit everything as a single generation.
 */
@Service
@Slf4j
public class IngestionCycleService {

    private final CandidateSource candidateSource;
    private final HistoryFetcher historyFetcher;
    private final DealScorer dealScorer;
    private final SnapshotWriter snapshotWriter;
    private final ExcludedProductRepository excludedRepository;
    private final IngestionProperties properties;
    private final KeepaQuota quota;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean cancelRequested;
    private volatile CycleResult lastResult;

    public IngestionCycleService(CandidateSource candidateSource,
                                 HistoryFetcher historyFetcher,
                                 DealScorer dealScorer,
                                 SnapshotWriter snapshotWriter,
                                 ExcludedProductRepository excludedRepository,
                                 IngestionProperties properties,
                                 KeepaQuota quota,
                                 Clock clock) {
        this.candidateSource = candidateSource;
        this.historyFetcher = historyFetcher;
        this.dealScorer = dealScorer;
        this.snapshotWriter = snapshotWriter;
        this.excludedRepository = excludedRepository;
        this.properties = properties;
        this.quota = quota;
        this.clock = clock;
    }

    public boolean isRunning() {
        return running.get();
    }

    public CycleResult getLastResult() {
        return lastResult;
    }

    /**
     * Ask the running cycle to stop before its commit point.
     *
     * @return false when no cycle is running
     */
    public boolean requestCancel() {
        if (!running.get()) {
            return false;
        }
        log.warn("Cancellation requested for running cycle");
        cancelRequested = true;
        return true;
    }

    public CycleResult runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Ingestion cycle already running, skipping...");
            return CycleResult.skipped();
        }

        cancelRequested = false;
        try {
            CycleResult result = doRunCycle();
            lastResult = result;
            return result;
        } finally {
            running.set(false);
        }
    }

    private CycleResult doRunCycle() {
        String generationId = UUID.randomUUID().toString();
        LocalDateTime asOf = LocalDateTime.now(clock);
        long started = System.currentTimeMillis();

        log.info("=== INGESTION CYCLE {} STARTED (as of {}) ===", generationId, asOf);
        quota.startCycle();

        List<Candidate> candidates;
        try {
            candidates = loadCandidates();
        } catch (UpstreamUnavailableException e) {
            log.error("Could not load candidates: {}", e.getMessage(), e);
            return fail(GenerationCommit.builder().generationId(generationId).startedAt(asOf).build(),
                    "Candidate loading failed: " + e.getMessage(), started);
        }

        if (cancelRequested) {
            return abort(generationId, CycleStats.EMPTY, started);
        }

        List<ProductOutcome> outcomes;
        try {
            outcomes = processAll(candidates, asOf);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Cycle {} interrupted while scoring", generationId);
            return abort(generationId, CycleStats.EMPTY, started);
        }

        List<DealRecord> records = new ArrayList<>();
        Map<String, String> unknownAsins = new LinkedHashMap<>();
        int unavailable = 0;
        int unknown = 0;
        int quotaSkipped = 0;
        int filtered = 0;

        for (ProductOutcome outcome : outcomes) {
            switch (outcome.kind()) {
                case SCORED -> {
                    if (belowMinimumDiscount(outcome.record())) {
                        filtered++;
                    } else {
                        records.add(outcome.record());
                    }
                }
                case UNAVAILABLE -> unavailable++;
                case UNKNOWN -> {
                    unknown++;
                    unknownAsins.putIfAbsent(outcome.candidate().asin(), outcome.reason());
                }
                case QUOTA_SKIPPED -> quotaSkipped++;
                case CANCELLED -> {
                }
            }
        }

        CycleStats stats = new CycleStats(candidates.size(), unavailable, unknown, quotaSkipped, filtered);

        if (cancelRequested) {
            return abort(generationId, stats, started);
        }

        GenerationCommit generation = GenerationCommit.builder()
                .generationId(generationId)
                .startedAt(asOf)
                .records(records)
                .unknownAsins(unknownAsins)
                .stats(stats)
                .build();

        if (properties.isKeepGenerationOnOutage() && isOutage(candidates.size(), stats)) {
            return fail(generation, "Every candidate unavailable, current generation kept", started);
        }

        log.info("Scored {} of {} candidates ({} unavailable, {} unknown, {} quota-skipped, {} filtered)",
                records.size(), candidates.size(), unavailable, unknown, quotaSkipped, filtered);

        try {
            CommitResult commit = snapshotWriter.commit(generation);
            CycleResult result = new CycleResult(CycleStatus.COMMITTED, generationId, stats, commit.inserted(),
                    null, System.currentTimeMillis() - started);
            log.info("=== INGESTION CYCLE COMPLETED: {} ===", result.summary());
            return result;
        } catch (CommitFailureException e) {
            return fail(generation, e.getMessage(), started);
        }
    }

    private List<Candidate> loadCandidates() throws UpstreamUnavailableException {
        Set<String> excluded = new HashSet<>(excludedRepository.findAllAsins());
        Set<Candidate> distinct = new LinkedHashSet<>();
        int dropped = 0;

        for (Candidate candidate : candidateSource.loadCandidates()) {
            if (excluded.contains(candidate.asin())) {
                dropped++;
            } else {
                distinct.add(candidate);
            }
        }

        if (dropped > 0) {
            log.info("Dropped {} candidates for excluded products", dropped);
        }
        return new ArrayList<>(distinct);
    }

    /**
     * Fetch and score every candidate. A product listed under several categories is fetched once.
     * Outcomes come back in candidate order whatever order the workers finish in.
     */
    private List<ProductOutcome> processAll(List<Candidate> candidates, LocalDateTime asOf) throws InterruptedException {
        if (candidates.isEmpty()) {
            return List.of();
        }

        Map<String, List<Candidate>> byAsin = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            byAsin.computeIfAbsent(candidate.asin(), k -> new ArrayList<>()).add(candidate);
        }

        List<Callable<List<ProductOutcome>>> tasks = new ArrayList<>(byAsin.size());
        for (List<Candidate> group : byAsin.values()) {
            tasks.add(() -> processProduct(group, asOf));
        }

        int workers = Math.max(1, properties.getWorkers());
        long rounds = (tasks.size() + workers - 1) / workers;
        Duration deadline = properties.getProductTimeout().multipliedBy(rounds);

        ExecutorService pool = Executors.newFixedThreadPool(workers,
                new ThreadFactoryBuilder().setNameFormat("ingestion-worker-%d").setDaemon(true).build());
        try {
            List<Future<List<ProductOutcome>>> futures = pool.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);

            List<ProductOutcome> outcomes = new ArrayList<>(candidates.size());
            List<List<Candidate>> groups = new ArrayList<>(byAsin.values());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.addAll(collect(futures.get(i), groups.get(i)));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    private List<ProductOutcome> collect(Future<List<ProductOutcome>> future, List<Candidate> group)
            throws InterruptedException {
        try {
            return future.get();
        } catch (CancellationException e) {
            log.warn("Timed out fetching {}", group.get(0).asin());
            return ProductOutcome.all(group, OutcomeKind.UNAVAILABLE, "timed out");
        } catch (ExecutionException e) {
            log.error("Unexpected error scoring {}: {}", group.get(0).asin(), e.getCause().getMessage(), e.getCause());
            return ProductOutcome.all(group, OutcomeKind.UNAVAILABLE, e.getCause().getMessage());
        }
    }

    private List<ProductOutcome> processProduct(List<Candidate> group, LocalDateTime asOf) {
        Candidate first = group.get(0);
        if (cancelRequested) {
            return ProductOutcome.all(group, OutcomeKind.CANCELLED, null);
        }
        if (quota.isExhausted()) {
            return ProductOutcome.all(group, OutcomeKind.QUOTA_SKIPPED, null);
        }

        ProductHistory history;
        try {
            history = historyFetcher.fetchHistory(first.asin(), first.category());
        } catch (UpstreamQuotaExceededException e) {
            quota.exhaust();
            log.warn("Quota exhausted while fetching {}", first.asin());
            return ProductOutcome.all(group, OutcomeKind.QUOTA_SKIPPED, e.getMessage());
        } catch (UpstreamUnavailableException e) {
            log.warn("History unavailable for {}: {}", first.asin(), e.getMessage());
            return ProductOutcome.all(group, OutcomeKind.UNAVAILABLE, e.getMessage());
        } catch (UnknownProductException e) {
            log.warn("Unknown product {}: {}", first.asin(), e.getMessage());
            return ProductOutcome.all(group, OutcomeKind.UNKNOWN, e.getMessage());
        }

        List<ProductOutcome> outcomes = new ArrayList<>(group.size());
        for (Candidate candidate : group) {
            outcomes.add(new ProductOutcome(candidate, OutcomeKind.SCORED, dealScorer.score(candidate, history, asOf), null));
        }
        return outcomes;
    }

    private boolean belowMinimumDiscount(DealRecord record) {
        Double threshold = properties.getMinDiscount().get(record.getCategory().getSlug());
        return threshold != null
                && record.getDiscountPct90d() != null
                && record.getDiscountPct90d() < threshold;
    }

    /**
     * Every candidate ended unavailable or quota-skipped. Unknown products and filtered records
     * are answers from the provider, not an outage.
     */
    private static boolean isOutage(int candidates, CycleStats stats) {
        return candidates > 0 && stats.unavailable() + stats.quotaSkipped() == candidates;
    }

    private CycleResult fail(GenerationCommit generation, String message, long started) {
        String generationId = generation.getGenerationId();
        try {
            snapshotWriter.recordFailure(generation, message);
        } catch (RuntimeException e) {
            log.error("Could not record failed generation {}: {}", generationId, e.getMessage(), e);
        }
        CycleResult result = new CycleResult(CycleStatus.FAILED, generationId, generation.getStats(), 0, message,
                System.currentTimeMillis() - started);
        log.error("=== INGESTION CYCLE FAILED: {} ===", result.summary());
        return result;
    }

    private CycleResult abort(String generationId, CycleStats stats, long started) {
        CycleResult result = new CycleResult(CycleStatus.ABORTED, generationId, stats, 0, "Cancelled before commit",
                System.currentTimeMillis() - started);
        log.warn("=== INGESTION CYCLE ABORTED: {} ===", result.summary());
        return result;
    }

    private enum OutcomeKind {
        SCORED,
        UNAVAILABLE,
        UNKNOWN,
        QUOTA_SKIPPED,
        CANCELLED
    }

    private record ProductOutcome(Candidate candidate, OutcomeKind kind, DealRecord record, String reason) {

        static List<ProductOutcome> all(List<Candidate> group, OutcomeKind kind, String reason) {
            List<ProductOutcome> outcomes = new ArrayList<>(group.size());
            for (Candidate candidate : group) {
                outcomes.add(new ProductOutcome(candidate, kind, null, reason));
            }
            return outcomes;
        }
    }
}
