package com.deals.collector.service;

import com.deals.collector.config.IngestionProperties;
import com.deals.collector.history.UpstreamQuotaExceededException;
import com.deals.collector.history.UpstreamUnavailableException;
import com.deals.collector.keepa.KeepaClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Browses Keepa deals in a curated set of root categories. Each root is paged separately and its
 * deals take the root's category.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "deals.candidates.source", havingValue = "keepa", matchIfMissing = true)
public class KeepaDealsCandidateSource implements CandidateSource {

    private final KeepaClient keepaClient;
    private final IngestionProperties properties;

    @Override
    public List<Candidate> loadCandidates() throws UpstreamUnavailableException {
        Map<Long, DealCategory> roots = resolveRoots(keepaClient.fetchRootCategories());
        log.info("Browsing deals in {} root categories", roots.size());

        Set<Candidate> candidates = new LinkedHashSet<>();
        for (Map.Entry<Long, DealCategory> root : roots.entrySet()) {
            for (int page = 0; page < properties.getPagesPerRootCategory(); page++) {
                JsonNode rows;
                try {
                    rows = keepaClient.fetchDeals(List.of(root.getKey()), page);
                } catch (UpstreamQuotaExceededException e) {
                    log.warn("Deal browsing stopped, quota exhausted: {}", e.getMessage());
                    return new ArrayList<>(candidates);
                } catch (UpstreamUnavailableException e) {
                    log.warn("Deals page {} of root {} unavailable: {}", page, root.getKey(), e.getMessage());
                    continue;
                }

                int before = candidates.size();
                for (JsonNode row : rows) {
                    extractAsin(row).ifPresent(asin -> candidates.add(new Candidate(asin, root.getValue())));
                }
                if (candidates.size() == before) {
                    break;
                }
            }
        }

        log.info("Loaded {} deal candidates", candidates.size());
        return new ArrayList<>(candidates);
    }

    /**
     * Root category ids to browse, each with its category. Falls back to every root when none of
     * the curated ones is found.
     */
    static Map<Long, DealCategory> resolveRoots(JsonNode categories) {
        Map<String, Long> curated = new LinkedHashMap<>();
        Map<Long, DealCategory> all = new LinkedHashMap<>();

        Iterator<JsonNode> it = categories.elements();
        while (it.hasNext()) {
            JsonNode category = it.next();
            long catId = category.path("catId").asLong(0);
            if (catId <= 0) {
                continue;
            }
            String name = category.path("name").asText("");
            all.put(catId, CategoryResolver.resolve(name));
            CategoryResolver.curatedKey(name).ifPresent(key -> curated.putIfAbsent(key, catId));
        }

        if (curated.isEmpty()) {
            log.warn("No curated root categories found, browsing all {} roots", all.size());
            return all;
        }

        Map<Long, DealCategory> roots = new LinkedHashMap<>();
        curated.values().stream().sorted().forEach(id -> roots.put(id, all.get(id)));
        return roots;
    }

    private static Optional<String> extractAsin(JsonNode row) {
        for (String field : List.of("asin", "ASIN", "productCode")) {
            String value = row.path(field).asText("").trim();
            if (value.length() == 10) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
