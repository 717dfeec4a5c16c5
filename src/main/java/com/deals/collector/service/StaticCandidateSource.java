package com.deals.collector.service;

import com.deals.collector.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Candidates listed in configuration as "ASIN:slug".
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "deals.candidates.source", havingValue = "static")
public class StaticCandidateSource implements CandidateSource {

    private final IngestionProperties properties;

    @Override
    public List<Candidate> loadCandidates() {
        List<Candidate> candidates = new ArrayList<>();
        for (String entry : properties.getStaticCandidates()) {
            parse(entry).ifPresent(candidates::add);
        }
        log.info("Loaded {} static candidates", candidates.size());
        return candidates;
    }

    static Optional<Candidate> parse(String entry) {
        if (entry == null) {
            return Optional.empty();
        }
        String[] parts = entry.trim().split(":", 2);
        if (parts.length != 2) {
            log.warn("Ignoring static candidate '{}': expected ASIN:slug", entry);
            return Optional.empty();
        }
        String asin = parts[0].trim().toUpperCase(Locale.ROOT);
        Optional<DealCategory> category = DealCategory.fromSlug(parts[1].trim());
        if (category.isEmpty()) {
            log.warn("Ignoring static candidate '{}': unknown category", entry);
            return Optional.empty();
        }
        return Optional.of(new Candidate(asin, category.get()));
    }
}
