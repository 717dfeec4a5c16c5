package com.deals.collector.api;

import com.deals.collector.service.DealCategory;
import com.deals.collector.service.DealQueryService;
import com.deals.collector.service.DealQueryService.DealSort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read API over the current generation.
 *
 * Endpoints:
 * - GET /api/deals?category=kitchen&sort=hot|deal&limit=50
 * - GET /api/deal/{asin} (also served as /api/deals/{asin})
 */
@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class DealController {

    private static final int MAX_LIMIT = 200;

    private final DealQueryService queryService;

    @GetMapping("/deals")
    public ResponseEntity<Map<String, List<DealResponse>>> listDeals(
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "hot") String sort,
            @RequestParam(defaultValue = "50") int limit) {

        if (limit < 1 || limit > MAX_LIMIT) {
            log.warn("[DEALS-API] Invalid limit: {}", limit);
            return ResponseEntity.badRequest().build();
        }

        DealSort dealSort;
        switch (sort.toLowerCase(Locale.ROOT)) {
            case "hot" -> dealSort = DealSort.HOT;
            case "deal" -> dealSort = DealSort.DEAL;
            default -> {
                log.warn("[DEALS-API] Invalid sort: {}", sort);
                return ResponseEntity.badRequest().build();
            }
        }

        DealCategory dealCategory = null;
        if (category != null && !category.isBlank()) {
            Optional<DealCategory> resolved = DealCategory.fromSlug(category);
            if (resolved.isEmpty()) {
                log.warn("[DEALS-API] Unknown category: {}", category);
                return ResponseEntity.badRequest().build();
            }
            dealCategory = resolved.get();
        }

        List<DealResponse> items = queryService.listDeals(dealCategory, dealSort, limit).stream()
                .map(DealResponse::from)
                .toList();
        return ResponseEntity.ok(Map.of("items", items));
    }

    @GetMapping({"/deal/{asin}", "/deals/{asin}"})
    public ResponseEntity<DealResponse> getDeal(@PathVariable String asin) {
        if (asin.length() != 10) {
            return ResponseEntity.badRequest().build();
        }
        return queryService.findDeal(asin)
                .map(DealResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
