package com.deals.collector.api;

import com.deals.collector.service.DealQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/generations")
@RequiredArgsConstructor
public class GenerationController {

    private final DealQueryService queryService;

    /**
     * Latest committed generation, 404 before the first commit.
     */
    @GetMapping("/current")
    public ResponseEntity<GenerationResponse> currentGeneration() {
        return queryService.currentGeneration()
                .map(GenerationResponse::from)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
