package com.deals.collector.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * ASIN the provider reported as unknown. Never offered as a candidate again.
 */
@Entity
@Table(name = "excluded_product")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExcludedProductEntity {

    @Id
    @Column(name = "asin", length = 10)
    private String asin;

    @Column(name = "excluded_at", nullable = false)
    private LocalDateTime excludedAt;

    @Column(name = "generation_id", length = 36)
    private String generationId;

    @Column(name = "reason", length = 500)
    private String reason;
}
