package com.deals.collector.service;

import java.time.LocalDateTime;

/**
 * @param superseded previously active rows retired, or deleted in purge mode
 */
public record CommitResult(String generationId, int inserted, int superseded, int excluded,
                           LocalDateTime committedAt) {
}
