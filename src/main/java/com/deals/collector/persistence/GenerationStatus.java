package com.deals.collector.persistence;

public enum GenerationStatus {
    COMMITTED,
    FAILED
}
