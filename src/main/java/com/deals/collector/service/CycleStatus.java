package com.deals.collector.service;

public enum CycleStatus {
    COMMITTED,
    FAILED,
    ABORTED,
    SKIPPED
}
