package com.deals.collector.service;

/**
 * One product to consider in a cycle, with the category it will be listed under.
 */
public record Candidate(String asin, DealCategory category) {
}
