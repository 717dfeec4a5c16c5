package com.deals.collector.analysis;

/**
 * @param score    deal score, 0-100
 * @param hotScore deal score blended with demand, equal to score when demand is unknown
 */
public record DealScores(double score, double hotScore) {
}
