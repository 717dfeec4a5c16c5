package com.deals.collector.service;

import com.deals.collector.history.UpstreamUnavailableException;

import java.util.List;

/**
 * Supplies the (asin, category) pairs a cycle considers.
 */
public interface CandidateSource {

    List<Candidate> loadCandidates() throws UpstreamUnavailableException;
}
