package com.purchasingpower.genki.service;

import com.purchasingpower.genki.model.AggregationResult;

/**
 * Counts a user's recent commits across owned and, optionally, organization repositories.
 */
public interface ActivityAggregationService {

    /**
     * Run one aggregation over the configured monitoring window.
     *
     * @param username monitored GitHub login
     * @return total qualifying commits and contributing repositories per source
     * @throws com.purchasingpower.genki.exception.GitHubFetchException if the owned
     *         repository listing exhausts its retries
     */
    AggregationResult aggregate(String username);
}
