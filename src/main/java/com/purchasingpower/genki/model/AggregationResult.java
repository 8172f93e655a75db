package com.purchasingpower.genki.model;

/**
 * Outcome of one aggregation run.
 *
 * @param commits     qualifying commits summed over every contributing repository
 * @param ownedRepos  owned repositories that contributed at least one commit
 * @param orgRepos    organization repositories that contributed at least one commit
 */
public record AggregationResult(int commits, int ownedRepos, int orgRepos) {
}
