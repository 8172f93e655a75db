package com.purchasingpower.genki.model;

import java.time.Instant;

/**
 * Persisted result of one aggregation run plus its classification.
 *
 * <p>{@code lastUpdated} is the instant the run finished, not the time of any commit.
 */
public record ActivitySnapshot(
        int commits,
        HealthStatus status,
        Instant lastUpdated,
        RepoSources sources
) {

    /**
     * Number of contributing repositories per source.
     */
    public record RepoSources(int owned, int org) {
    }

    public static ActivitySnapshot of(AggregationResult result, HealthStatus status, Instant computedAt) {
        return new ActivitySnapshot(
                result.commits(),
                status,
                computedAt,
                new RepoSources(result.ownedRepos(), result.orgRepos()));
    }
}
