package com.purchasingpower.genki.service.impl;

import com.purchasingpower.genki.configuration.AppProperties;
import com.purchasingpower.genki.configuration.MonitoringProperties;
import com.purchasingpower.genki.exception.BotAccountRejectedException;
import com.purchasingpower.genki.exception.MissingConfigurationException;
import com.purchasingpower.genki.model.ActivitySnapshot;
import com.purchasingpower.genki.model.AggregationResult;
import com.purchasingpower.genki.model.CacheState;
import com.purchasingpower.genki.model.HealthStatus;
import com.purchasingpower.genki.model.SnapshotLookup;
import com.purchasingpower.genki.service.ActivityAggregationService;
import com.purchasingpower.genki.service.BadgeCacheService;
import com.purchasingpower.genki.service.FreshnessPolicy;
import com.purchasingpower.genki.store.SnapshotStore;
import com.purchasingpower.genki.util.CommitQualifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Uses direct executor submission for background refreshes, no @Async proxy.
 *
 * Concurrent requests that both see a stale snapshot may both schedule a
 * refresh. The second run only overwrites the store with an equivalent snapshot,
 * so no per-user locking is done.
 */
@Slf4j
@Service
public class BadgeCacheServiceImpl implements BadgeCacheService {

    private final SnapshotStore snapshotStore;
    private final FreshnessPolicy freshnessPolicy;
    private final ActivityAggregationService aggregationService;
    private final AppProperties props;
    private final Clock clock;
    private final Executor revalidationExecutor;

    public BadgeCacheServiceImpl(SnapshotStore snapshotStore,
                                 FreshnessPolicy freshnessPolicy,
                                 ActivityAggregationService aggregationService,
                                 AppProperties props,
                                 Clock clock,
                                 @Qualifier("revalidationExecutor") Executor revalidationExecutor) {
        this.snapshotStore = snapshotStore;
        this.freshnessPolicy = freshnessPolicy;
        this.aggregationService = aggregationService;
        this.props = props;
        this.clock = clock;
        this.revalidationExecutor = revalidationExecutor;
    }

    @Override
    public SnapshotLookup getSnapshot() {
        MonitoringProperties monitoring = props.getMonitoring();
        if (!monitoring.isConfigured()) {
            throw new MissingConfigurationException("GITHUB_USERNAME not configured");
        }

        String username = monitoring.getUsername();
        String cacheKey = BadgeCacheService.cacheKey(username);

        Optional<ActivitySnapshot> cached = snapshotStore.get(cacheKey);
        if (cached.isPresent()) {
            ActivitySnapshot snapshot = cached.get();
            if (freshnessPolicy.isStale(snapshot.lastUpdated(), monitoring.getRefreshHour())) {
                log.info("Snapshot for {} from {} is stale, refreshing in background",
                        username, snapshot.lastUpdated());
                scheduleRevalidation(username, cacheKey);
                return new SnapshotLookup(snapshot, CacheState.STALE, username);
            }
            return new SnapshotLookup(snapshot, CacheState.FRESH, username);
        }

        if (CommitQualifier.isBotAccount(username)) {
            throw new BotAccountRejectedException(username);
        }

        log.info("No snapshot for {}, computing synchronously", username);
        ActivitySnapshot computed = computeAndStore(username, cacheKey);
        return new SnapshotLookup(computed, CacheState.ABSENT, username);
    }

    private void scheduleRevalidation(String username, String cacheKey) {
        try {
            revalidationExecutor.execute(() -> revalidate(username, cacheKey));
        } catch (RejectedExecutionException e) {
            // Queue full: the next stale read schedules again
            log.warn("Background refresh for {} not scheduled: {}", username, e.getMessage());
        }
    }

    /**
     * Background refresh. Failures leave the previous snapshot in place.
     */
    void revalidate(String username, String cacheKey) {
        try {
            if (CommitQualifier.isBotAccount(username)) {
                log.error("Bot users are not supported: {}", username);
                return;
            }
            computeAndStore(username, cacheKey);
            log.info("Cache updated successfully for {}", username);
        } catch (RuntimeException e) {
            log.error("Background cache update failed for {}", username, e);
        }
    }

    private ActivitySnapshot computeAndStore(String username, String cacheKey) {
        MonitoringProperties monitoring = props.getMonitoring();

        AggregationResult result = aggregationService.aggregate(username);
        HealthStatus status = HealthStatus.classify(
                result.commits(),
                monitoring.getHealthyThreshold(),
                monitoring.getModerateThreshold());

        ActivitySnapshot snapshot = ActivitySnapshot.of(result, status, clock.instant());
        snapshotStore.put(cacheKey, snapshot, monitoring.getCacheTtl());
        return snapshot;
    }
}
