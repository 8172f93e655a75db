package com.purchasingpower.genki.service;

import com.purchasingpower.genki.model.SnapshotLookup;

/**
 * Stale-while-revalidate access to the monitored user's activity snapshot.
 */
public interface BadgeCacheService {

    /**
     * Return the snapshot to serve for the current request.
     *
     * <ul>
     *   <li>absent: aggregate synchronously, store, return the new snapshot</li>
     *   <li>fresh: return the stored snapshot, no GitHub calls</li>
     *   <li>stale: return the stored snapshot and refresh it in the background</li>
     * </ul>
     *
     * @throws com.purchasingpower.genki.exception.MissingConfigurationException if no username is configured
     * @throws com.purchasingpower.genki.exception.BotAccountRejectedException if nothing is cached and the
     *         configured username looks like an automation account
     */
    SnapshotLookup getSnapshot();

    /**
     * Store key for a monitored username.
     */
    static String cacheKey(String username) {
        return "github-health:" + username;
    }
}
