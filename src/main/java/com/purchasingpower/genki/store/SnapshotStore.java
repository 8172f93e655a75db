package com.purchasingpower.genki.store;

import com.purchasingpower.genki.model.ActivitySnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value persistence for activity snapshots.
 *
 * <p>The TTL is a safety net only; recomputation is driven by the freshness policy.
 * A put atomically replaces whatever was stored under the key.
 */
public interface SnapshotStore {

    Optional<ActivitySnapshot> get(String key);

    void put(String key, ActivitySnapshot snapshot, Duration ttl);
}
