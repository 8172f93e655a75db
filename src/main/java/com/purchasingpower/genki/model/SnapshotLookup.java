package com.purchasingpower.genki.model;

/**
 * Snapshot served for a request together with how it was obtained.
 */
public record SnapshotLookup(ActivitySnapshot snapshot, CacheState state, String username) {
}
