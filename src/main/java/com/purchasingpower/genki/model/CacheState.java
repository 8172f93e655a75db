package com.purchasingpower.genki.model;

/**
 * State of the cached snapshot for the monitored user, derived on every lookup.
 */
public enum CacheState {

    /** Nothing stored; the request computes synchronously. */
    ABSENT,

    /** Stored and within the freshness policy; served as is. */
    FRESH,

    /** Stored but outdated; served as is while a background refresh runs. */
    STALE
}
