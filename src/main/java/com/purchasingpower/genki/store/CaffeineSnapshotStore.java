package com.purchasingpower.genki.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.google.common.base.Preconditions;
import com.purchasingpower.genki.model.ActivitySnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process {@link SnapshotStore} on Caffeine with a TTL per entry.
 *
 * <p>Snapshots are kept as JSON strings, the same form a remote key-value store
 * would hold, so readers always get their own copy.
 */
@Slf4j
@Component
public class CaffeineSnapshotStore implements SnapshotStore {

    private static final long MAX_ENTRIES = 1_000;

    private final Cache<String, StoredEntry> cache;
    private final ObjectMapper objectMapper;

    @Autowired
    public CaffeineSnapshotStore(ObjectMapper objectMapper) {
        this(objectMapper, Ticker.systemTicker());
    }

    CaffeineSnapshotStore(ObjectMapper objectMapper, Ticker ticker) {
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(MAX_ENTRIES)
                .expireAfter(new PerEntryTtl())
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public Optional<ActivitySnapshot> get(String key) {
        Preconditions.checkNotNull(key, "Key cannot be null");

        StoredEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            log.debug("Snapshot miss: {}", key);
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(entry.json(), ActivitySnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable snapshot under {}: {}", key, e.getOriginalMessage());
            cache.invalidate(key);
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, ActivitySnapshot snapshot, Duration ttl) {
        Preconditions.checkNotNull(key, "Key cannot be null");
        Preconditions.checkNotNull(snapshot, "Snapshot cannot be null");
        Preconditions.checkArgument(ttl != null && !ttl.isNegative() && !ttl.isZero(),
                "TTL must be positive, got %s", ttl);

        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot for " + key, e);
        }

        cache.put(key, new StoredEntry(json, ttl));
        log.debug("Stored snapshot {} (ttl {}s, stats {})", key, ttl.toSeconds(), cache.stats());
    }

    private record StoredEntry(String json, Duration ttl) {
    }

    private static final class PerEntryTtl implements Expiry<String, StoredEntry> {

        @Override
        public long expireAfterCreate(String key, StoredEntry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredEntry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
