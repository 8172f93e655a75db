package com.purchasingpower.genki.service;

import com.google.common.base.Preconditions;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Decides when a cached snapshot has to be recomputed.
 *
 * <p>A snapshot is stale when either
 * <ul>
 *   <li>it is more than 24 hours old, or</li>
 *   <li>it was computed on an earlier calendar day (UTC+9) and the current UTC+9 hour
 *       has reached the refresh hour.</li>
 * </ul>
 * The result is one refresh per day, no earlier than the refresh hour. The 24 hour
 * ceiling covers snapshots computed after the refresh hour of their own day,
 * which the date rule alone would keep for almost two days.
 */
@Component
@RequiredArgsConstructor
public class FreshnessPolicy {

    public static final ZoneOffset REFRESH_ZONE = ZoneOffset.ofHours(9);

    private static final Duration MAX_AGE = Duration.ofHours(24);

    private final Clock clock;

    public boolean isStale(Instant lastUpdated, int refreshHour) {
        Preconditions.checkArgument(refreshHour >= 0 && refreshHour <= 23,
                "refreshHour must be within 0-23, got %s", refreshHour);
        if (lastUpdated == null) {
            return true;
        }

        Instant now = clock.instant();
        if (Duration.between(lastUpdated, now).compareTo(MAX_AGE) > 0) {
            return true;
        }

        ZonedDateTime localNow = now.atZone(REFRESH_ZONE);
        ZonedDateTime localLastUpdated = lastUpdated.atZone(REFRESH_ZONE);

        return !localNow.toLocalDate().equals(localLastUpdated.toLocalDate())
                && localNow.getHour() >= refreshHour;
    }
}
