package com.purchasingpower.genki.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Freshness Policy Tests")
class FreshnessPolicyTest {

    private static final ZoneOffset JST = ZoneOffset.ofHours(9);

    private static Instant jst(int day, int hour) {
        return LocalDateTime.of(2024, 3, day, hour, 0).toInstant(JST);
    }

    private static FreshnessPolicy policyAt(Instant now) {
        return new FreshnessPolicy(Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Previous day snapshot is stale once the refresh hour has passed")
    void testNewDayAfterRefreshHour_ShouldBeStale() {
        // Given: computed yesterday 23:00 JST, now today 09:00 JST, refresh at 8
        FreshnessPolicy policy = policyAt(jst(11, 9));

        // Then
        assertThat(policy.isStale(jst(10, 23), 8)).isTrue();
    }

    @Test
    @DisplayName("Previous day snapshot stays fresh before the refresh hour")
    void testNewDayBeforeRefreshHour_ShouldBeFresh() {
        FreshnessPolicy policy = policyAt(jst(11, 7));

        assertThat(policy.isStale(jst(10, 23), 8)).isFalse();
    }

    @Test
    @DisplayName("Same day snapshot stays fresh even after the refresh hour")
    void testSameDay_ShouldBeFresh() {
        FreshnessPolicy policy = policyAt(jst(11, 22));

        assertThat(policy.isStale(jst(11, 9), 8)).isFalse();
    }

    @Test
    @DisplayName("Snapshot older than 24h is stale regardless of the refresh hour")
    void testOlderThanADay_ShouldBeStale() {
        // Given: computed at 20:00 on the 10th, now 21:00 on the 11th, refresh hour 23
        FreshnessPolicy policy = policyAt(jst(11, 21));

        assertThat(policy.isStale(jst(10, 20), 23)).isTrue();
        // exactly 24h is not beyond the ceiling
        assertThat(policyAt(jst(11, 20)).isStale(jst(10, 20), 23)).isFalse();
    }

    @Test
    @DisplayName("Calendar days are taken in UTC+9, not UTC")
    void testZoneBoundary() {
        // 14:00 UTC on the 10th is already 23:00 JST; 00:30 UTC on the 11th is 09:30 JST
        Instant lastUpdated = Instant.parse("2024-03-10T14:00:00Z");
        FreshnessPolicy policy = policyAt(Instant.parse("2024-03-11T00:30:00Z"));

        assertThat(policy.isStale(lastUpdated, 9)).isTrue();
        assertThat(policy.isStale(lastUpdated, 10)).isFalse();
    }

    @Test
    @DisplayName("Missing timestamp counts as stale; invalid hour is rejected")
    void testEdgeCases() {
        FreshnessPolicy policy = policyAt(jst(11, 9));

        assertThat(policy.isStale(null, 8)).isTrue();
        assertThrows(IllegalArgumentException.class, () -> policy.isStale(jst(11, 8), 24));
    }
}
