package com.purchasingpower.genki.client;

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * How many times a single GitHub call may be attempted and how long the first wait is.
 */
public record RetryBudget(int maxAttempts, Duration initialDelay) {

    public RetryBudget {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");
        Preconditions.checkNotNull(initialDelay, "initialDelay cannot be null");
        Preconditions.checkArgument(!initialDelay.isNegative(), "initialDelay cannot be negative");
    }
}
