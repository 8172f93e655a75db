package com.purchasingpower.genki.util;

import java.time.Duration;

/**
 * Blocking pause used for retry backoff and inter-batch pacing.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleeper() {
        return duration -> {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
