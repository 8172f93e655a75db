package com.purchasingpower.genki.config;

import com.purchasingpower.genki.client.RetryBudget;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry configuration for calls to the GitHub REST API.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 1000
 *     commit-backoff-ms: 500
 *     max-exponent: 6
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For attempt N (starting at 0), the delay is:
 * <pre>
 *   delay = initialDelay * 2 ^ min(N, max-exponent)
 * </pre>
 * unless the response carried a {@code Retry-After} hint, which wins.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe as Spring manages a single instance
 * and all fields are effectively immutable after initialization.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Total number of attempts per call, including the first one.
     * Default: 3
     */
    private int maxAttempts = 3;

    /**
     * Initial backoff for repository and organization listing calls.
     * Default: 1000
     */
    private long backoffMs = 1000;

    /**
     * Initial backoff for per-repository commit queries. Kept shorter because
     * these run inside a batch and one slow repository delays the whole batch.
     * Default: 500
     */
    private long commitBackoffMs = 500;

    /**
     * Upper bound on the exponent of the backoff multiplier, so long retry
     * budgets cannot overflow the delay.
     * Default: 6
     */
    private int maxExponent = 6;

    public RetryBudget listingBudget() {
        return new RetryBudget(maxAttempts, Duration.ofMillis(backoffMs));
    }

    public RetryBudget commitQueryBudget() {
        return new RetryBudget(maxAttempts, Duration.ofMillis(commitBackoffMs));
    }
}
