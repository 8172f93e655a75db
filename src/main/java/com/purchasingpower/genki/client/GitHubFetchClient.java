package com.purchasingpower.genki.client;

import com.purchasingpower.genki.config.GlobalRetryConfig;
import com.purchasingpower.genki.configuration.AppProperties;
import com.purchasingpower.genki.configuration.GitHubProperties;
import com.purchasingpower.genki.exception.GitHubFetchException;
import com.purchasingpower.genki.model.CallContext;
import com.purchasingpower.genki.model.ServiceType;
import com.purchasingpower.genki.util.ExternalCallLogger;
import com.purchasingpower.genki.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Optional;

/**
 * Rate-limit aware GET access to the GitHub REST API.
 *
 * <p>Retry rules per attempt:
 * <ul>
 *   <li>429 or 403: wait for {@code Retry-After} seconds when present, otherwise back off exponentially</li>
 *   <li>5xx: back off exponentially</li>
 *   <li>network failure: back off exponentially</li>
 *   <li>anything else: returned to the caller untouched, including other 4xx</li>
 * </ul>
 *
 * <p>Response bodies are never inspected here. This client does no concurrency
 * control of its own; callers bound how many calls run in parallel.
 */
@Slf4j
@Component
public class GitHubFetchClient {

    private static final String GITHUB_JSON = "application/vnd.github.v3+json";

    private final WebClient webClient;
    private final GlobalRetryConfig retryConfig;
    private final Sleeper sleeper;
    private final Duration requestTimeout;

    public GitHubFetchClient(WebClient.Builder builder,
                             AppProperties props,
                             GlobalRetryConfig retryConfig,
                             Sleeper sleeper) {
        GitHubProperties github = props.getGithub();
        this.retryConfig = retryConfig;
        this.sleeper = sleeper;
        this.requestTimeout = github.getRequestTimeout();

        WebClient.Builder configured = builder
                .baseUrl(github.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_JSON)
                .defaultHeader(HttpHeaders.USER_AGENT, github.getUserAgent())
                // A full page of 100 commits is well above the 256KB default
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());

        if (github.hasToken()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + github.getToken());
        }

        this.webClient = configured.build();
    }

    /**
     * Perform a GET with retries.
     *
     * @param operation    short name for logging, e.g. "listCommits"
     * @param budget       attempts and initial delay
     * @param uriTemplate  path relative to the API base URL, with {placeholders}
     * @param uriVariables values for the placeholders
     * @return the first response that is neither rate-limited nor a server error
     * @throws GitHubFetchException when every attempt was rate-limited, failed server-side or failed on the network
     */
    public ResponseEntity<String> get(String operation, RetryBudget budget, String uriTemplate, Object... uriVariables) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GITHUB, operation, log);
        ctx.logRequest(uriTemplate);

        Throwable lastError = null;
        String lastFailure = null;

        for (int attempt = 0; attempt < budget.maxAttempts(); attempt++) {
            ResponseEntity<String> response;
            try {
                response = webClient.get()
                        .uri(uriTemplate, uriVariables)
                        .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                        .block(requestTimeout);
                if (response == null) {
                    throw new IllegalStateException("Empty response from GitHub");
                }
            } catch (RuntimeException e) {
                lastError = e;
                lastFailure = "network error: " + e.getMessage();
                pauseBeforeNextAttempt(ctx, lastFailure, budget, attempt, exponentialBackoff(budget, attempt), uriTemplate);
                continue;
            }

            int status = response.getStatusCode().value();

            if (status == 429 || status == 403) {
                lastFailure = "rate limited (" + status + ")";
                Duration wait = retryAfter(response.getHeaders()).orElse(exponentialBackoff(budget, attempt));
                pauseBeforeNextAttempt(ctx, lastFailure, budget, attempt, wait, uriTemplate);
                continue;
            }

            if (response.getStatusCode().is5xxServerError()) {
                lastFailure = "server error (" + status + ")";
                pauseBeforeNextAttempt(ctx, lastFailure, budget, attempt, exponentialBackoff(budget, attempt), uriTemplate);
                continue;
            }

            ctx.logResponse(status, attempt + 1);
            return response;
        }

        GitHubFetchException exhausted = new GitHubFetchException(uriTemplate, budget.maxAttempts(), lastError);
        ctx.logError(exhausted.getMessage() + " (last: " + lastFailure + ")", lastError);
        throw exhausted;
    }

    /**
     * Log and wait before the next attempt. Nothing happens after the final attempt.
     */
    private void pauseBeforeNextAttempt(CallContext ctx, String reason, RetryBudget budget,
                                        int attempt, Duration wait, String target) {
        if (attempt >= budget.maxAttempts() - 1) {
            return;
        }
        ctx.logRetry(reason, attempt, wait);
        pause(wait, target, attempt + 1);
    }

    /**
     * {@code initialDelay * 2^attempt}, with the exponent clamped to {@code app.retry.max-exponent}.
     */
    Duration exponentialBackoff(RetryBudget budget, int attempt) {
        int exponent = Math.max(0, Math.min(attempt, retryConfig.getMaxExponent()));
        return budget.initialDelay().multipliedBy(1L << exponent);
    }

    static Optional<Duration> retryAfter(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by GitHub; fall back to exponential backoff
            return Optional.empty();
        }
    }

    private void pause(Duration wait, String target, int attemptsSoFar) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubFetchException(target, attemptsSoFar, e);
        }
    }
}
