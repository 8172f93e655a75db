package com.purchasingpower.genki.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracks one logical outbound call, including all of its retry attempts.
 *
 * Every line carries the same short call id so a retried GitHub request can be
 * followed through the log from first attempt to final status.
 *
 * @see com.purchasingpower.genki.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String target) {
        logger.info("{} {} → {} [{}]", service.getEmoji(), service.getName(), operation, callId);
        logger.debug("  Target: {}", target);
    }

    public void logResponse(int status, int attempts) {
        logger.info("{} {} ← {} [{}] status={} attempts={} ({}ms)",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                status,
                attempts,
                getElapsedMs());
    }

    public void logRetry(String reason, int attempt, Duration wait) {
        logger.warn("{} {} ↻ {} [{}] {} - attempt {} failed, waiting {}ms",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                reason,
                attempt + 1,
                wait.toMillis());
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(),
                service.getName(),
                operation,
                callId,
                getElapsedMs(),
                errorMessage);

        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
