package com.purchasingpower.genki.exception;

import lombok.Getter;

/**
 * A GitHub call used up its retry budget without an answer that could be handed back.
 */
@Getter
public class GitHubFetchException extends RuntimeException {

    private final String target;
    private final int attempts;

    public GitHubFetchException(String target, int attempts, Throwable lastError) {
        super(buildMessage(target, attempts, lastError), lastError);
        this.target = target;
        this.attempts = attempts;
    }

    private static String buildMessage(String target, int attempts, Throwable lastError) {
        if (lastError == null) {
            return "Failed to fetch " + target + " after " + attempts + " attempts";
        }
        return "Failed to fetch " + target + " after " + attempts + " attempts: " + lastError.getMessage();
    }
}
