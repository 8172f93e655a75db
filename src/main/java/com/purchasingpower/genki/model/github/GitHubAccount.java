package com.purchasingpower.genki.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * User or organization reference embedded in other payloads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubAccount(String login) {
}
