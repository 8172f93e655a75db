package com.purchasingpower.genki.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Organization entry from {@code /users/{user}/orgs}. {@code login} is required.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubOrg(String login) {

    public boolean isWellFormed() {
        return login != null && !login.isBlank();
    }
}
