package com.purchasingpower.genki.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Repository entry from {@code /users/{user}/repos} or {@code /orgs/{org}/repos}.
 *
 * <p>{@code name} and {@code updatedAt} are required; {@code owner} is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubRepo(
        String name,
        @JsonProperty("updated_at") Instant updatedAt,
        GitHubAccount owner
) {

    public boolean isWellFormed() {
        return name != null && !name.isBlank() && updatedAt != null;
    }

    public String ownerLogin() {
        return owner != null ? owner.login() : null;
    }
}
