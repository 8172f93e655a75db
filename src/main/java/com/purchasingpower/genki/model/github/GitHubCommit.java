package com.purchasingpower.genki.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Commit entry from {@code /repos/{owner}/{repo}/commits}.
 *
 * <p>{@code author} is the linked GitHub account and is absent when the commit
 * email matches no account. {@code commit.author} holds the raw git identity.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubCommit(
        GitHubAccount author,
        Detail commit,
        List<Parent> parents
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Detail(GitIdentity author) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GitIdentity(String name, String email) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Parent(String sha) {
    }

    public String authorLogin() {
        return author != null ? author.login() : null;
    }

    public String authorName() {
        return commit != null && commit.author() != null ? commit.author().name() : null;
    }

    public String authorEmail() {
        return commit != null && commit.author() != null ? commit.author().email() : null;
    }

    public int parentCount() {
        return parents != null ? parents.size() : 0;
    }
}
