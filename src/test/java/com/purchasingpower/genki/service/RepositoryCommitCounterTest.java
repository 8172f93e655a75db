package com.purchasingpower.genki.service;

import com.purchasingpower.genki.client.GitHubClient;
import com.purchasingpower.genki.exception.GitHubFetchException;
import com.purchasingpower.genki.model.github.GitHubAccount;
import com.purchasingpower.genki.model.github.GitHubCommit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Repository Commit Counter Tests")
class RepositoryCommitCounterTest {

    private static final Instant SINCE = Instant.parse("2024-03-01T00:00:00Z");

    @Mock
    private GitHubClient gitHubClient;

    @InjectMocks
    private RepositoryCommitCounter counter;

    private static GitHubCommit commit(String login, String name, int parents) {
        return new GitHubCommit(
                new GitHubAccount(login),
                new GitHubCommit.Detail(new GitHubCommit.GitIdentity(name, login + "@example.com")),
                java.util.Collections.nCopies(parents, new GitHubCommit.Parent("p")));
    }

    @Test
    @DisplayName("Should count only qualifying commits")
    void testCountCommits_ShouldApplyQualifier() {
        // Given
        when(gitHubClient.listCommits("octocat", "hello-world", "octocat", SINCE)).thenReturn(List.of(
                commit("octocat", "The Octocat", 1),
                commit("octocat", "The Octocat", 1),
                commit("octocat", "The Octocat", 2),
                commit("hubot", "Hubot", 1),
                commit("octocat", "renovate", 1)));

        // When
        int count = counter.countCommits("octocat", "octocat", "hello-world", SINCE);

        // Then
        assertEquals(2, count);
    }

    @Test
    @DisplayName("Should report zero instead of failing when the repository cannot be read")
    void testCountCommits_FailureIsZero() {
        // Given
        when(gitHubClient.listCommits("acme", "private-thing", "octocat", SINCE))
                .thenThrow(new GitHubFetchException("/repos/acme/private-thing/commits", 3, null));

        // When / Then
        assertEquals(0, counter.countCommits("octocat", "acme", "private-thing", SINCE));
    }

    @Test
    @DisplayName("Empty history counts as zero")
    void testCountCommits_Empty() {
        when(gitHubClient.listCommits("octocat", "empty", "octocat", SINCE)).thenReturn(List.of());

        assertEquals(0, counter.countCommits("octocat", "octocat", "empty", SINCE));
    }
}
