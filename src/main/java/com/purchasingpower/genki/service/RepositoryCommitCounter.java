package com.purchasingpower.genki.service;

import com.purchasingpower.genki.client.GitHubClient;
import com.purchasingpower.genki.model.github.GitHubCommit;
import com.purchasingpower.genki.util.CommitQualifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Counts the monitored user's qualifying commits in one repository.
 *
 * <p>Only the first page of 100 commits is read, so a repository with more
 * in-window commits than that is undercounted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepositoryCommitCounter {

    private final GitHubClient gitHubClient;

    /**
     * @return qualifying commits, or 0 when the repository could not be read.
     *         Never throws, so one unreachable repository cannot abort an aggregation.
     */
    public int countCommits(String username, String owner, String repository, Instant since) {
        try {
            List<GitHubCommit> commits = gitHubClient.listCommits(owner, repository, username, since);
            int qualifying = (int) commits.stream()
                    .filter(commit -> CommitQualifier.qualifies(commit, username))
                    .count();
            log.debug("{}/{}: {} of {} commits qualify", owner, repository, qualifying, commits.size());
            return qualifying;
        } catch (RuntimeException e) {
            log.warn("Error fetching commits for {}/{}: {}", owner, repository, e.getMessage());
            return 0;
        }
    }
}
