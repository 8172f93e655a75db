package com.purchasingpower.genki.client;

import com.purchasingpower.genki.model.github.GitHubCommit;
import com.purchasingpower.genki.model.github.GitHubOrg;
import com.purchasingpower.genki.model.github.GitHubRepo;

import java.time.Instant;
import java.util.List;

/**
 * Typed access to the GitHub endpoints used for activity aggregation.
 *
 * <p>Non-2xx answers and payloads that do not have the expected shape come back
 * as empty lists. Exhausted retries surface as
 * {@link com.purchasingpower.genki.exception.GitHubFetchException}.
 */
public interface GitHubClient {

    /**
     * Repositories owned by the user, most recently updated first, first page of 30.
     */
    List<GitHubRepo> listOwnedRepositories(String username);

    /**
     * Organizations the user is a public member of.
     */
    List<GitHubOrg> listOrganizations(String username);

    /**
     * Public repositories of an organization, most recently updated first.
     *
     * @param limit page size, i.e. the per-organization cap
     */
    List<GitHubRepo> listOrganizationRepositories(String organization, int limit);

    /**
     * First page (up to 100) of commits authored by {@code author} since {@code since}.
     */
    List<GitHubCommit> listCommits(String owner, String repository, String author, Instant since);
}
