package com.purchasingpower.genki.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.genki.config.GlobalRetryConfig;
import com.purchasingpower.genki.model.github.GitHubCommit;
import com.purchasingpower.genki.model.github.GitHubOrg;
import com.purchasingpower.genki.model.github.GitHubRepo;
import com.purchasingpower.genki.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

@Slf4j
@Component
@RequiredArgsConstructor
public class GitHubRestClient implements GitHubClient {

    static final int OWNED_REPOS_PAGE_SIZE = 30;
    static final int COMMITS_PAGE_SIZE = 100;

    private static final TypeReference<List<GitHubRepo>> REPO_LIST = new TypeReference<>() { };
    private static final TypeReference<List<GitHubOrg>> ORG_LIST = new TypeReference<>() { };
    private static final TypeReference<List<GitHubCommit>> COMMIT_LIST = new TypeReference<>() { };

    private final GitHubFetchClient fetchClient;
    private final GlobalRetryConfig retryConfig;
    private final ObjectMapper objectMapper;

    @Override
    public List<GitHubRepo> listOwnedRepositories(String username) {
        ResponseEntity<String> response = fetchClient.get("listOwnedRepositories",
                retryConfig.listingBudget(),
                "/users/{username}/repos?type=owner&sort=updated&per_page={perPage}",
                username, OWNED_REPOS_PAGE_SIZE);
        return parse(response, REPO_LIST, GitHubRepo::isWellFormed, "owned repositories of " + username);
    }

    @Override
    public List<GitHubOrg> listOrganizations(String username) {
        ResponseEntity<String> response = fetchClient.get("listOrganizations",
                retryConfig.listingBudget(),
                "/users/{username}/orgs",
                username);
        return parse(response, ORG_LIST, GitHubOrg::isWellFormed, "organizations of " + username);
    }

    @Override
    public List<GitHubRepo> listOrganizationRepositories(String organization, int limit) {
        ResponseEntity<String> response = fetchClient.get("listOrganizationRepositories",
                retryConfig.listingBudget(),
                "/orgs/{org}/repos?type=public&sort=updated&per_page={perPage}",
                organization, limit);
        return parse(response, REPO_LIST, GitHubRepo::isWellFormed, "repositories of organization " + organization);
    }

    @Override
    public List<GitHubCommit> listCommits(String owner, String repository, String author, Instant since) {
        ResponseEntity<String> response = fetchClient.get("listCommits",
                retryConfig.commitQueryBudget(),
                "/repos/{owner}/{repo}/commits?author={author}&since={since}&per_page={perPage}",
                owner, repository, author, since.truncatedTo(ChronoUnit.SECONDS).toString(), COMMITS_PAGE_SIZE);
        return parse(response, COMMIT_LIST, commit -> true, "commits of " + owner + "/" + repository);
    }

    private <T> List<T> parse(ResponseEntity<String> response,
                              TypeReference<List<T>> type,
                              Predicate<T> wellFormed,
                              String what) {
        if (!response.getStatusCode().is2xxSuccessful()) {
            log.warn("GitHub returned {} for {}", response.getStatusCode().value(), what);
            return List.of();
        }

        String body = response.getBody();
        if (body == null || body.isBlank()) {
            log.warn("Empty body for {}", what);
            return List.of();
        }

        try {
            List<T> items = objectMapper.readValue(body, type);
            if (items == null) {
                return List.of();
            }
            return items.stream().filter(Objects::nonNull).filter(wellFormed).toList();
        } catch (JsonProcessingException e) {
            log.warn("Unexpected payload for {}: {} (body: {})",
                    what, e.getOriginalMessage(), ExternalCallLogger.truncate(body, 200));
            return List.of();
        }
    }
}
