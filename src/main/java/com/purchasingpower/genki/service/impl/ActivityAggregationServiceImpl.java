package com.purchasingpower.genki.service.impl;

import com.purchasingpower.genki.client.GitHubClient;
import com.purchasingpower.genki.configuration.AppProperties;
import com.purchasingpower.genki.configuration.MonitoringProperties;
import com.purchasingpower.genki.model.AggregationResult;
import com.purchasingpower.genki.model.github.GitHubOrg;
import com.purchasingpower.genki.model.github.GitHubRepo;
import com.purchasingpower.genki.service.ActivityAggregationService;
import com.purchasingpower.genki.service.RepositoryCommitCounter;
import com.purchasingpower.genki.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * Batched, paced crawl over a user's repositories.
 *
 * Two passes with the same shape:
 * 1. Owned pass: the 30 most recently updated owned repositories.
 * 2. Organization pass (optional): public repositories of every organization the
 *    user belongs to, capped per organization.
 *
 * Each pass drops excluded repositories and repositories not updated inside the
 * window (they cannot hold in-window commits, so no commit query is spent on
 * them), then queries commit counts in concurrent batches with a short pause
 * between batches.
 *
 * At most 20 commit histories are queried per run across both passes. The
 * organization pass runs only while fewer than 20 repositories have contributed
 * and query budget is left after the owned pass.
 */
@Slf4j
@Service
public class ActivityAggregationServiceImpl implements ActivityAggregationService {

    static final int MAX_PROCESSED_REPOS = 20;

    private static final Pacing AUTHENTICATED = new Pacing(5, Duration.ofMillis(100));
    private static final Pacing UNAUTHENTICATED = new Pacing(3, Duration.ofMillis(200));

    private final GitHubClient gitHubClient;
    private final RepositoryCommitCounter commitCounter;
    private final AppProperties props;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Executor commitQueryExecutor;

    public ActivityAggregationServiceImpl(GitHubClient gitHubClient,
                                          RepositoryCommitCounter commitCounter,
                                          AppProperties props,
                                          Clock clock,
                                          Sleeper sleeper,
                                          @Qualifier("commitQueryExecutor") Executor commitQueryExecutor) {
        this.gitHubClient = gitHubClient;
        this.commitCounter = commitCounter;
        this.props = props;
        this.clock = clock;
        this.sleeper = sleeper;
        this.commitQueryExecutor = commitQueryExecutor;
    }

    @Override
    public AggregationResult aggregate(String username) {
        MonitoringProperties monitoring = props.getMonitoring();
        Instant since = clock.instant().minus(Duration.ofDays(monitoring.getMonitoringDays()));
        Pacing pacing = props.getGithub().hasToken() ? AUTHENTICATED : UNAUTHENTICATED;

        log.info("📊 Aggregating commits for {} since {} (batch size {})", username, since, pacing.batchSize());

        PassResult owned = ownedPass(username, since, monitoring, pacing);

        PassResult org = PassResult.EMPTY;
        int remainingQueries = MAX_PROCESSED_REPOS - owned.examined();
        if (monitoring.isIncludeOrgRepos()
                && owned.contributing() < MAX_PROCESSED_REPOS
                && remainingQueries > 0) {
            org = organizationPass(username, since, monitoring, pacing, remainingQueries);
        }

        AggregationResult result = new AggregationResult(
                owned.commits() + org.commits(),
                owned.contributing(),
                org.contributing());

        log.info("✅ {} commits for {} (owned repos: {}, org repos: {}, queried: {})",
                result.commits(), username, result.ownedRepos(), result.orgRepos(),
                owned.examined() + org.examined());

        return result;
    }

    private PassResult ownedPass(String username, Instant since, MonitoringProperties monitoring, Pacing pacing) {
        List<RepositoryTarget> candidates = gitHubClient.listOwnedRepositories(username).stream()
                .filter(repo -> isCandidate(repo, since, monitoring.getExcludeRepos()))
                .limit(MAX_PROCESSED_REPOS)
                .map(repo -> RepositoryTarget.of(repo, username))
                .toList();

        log.debug("Owned pass: {} candidate repositories", candidates.size());
        return countInBatches(username, candidates, since, MAX_PROCESSED_REPOS, pacing);
    }

    private PassResult organizationPass(String username,
                                        Instant since,
                                        MonitoringProperties monitoring,
                                        Pacing pacing,
                                        int maxRepos) {
        List<String> organizations;
        try {
            organizations = gitHubClient.listOrganizations(username).stream()
                    .map(GitHubOrg::login)
                    .filter(login -> !monitoring.getExcludeOrgs().contains(login))
                    .toList();
        } catch (RuntimeException e) {
            log.error("Failed to fetch organizations of {}: {}", username, e.getMessage());
            return PassResult.EMPTY;
        }

        List<List<GitHubRepo>> reposPerOrg = runInBatches(organizations,
                org -> listOrganizationRepositories(org, monitoring.getMaxReposPerOrg()),
                pacing);

        List<RepositoryTarget> candidates = new ArrayList<>();
        for (int i = 0; i < organizations.size() && candidates.size() < maxRepos; i++) {
            for (GitHubRepo repo : reposPerOrg.get(i)) {
                if (candidates.size() >= maxRepos) {
                    break;
                }
                if (isCandidate(repo, since, monitoring.getExcludeRepos())) {
                    candidates.add(RepositoryTarget.of(repo, organizations.get(i)));
                }
            }
        }

        log.debug("Organization pass: {} candidate repositories across {} organizations (cap {})",
                candidates.size(), organizations.size(), maxRepos);
        return countInBatches(username, candidates, since, maxRepos, pacing);
    }

    private List<GitHubRepo> listOrganizationRepositories(String organization, int limit) {
        try {
            return gitHubClient.listOrganizationRepositories(organization, limit);
        } catch (RuntimeException e) {
            log.warn("Error fetching repos for org {}: {}", organization, e.getMessage());
            return List.of();
        }
    }

    private PassResult countInBatches(String username,
                                      List<RepositoryTarget> candidates,
                                      Instant since,
                                      int maxContributing,
                                      Pacing pacing) {
        int commits = 0;
        int contributing = 0;
        int examined = 0;
        int batchSize = pacing.batchSize();

        for (int i = 0; i < candidates.size() && contributing < maxContributing; i += batchSize) {
            List<RepositoryTarget> batch = candidates.subList(i, Math.min(i + batchSize, candidates.size()));

            List<Integer> counts = runConcurrently(batch,
                    target -> commitCounter.countCommits(username, target.owner(), target.name(), since));
            examined += batch.size();

            for (int count : counts) {
                if (count > 0 && contributing < maxContributing) {
                    commits += count;
                    contributing++;
                }
            }

            if (i + batchSize < candidates.size() && contributing < maxContributing) {
                pause(pacing);
            }
        }

        return new PassResult(commits, contributing, examined);
    }

    private <T, R> List<R> runInBatches(List<T> items, Function<T, R> task, Pacing pacing) {
        List<R> results = new ArrayList<>(items.size());
        int batchSize = pacing.batchSize();
        for (int i = 0; i < items.size(); i += batchSize) {
            results.addAll(runConcurrently(items.subList(i, Math.min(i + batchSize, items.size())), task));
            if (i + batchSize < items.size()) {
                pause(pacing);
            }
        }
        return results;
    }

    /**
     * Run every task of one batch on the commit query pool and wait for all of them.
     * Results keep the input order.
     */
    private <T, R> List<R> runConcurrently(List<T> batch, Function<T, R> task) {
        List<CompletableFuture<R>> futures = batch.stream()
                .map(item -> submit(item, task))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    /**
     * The pool is shared by every aggregation in flight. A task it rejects runs on the calling thread.
     */
    private <T, R> CompletableFuture<R> submit(T item, Function<T, R> task) {
        try {
            return CompletableFuture.supplyAsync(() -> task.apply(item), commitQueryExecutor);
        } catch (RejectedExecutionException e) {
            log.debug("Commit query pool saturated, running {} inline", item);
            return CompletableFuture.completedFuture(task.apply(item));
        }
    }

    private void pause(Pacing pacing) {
        try {
            sleeper.sleep(pacing.pauseBetweenBatches());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted between commit query batches", e);
        }
    }

    private static boolean isCandidate(GitHubRepo repo, Instant since, List<String> excludedRepos) {
        return !excludedRepos.contains(repo.name()) && !repo.updatedAt().isBefore(since);
    }

    private record RepositoryTarget(String owner, String name) {

        static RepositoryTarget of(GitHubRepo repo, String listedUnder) {
            return new RepositoryTarget(Objects.requireNonNullElse(repo.ownerLogin(), listedUnder), repo.name());
        }
    }

    private record Pacing(int batchSize, Duration pauseBetweenBatches) {
    }

    private record PassResult(int commits, int contributing, int examined) {
        static final PassResult EMPTY = new PassResult(0, 0, 0);
    }
}
