package com.purchasingpower.genki.service.impl;

import com.purchasingpower.genki.client.GitHubClient;
import com.purchasingpower.genki.configuration.AppProperties;
import com.purchasingpower.genki.configuration.AsyncConfig;
import com.purchasingpower.genki.model.AggregationResult;
import com.purchasingpower.genki.model.github.GitHubAccount;
import com.purchasingpower.genki.model.github.GitHubCommit;
import com.purchasingpower.genki.model.github.GitHubRepo;
import com.purchasingpower.genki.service.RepositoryCommitCounter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Aggregation on real thread pools: batch parallelism, batch boundaries and a
 * saturated shared commit query pool.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Activity Aggregation Concurrency Tests")
class ActivityAggregationConcurrencyTest {

    private static final String USER = "octocat";
    private static final Instant NOW = Instant.parse("2024-03-15T00:00:00Z");
    private static final Instant RECENT = Instant.parse("2024-03-14T00:00:00Z");
    private static final int AUTHENTICATED_BATCH_SIZE = 5;

    @Mock
    private GitHubClient gitHubClient;

    private AppProperties props;
    private final List<ExecutorService> pools = new ArrayList<>();
    private ThreadPoolTaskExecutor commitQueryExecutor;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        props.getMonitoring().setUsername(USER);
        props.getGithub().setToken("ghp_secret");
    }

    @AfterEach
    void tearDown() {
        pools.forEach(ExecutorService::shutdownNow);
        if (commitQueryExecutor != null) {
            commitQueryExecutor.shutdown();
        }
    }

    private ActivityAggregationServiceImpl serviceOn(Executor executor) {
        return new ActivityAggregationServiceImpl(
                gitHubClient,
                new RepositoryCommitCounter(gitHubClient),
                props,
                Clock.fixed(NOW, ZoneOffset.UTC),
                wait -> { },
                executor);
    }

    private ExecutorService newPool(int threads) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        pools.add(pool);
        return pool;
    }

    private static List<GitHubRepo> recentRepos(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new GitHubRepo("repo-" + i, RECENT, new GitHubAccount(USER)))
                .toList();
    }

    private static List<GitHubCommit> oneCommit() {
        return List.of(new GitHubCommit(
                new GitHubAccount(USER),
                new GitHubCommit.Detail(new GitHubCommit.GitIdentity("The Octocat", "octocat@example.com")),
                List.of(new GitHubCommit.Parent("p"))));
    }

    @Test
    @DisplayName("Queries of one batch run together and the next batch waits for all of them")
    void testBatchRunsInParallelAndBatchesDoNotOverlap() {
        // Given: every query blocks until a full batch has arrived
        CyclicBarrier fullBatch = new CyclicBarrier(AUTHENTICATED_BATCH_SIZE);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        when(gitHubClient.listOwnedRepositories(USER)).thenReturn(recentRepos(2 * AUTHENTICATED_BATCH_SIZE));
        when(gitHubClient.listCommits(eq(USER), anyString(), eq(USER), any(Instant.class))).thenAnswer(invocation -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                fullBatch.await(5, TimeUnit.SECONDS);
                return oneCommit();
            } finally {
                inFlight.decrementAndGet();
            }
        });

        // When: the pool has room for more than one batch
        AggregationResult result = serviceOn(newPool(2 * AUTHENTICATED_BATCH_SIZE)).aggregate(USER);

        // Then: a sequential run would time out at the barrier
        assertEquals(new AggregationResult(10, 10, 0), result);
        assertEquals(AUTHENTICATED_BATCH_SIZE, maxInFlight.get());
    }

    @Test
    @DisplayName("Concurrent aggregations survive a saturated commit query pool")
    void testSaturatedPoolDoesNotAbortAggregation() throws Exception {
        // Given: the production pool and 16 aggregations of 20 slow repositories each
        commitQueryExecutor = (ThreadPoolTaskExecutor) new AsyncConfig().commitQueryExecutor();
        when(gitHubClient.listOwnedRepositories(USER)).thenReturn(recentRepos(20));
        when(gitHubClient.listCommits(eq(USER), anyString(), eq(USER), any(Instant.class))).thenAnswer(invocation -> {
            Thread.sleep(50);
            return oneCommit();
        });
        ActivityAggregationServiceImpl service = serviceOn(commitQueryExecutor);

        // When
        ExecutorService callers = newPool(16);
        List<Future<AggregationResult>> runs = IntStream.range(0, 16)
                .mapToObj(i -> callers.submit(() -> service.aggregate(USER)))
                .toList();

        // Then
        for (Future<AggregationResult> run : runs) {
            assertEquals(new AggregationResult(20, 20, 0), run.get(60, TimeUnit.SECONDS));
        }
    }
}
