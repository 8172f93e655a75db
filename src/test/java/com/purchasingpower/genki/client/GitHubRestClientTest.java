package com.purchasingpower.genki.client;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.purchasingpower.genki.config.GlobalRetryConfig;
import com.purchasingpower.genki.configuration.AppProperties;
import com.purchasingpower.genki.model.github.GitHubCommit;
import com.purchasingpower.genki.model.github.GitHubOrg;
import com.purchasingpower.genki.model.github.GitHubRepo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GitHub REST Client Parsing Tests")
class GitHubRestClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private GitHubRestClient clientReturning(HttpStatus status, String body) {
        AppProperties props = new AppProperties();
        props.getGithub().setBaseUrl("http://github.test");
        GlobalRetryConfig retryConfig = new GlobalRetryConfig();

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        });
        GitHubFetchClient fetchClient = new GitHubFetchClient(builder, props, retryConfig, wait -> { });
        return new GitHubRestClient(fetchClient, retryConfig, JsonMapper.builder().findAndAddModules().build());
    }

    @Test
    @DisplayName("Should parse owned repositories and drop malformed entries")
    void testListOwnedRepositories() {
        // Given
        String body = """
                [
                  {"name": "hello-world", "updated_at": "2024-03-10T12:00:00Z", "owner": {"login": "octocat"}, "fork": false},
                  {"name": "no-date"},
                  null,
                  {"updated_at": "2024-03-10T12:00:00Z"}
                ]
                """;
        GitHubRestClient client = clientReturning(HttpStatus.OK, body);

        // When
        List<GitHubRepo> repos = client.listOwnedRepositories("octocat");

        // Then
        assertThat(repos).extracting(GitHubRepo::name).containsExactly("hello-world");
        assertThat(repos.get(0).updatedAt()).isEqualTo(Instant.parse("2024-03-10T12:00:00Z"));
        assertThat(repos.get(0).ownerLogin()).isEqualTo("octocat");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/users/octocat/repos");
        assertThat(requests.get(0).url().getQuery()).contains("type=owner", "sort=updated", "per_page=30");
    }

    @Test
    @DisplayName("Should treat a non-list payload as empty")
    void testMalformedPayload_ShouldBeEmpty() {
        GitHubRestClient client = clientReturning(HttpStatus.OK, "{\"message\": \"weird\"}");

        assertThat(client.listOrganizations("octocat")).isEmpty();
    }

    @Test
    @DisplayName("Should treat a non-success status as empty")
    void testNotFound_ShouldBeEmpty() {
        GitHubRestClient client = clientReturning(HttpStatus.NOT_FOUND, "{\"message\": \"Not Found\"}");

        assertThat(client.listOrganizationRepositories("acme", 5)).isEmpty();
    }

    @Test
    @DisplayName("Should parse organizations and skip entries without login")
    void testListOrganizations() {
        GitHubRestClient client = clientReturning(HttpStatus.OK, "[{\"login\": \"acme\"}, {\"id\": 7}]");

        assertThat(client.listOrganizations("octocat")).extracting(GitHubOrg::login).containsExactly("acme");
    }

    @Test
    @DisplayName("Should request commits by author since the window start")
    void testListCommits() {
        // Given
        String body = """
                [
                  {
                    "sha": "abc",
                    "author": {"login": "octocat"},
                    "commit": {"author": {"name": "The Octocat", "email": "octocat@example.com"}},
                    "parents": [{"sha": "p1"}, {"sha": "p2"}]
                  }
                ]
                """;
        GitHubRestClient client = clientReturning(HttpStatus.OK, body);

        // When
        List<GitHubCommit> commits = client.listCommits("octocat", "hello-world", "octocat",
                Instant.parse("2024-03-01T00:00:00.123Z"));

        // Then
        assertThat(commits).hasSize(1);
        assertThat(commits.get(0).parentCount()).isEqualTo(2);
        assertThat(commits.get(0).authorEmail()).isEqualTo("octocat@example.com");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/repos/octocat/hello-world/commits");
        assertThat(requests.get(0).url().getQuery()).contains("author=octocat", "per_page=100", "since=2024-03-01T00");
        assertThat(requests.get(0).url().getQuery()).doesNotContain(".123");
    }
}
