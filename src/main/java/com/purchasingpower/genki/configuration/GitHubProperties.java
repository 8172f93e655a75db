package com.purchasingpower.genki.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class GitHubProperties {

    @NotBlank
    private String baseUrl = "https://api.github.com";

    @NotBlank
    private String userAgent = "Am-I-Genki-Badge-Service";

    /**
     * Optional personal access token. Blank means unauthenticated access,
     * which gets the provider's stricter rate limit.
     */
    private String token;

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(10);

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }
}
