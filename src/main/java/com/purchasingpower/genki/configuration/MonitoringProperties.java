package com.purchasingpower.genki.configuration;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * What to monitor and how to score it.
 *
 * <p>Bound from {@code app.monitoring}. Every value can be supplied through the
 * environment variables listed in application.yml.
 */
@Data
public class MonitoringProperties {

    /**
     * GitHub login of the monitored user. Left optional on purpose so the
     * health endpoint can report an unconfigured service instead of failing startup.
     */
    private String username;

    @Min(0)
    private int healthyThreshold = 15;

    @Min(0)
    private int moderateThreshold = 5;

    @Min(1)
    private int monitoringDays = 14;

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration cacheTtl = Duration.ofSeconds(86400);

    /**
     * Hour of day (UTC+9) after which a snapshot from a previous day is refreshed.
     */
    @Min(0)
    @Max(23)
    private int refreshHour = 8;

    private boolean includeOrgRepos = false;

    @Min(1)
    private int maxReposPerOrg = 5;

    @NotNull
    private List<String> excludeRepos = new ArrayList<>(List.of("dotfiles"));

    @NotNull
    private List<String> excludeOrgs = new ArrayList<>();

    public boolean isConfigured() {
        return username != null && !username.isBlank();
    }

    @AssertTrue(message = "healthy-threshold must be greater than moderate-threshold")
    public boolean isThresholdOrderValid() {
        return healthyThreshold > moderateThreshold;
    }
}
