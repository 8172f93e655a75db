package com.purchasingpower.genki.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health tier derived from the commit count of the monitoring window.
 *
 * <p>Ordered from most to least active. Each tier also carries what the badge
 * shows for it.
 */
public enum HealthStatus {

    HEALTHY("healthy", "brightgreen", "元気", "😎"),
    MODERATE("moderate", "yellow", "いまいち", "😑"),
    INACTIVE("inactive", "red", "元気ない", "🙁");

    private final String value;
    private final String color;
    private final String text;
    private final String emoji;

    HealthStatus(String value, String color, String text, String emoji) {
        this.value = value;
        this.color = color;
        this.text = text;
        this.emoji = emoji;
    }

    /**
     * Classify a commit count. Both thresholds are inclusive lower bounds.
     *
     * @param commits qualifying commits in the window
     * @param healthyThreshold minimum count for {@link #HEALTHY}
     * @param moderateThreshold minimum count for {@link #MODERATE}
     * @return the tier
     */
    public static HealthStatus classify(int commits, int healthyThreshold, int moderateThreshold) {
        if (commits >= healthyThreshold) {
            return HEALTHY;
        }
        if (commits >= moderateThreshold) {
            return MODERATE;
        }
        return INACTIVE;
    }

    @JsonCreator
    public static HealthStatus fromValue(String value) {
        for (HealthStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + value);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getColor() {
        return color;
    }

    public String getText() {
        return text;
    }

    public String getEmoji() {
        return emoji;
    }
}
