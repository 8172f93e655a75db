package com.purchasingpower.genki.model;

/**
 * Enumeration of external services for unified call logging.
 *
 * @see com.purchasingpower.genki.util.ExternalCallLogger
 */
public enum ServiceType {
    GITHUB("🐙", "GitHub");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
