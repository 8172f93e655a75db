package com.purchasingpower.genki.service;

import com.purchasingpower.genki.model.BadgeStyle;
import com.purchasingpower.genki.model.HealthStatus;

/**
 * Renders the activity badge as SVG.
 */
public interface BadgeRenderer {

    String LABEL = "Am I Genki?";

    String render(HealthStatus status, int commits, BadgeStyle style);
}
