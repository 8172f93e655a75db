package com.purchasingpower.genki.service.impl;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.genki.model.BadgeStyle;
import com.purchasingpower.genki.model.HealthStatus;
import com.purchasingpower.genki.service.BadgeRenderer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.StringWriter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Shields-style SVG badge rendered from {@code classpath:badges/badge.svg.mustache}.
 *
 * Text widths are estimated per code point; the badge is sized from them so the
 * emoji and Japanese status texts fit without a font metrics table.
 */
@Slf4j
@Service
public class MustacheBadgeRenderer implements BadgeRenderer {

    private static final String TEMPLATE = "badge.svg.mustache";
    private static final String LABEL_BACKGROUND = "#555";
    private static final int HORIZONTAL_PADDING = 10;

    private static final Map<String, String> COLORS = Map.of(
            "brightgreen", "#4c1",
            "yellow", "#dfb317",
            "red", "#e05d44");

    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory("badges");

    private Mustache template;

    @PostConstruct
    public void loadTemplate() {
        this.template = mustacheFactory.compile(TEMPLATE);
        log.info("Loaded badge template: {}", TEMPLATE);
    }

    @Override
    public String render(HealthStatus status, int commits, BadgeStyle style) {
        StyleSpec spec = StyleSpec.of(style);

        String label = spec.uppercase() ? LABEL.toUpperCase(Locale.ROOT) : LABEL;
        String message = status.getEmoji() + " " + status.getText() + " (" + commits + ")";
        if (spec.uppercase()) {
            message = message.toUpperCase(Locale.ROOT);
        }

        int labelWidth = textWidth(label, spec) + 2 * HORIZONTAL_PADDING;
        int messageWidth = textWidth(message, spec) + 2 * HORIZONTAL_PADDING;

        Map<String, Object> scope = new HashMap<>();
        scope.put("label", label);
        scope.put("message", message);
        scope.put("width", labelWidth + messageWidth);
        scope.put("height", spec.height());
        scope.put("radius", spec.radius());
        scope.put("gradient", spec.gradient());
        scope.put("labelWidth", labelWidth);
        scope.put("messageWidth", messageWidth);
        scope.put("labelX", labelWidth / 2.0);
        scope.put("messageX", labelWidth + messageWidth / 2.0);
        scope.put("textY", spec.height() / 2 + spec.fontSize() / 2 - 1);
        scope.put("fontSize", spec.fontSize());
        scope.put("fontWeight", spec.bold() ? "bold" : "normal");
        scope.put("labelColor", spec.social() ? "#fcfcfc" : LABEL_BACKGROUND);
        scope.put("messageColor", spec.social() ? "#fff" : COLORS.getOrDefault(status.getColor(), "#9f9f9f"));
        scope.put("labelTextColor", spec.social() ? "#333" : "#fff");
        scope.put("messageTextColor", spec.social() ? "#333" : "#fff");
        scope.put("border", spec.social());

        StringWriter writer = new StringWriter();
        template.execute(writer, scope);
        return writer.toString();
    }

    private static int textWidth(String text, StyleSpec spec) {
        return text.codePoints()
                .map(cp -> isWide(cp) ? spec.wideCharWidth() : spec.charWidth())
                .sum();
    }

    // CJK, full-width forms and emoji render roughly twice as wide as Latin text
    private static boolean isWide(int codePoint) {
        return codePoint >= 0x2E80;
    }

    private record StyleSpec(int height, int radius, boolean gradient, int fontSize, boolean bold,
                             boolean uppercase, boolean social, int charWidth, int wideCharWidth) {

        static StyleSpec of(BadgeStyle style) {
            return switch (style) {
                case FLAT -> new StyleSpec(20, 3, true, 11, false, false, false, 7, 13);
                case FLAT_SQUARE -> new StyleSpec(20, 0, false, 11, false, false, false, 7, 13);
                case PLASTIC -> new StyleSpec(18, 4, true, 11, false, false, false, 7, 13);
                case FOR_THE_BADGE -> new StyleSpec(28, 0, false, 10, true, true, false, 9, 14);
                case SOCIAL -> new StyleSpec(20, 2, true, 11, true, false, true, 7, 13);
            };
        }
    }
}
