package com.purchasingpower.genki.model;

/**
 * Visual styles accepted by the badge endpoint. Names follow the shields.io convention.
 */
public enum BadgeStyle {
    FLAT("flat"),
    FLAT_SQUARE("flat-square"),
    PLASTIC("plastic"),
    FOR_THE_BADGE("for-the-badge"),
    SOCIAL("social");

    private final String paramValue;

    BadgeStyle(String paramValue) {
        this.paramValue = paramValue;
    }

    /**
     * Resolve a query parameter. Missing or unknown names fall back to {@link #FLAT}.
     */
    public static BadgeStyle fromParam(String param) {
        if (param == null) {
            return FLAT;
        }
        for (BadgeStyle style : values()) {
            if (style.paramValue.equals(param)) {
                return style;
            }
        }
        return FLAT;
    }
}
