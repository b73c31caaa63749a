package com.mainforce.auction.model;

import java.util.Locale;

/**
 * Trading-day character derived from the rolling window. NEUTRAL is the fallback when the window
 * does not cover enough history.
 */
public enum MarketRegime {
    NEUTRAL("neutral"),
    CALM("calm"),
    ACTIVE("active"),
    VOLATILE("volatile");

    private final String label;

    MarketRegime(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static MarketRegime fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return NEUTRAL;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (MarketRegime regime : values()) {
            if (regime.label.equals(target)) {
                return regime;
            }
        }
        return NEUTRAL;
    }
}
